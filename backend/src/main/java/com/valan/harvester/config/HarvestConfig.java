package com.valan.harvester.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.valan.harvester.crawl.classify.NoticeClassifier;
import com.valan.harvester.crawl.extract.AwardDocumentExtractor;
import com.valan.harvester.crawl.extract.DocumentTextReader;
import com.valan.harvester.crawl.extract.ExtractionRuleSet;
import com.valan.harvester.crawl.extract.LocaleVocabulary;
import com.valan.harvester.crawl.http.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class HarvestConfig {

    @Bean(name = "harvestRunExecutor", destroyMethod = "shutdown")
    public ExecutorService harvestRunExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("harvest-run");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor() {
        return Executors.newFixedThreadPool(2);
    }

    @Bean
    public RateLimiter registryRateLimiter() {
        return new RateLimiter();
    }

    @Bean
    public LocaleVocabulary localeVocabulary() {
        return LocaleVocabulary.DUTCH;
    }

    @Bean
    public NoticeClassifier noticeClassifier(LocaleVocabulary vocabulary) {
        return new NoticeClassifier(vocabulary);
    }

    @Bean
    public AwardDocumentExtractor awardDocumentExtractor() {
        return new AwardDocumentExtractor(ExtractionRuleSet.dutch(), new DocumentTextReader());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
