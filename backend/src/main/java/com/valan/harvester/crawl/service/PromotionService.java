package com.valan.harvester.crawl.service;

import com.valan.harvester.config.HarvesterProperties;
import com.valan.harvester.crawl.model.PromotionRequest;
import com.valan.harvester.crawl.model.PromotionSummary;
import com.valan.harvester.crawl.persistence.PromotionJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class PromotionService {
    private static final Logger log = LoggerFactory.getLogger(PromotionService.class);
    static final String TENDER_TABLE = "registry_tenders";
    static final String AWARD_TABLE = "registry_awards";

    private final PromotionJdbcRepository repository;
    private final HarvestOrchestratorService orchestratorService;
    private final HarvesterProperties properties;

    public PromotionService(
        PromotionJdbcRepository repository,
        HarvestOrchestratorService orchestratorService,
        HarvesterProperties properties
    ) {
        this.repository = repository;
        this.orchestratorService = orchestratorService;
        this.properties = properties;
    }

    /**
     * Feeds staged rows to the master tables through the configured database functions.
     * A dry run only reports how many rows are waiting.
     */
    public PromotionSummary promote(PromotionRequest request) {
        PromotionRequest safe = request == null ? new PromotionRequest(null, null, null) : request;
        if (orchestratorService.isRunActive()) {
            throw new ActiveHarvestRunException("Promotion refused while a harvest run is in progress");
        }
        Map<String, Long> pending = new LinkedHashMap<>();
        Map<String, Long> promoted = new LinkedHashMap<>();
        HarvesterProperties.Promotion promotion = properties.getPromotion();
        if (safe.includeTenders()) {
            pending.put(TENDER_TABLE, repository.countPending(TENDER_TABLE));
            if (!safe.isDryRun()) {
                promoted.put(TENDER_TABLE, repository.callFeedFunction(promotion.getTenderFunction()));
            }
        }
        if (safe.includeAwards()) {
            pending.put(AWARD_TABLE, repository.countPending(AWARD_TABLE));
            if (!safe.isDryRun()) {
                promoted.put(AWARD_TABLE, repository.callFeedFunction(promotion.getAwardFunction()));
            }
        }
        log.info("Promotion {}: pending={} promoted={}", safe.isDryRun() ? "dry run" : "done", pending, promoted);
        return new PromotionSummary(safe.isDryRun(), pending, promoted);
    }
}
