package com.valan.harvester.crawl.service;

import com.valan.harvester.config.HarvesterProperties;
import com.valan.harvester.crawl.model.HarvestRunRequest;
import com.valan.harvester.crawl.model.HarvestRunSummary;
import com.valan.harvester.crawl.model.PromotionRequest;
import com.valan.harvester.crawl.model.PromotionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class HarvestCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(HarvestCliRunner.class);

    private final HarvesterProperties properties;
    private final HarvestOrchestratorService orchestratorService;
    private final PromotionService promotionService;
    private final ConfigurableApplicationContext applicationContext;

    public HarvestCliRunner(
        HarvesterProperties properties,
        HarvestOrchestratorService orchestratorService,
        PromotionService promotionService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.promotionService = promotionService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        HarvesterProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        HarvestRunRequest request = buildRequest(cli);
        HarvestRunSummary summary = orchestratorService.run(request);
        log.info(
            "Harvest run {} completed with status {} ({})",
            summary.harvestRunId(),
            summary.status(),
            summary.terminationReason()
        );

        boolean failed = HarvestOrchestratorService.STATUS_FAILED.equals(summary.status());
        if (cli.isPromoteAfterRun() && !failed) {
            PromotionSummary promotion = promotionService.promote(new PromotionRequest(null, null, false));
            log.info("Promoted after run: {}", promotion.promoted());
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> failed ? 1 : 0);
            System.exit(exitCode);
        }
    }

    HarvestRunRequest buildRequest(HarvesterProperties.Cli cli) {
        String mode = cli.getMode() == null ? "incremental" : cli.getMode().trim().toLowerCase(Locale.ROOT);
        if ("range".equals(mode)) {
            return HarvestRunRequest.range(
                cli.getStartId(),
                cli.getEndId(),
                properties.getScan().isUpdateExisting()
            );
        }
        if (!"incremental".equals(mode)) {
            log.warn("Unknown harvest mode '{}', running incremental", cli.getMode());
        }
        return HarvestRunRequest.incremental();
    }
}
