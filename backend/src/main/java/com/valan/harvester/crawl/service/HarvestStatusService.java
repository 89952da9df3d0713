package com.valan.harvester.crawl.service;

import com.valan.harvester.crawl.model.StatusResponse;
import com.valan.harvester.crawl.persistence.HarvestRunRepository;
import com.valan.harvester.crawl.persistence.PublicationStore;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class HarvestStatusService {
    private final PublicationStore store;
    private final HarvestRunRepository runRepository;
    private final HarvestOrchestratorService orchestratorService;

    public HarvestStatusService(
        PublicationStore store,
        HarvestRunRepository runRepository,
        HarvestOrchestratorService orchestratorService
    ) {
        this.store = store;
        this.runRepository = runRepository;
        this.orchestratorService = orchestratorService;
    }

    public StatusResponse getStatus() {
        boolean dbConnectivity = store.isReachable();
        if (!dbConnectivity) {
            return new StatusResponse(false, orchestratorService.isRunActive(), Map.of(), 0L, null);
        }
        return new StatusResponse(
            true,
            orchestratorService.isRunActive(),
            runRepository.tableCounts(),
            store.maxKnownId(),
            runRepository.findMostRecentRun()
        );
    }
}
