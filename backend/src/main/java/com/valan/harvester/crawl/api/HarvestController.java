package com.valan.harvester.crawl.api;

import com.valan.harvester.crawl.model.HarvestMode;
import com.valan.harvester.crawl.model.HarvestRunRequest;
import com.valan.harvester.crawl.model.HarvestRunSummary;
import com.valan.harvester.crawl.model.PromotionRequest;
import com.valan.harvester.crawl.model.PromotionSummary;
import com.valan.harvester.crawl.model.StatusResponse;
import com.valan.harvester.crawl.service.HarvestOrchestratorService;
import com.valan.harvester.crawl.service.HarvestStatusService;
import com.valan.harvester.crawl.service.PromotionService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class HarvestController {
    private final HarvestOrchestratorService orchestratorService;
    private final HarvestStatusService statusService;
    private final PromotionService promotionService;

    public HarvestController(
        HarvestOrchestratorService orchestratorService,
        HarvestStatusService statusService,
        PromotionService promotionService
    ) {
        this.orchestratorService = orchestratorService;
        this.statusService = statusService;
        this.promotionService = promotionService;
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return statusService.getStatus();
    }

    @PostMapping("/harvest/run")
    public HarvestRunSummary runHarvest(@RequestBody(required = false) HarvestApiRunRequest request) {
        return orchestratorService.run(toRunRequest(request));
    }

    @PostMapping("/harvest/start")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> startHarvest(@RequestBody(required = false) HarvestApiRunRequest request) {
        long harvestRunId = orchestratorService.startAsync(toRunRequest(request));
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("harvestRunId", harvestRunId);
        response.put("status", HarvestOrchestratorService.STATUS_RUNNING);
        return response;
    }

    @PostMapping("/harvest/cancel")
    public Map<String, Object> cancelHarvest() {
        return Map.of("cancelRequested", orchestratorService.cancel());
    }

    @PostMapping("/promotion/run")
    public PromotionSummary runPromotion(@RequestBody(required = false) PromotionRequest request) {
        return promotionService.promote(request);
    }

    HarvestRunRequest toRunRequest(HarvestApiRunRequest request) {
        if (request == null) {
            return HarvestRunRequest.incremental();
        }
        HarvestMode mode = parseMode(request.mode());
        if (mode == HarvestMode.RANGE) {
            if (request.startId() == null || request.endId() == null) {
                throw new ResponseStatusException(BAD_REQUEST, "range mode needs startId and endId");
            }
            if (request.endId() < 1 || request.startId() < request.endId()) {
                throw new ResponseStatusException(BAD_REQUEST, "startId must be >= endId >= 1");
            }
        }
        return new HarvestRunRequest(
            mode,
            request.startId(),
            request.endId(),
            request.updateExisting(),
            request.missCeiling()
        );
    }

    private HarvestMode parseMode(String raw) {
        if (raw == null || raw.isBlank()) {
            return HarvestMode.INCREMENTAL;
        }
        try {
            return HarvestMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(BAD_REQUEST, "Unknown mode: " + raw);
        }
    }
}
