package com.valan.harvester.crawl.service;

import com.valan.harvester.crawl.model.HarvestMode;
import com.valan.harvester.crawl.model.HarvestRunRequest;
import com.valan.harvester.crawl.model.HarvestRunSummary;
import com.valan.harvester.crawl.model.HarvestStats;
import com.valan.harvester.crawl.model.ScanResult;
import com.valan.harvester.crawl.model.TerminationReason;
import com.valan.harvester.crawl.persistence.HarvestRunRepository;
import com.valan.harvester.crawl.persistence.PublicationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the lifecycle of harvest runs: one active run at a time, a {@code harvest_runs}
 * row per run, cooperative cancellation and the end-of-run summary.
 */
@Service
public class HarvestOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(HarvestOrchestratorService.class);

    public static final String STATUS_RUNNING = "RUNNING";
    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_NO_NEW_DATA = "NO_NEW_DATA";
    public static final String STATUS_STOPPED_MISS_CEILING = "STOPPED_MISS_CEILING";
    public static final String STATUS_CANCELLED = "CANCELLED";
    public static final String STATUS_FAILED = "FAILED";

    private final IdRangeScanner scanner;
    private final PublicationStore store;
    private final HarvestRunRepository runRepository;
    private final ExecutorService harvestRunExecutor;
    private final AtomicBoolean active = new AtomicBoolean(false);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    public HarvestOrchestratorService(
        IdRangeScanner scanner,
        PublicationStore store,
        HarvestRunRepository runRepository,
        @Qualifier("harvestRunExecutor") ExecutorService harvestRunExecutor
    ) {
        this.scanner = scanner;
        this.store = store;
        this.runRepository = runRepository;
        this.harvestRunExecutor = harvestRunExecutor;
    }

    public HarvestRunSummary run(HarvestRunRequest request) {
        acquire();
        try {
            ensureDatabaseReachable();
            Instant startedAt = Instant.now();
            long harvestRunId = runRepository.insertHarvestRun(
                startedAt,
                STATUS_RUNNING,
                request.effectiveMode(),
                "harvest started"
            );
            return runWithId(harvestRunId, startedAt, request);
        } finally {
            active.set(false);
        }
    }

    public long startAsync(HarvestRunRequest request) {
        acquire();
        long harvestRunId;
        Instant startedAt = Instant.now();
        try {
            ensureDatabaseReachable();
            harvestRunId = runRepository.insertHarvestRun(
                startedAt,
                STATUS_RUNNING,
                request.effectiveMode(),
                "harvest started"
            );
            harvestRunExecutor.submit(() -> {
                try {
                    runWithId(harvestRunId, startedAt, request);
                } finally {
                    active.set(false);
                }
            });
        } catch (RuntimeException e) {
            active.set(false);
            throw e;
        }
        return harvestRunId;
    }

    /** Asks the active run to stop after the ID it is working on. */
    public boolean cancel() {
        if (!active.get()) {
            return false;
        }
        cancelRequested.set(true);
        log.info("Cancellation requested for the active harvest run");
        return true;
    }

    public boolean isRunActive() {
        return active.get();
    }

    private void acquire() {
        if (!active.compareAndSet(false, true)) {
            throw new ActiveHarvestRunException("A harvest run is already in progress");
        }
        cancelRequested.set(false);
    }

    private void ensureDatabaseReachable() {
        if (!store.isReachable()) {
            throw new IllegalStateException("Database not reachable; harvest not started");
        }
    }

    private HarvestRunSummary runWithId(long harvestRunId, Instant startedAt, HarvestRunRequest request) {
        HarvestMode mode = request.effectiveMode();
        String status = STATUS_FAILED;
        String notes = "harvest_failed";
        ScanResult result = null;
        Instant finishedAt;
        try {
            result = scanner.scan(request, cancelRequested::get);
            status = statusFor(result.reason());
            notes = "reason=" + result.reason();
        } catch (Exception e) {
            log.warn("Harvest run {} failed", harvestRunId, e);
            notes = "exception=" + e.getClass().getSimpleName();
        } finally {
            finishedAt = Instant.now();
            runRepository.completeHarvestRun(
                harvestRunId,
                finishedAt,
                status,
                result == null ? null : result.startId(),
                result == null ? null : result.lowerBound(),
                result == null ? null : result.lastVisitedId(),
                result == null ? null : result.reason(),
                result == null ? HarvestStats.EMPTY : result.stats(),
                notes
            );
        }
        HarvestRunSummary summary = new HarvestRunSummary(
            harvestRunId,
            startedAt,
            finishedAt,
            status,
            mode,
            result == null ? null : result.reason(),
            result == null ? null : result.startId(),
            result == null ? null : result.lowerBound(),
            result == null ? HarvestStats.EMPTY : result.stats()
        );
        logSummary(summary);
        return summary;
    }

    static String statusFor(TerminationReason reason) {
        return switch (reason) {
            case NO_NEW_DATA -> STATUS_NO_NEW_DATA;
            case RANGE_EXHAUSTED -> STATUS_COMPLETED;
            case MISS_CEILING -> STATUS_STOPPED_MISS_CEILING;
            case CANCELLED -> STATUS_CANCELLED;
        };
    }

    private void logSummary(HarvestRunSummary summary) {
        HarvestStats stats = summary.stats();
        log.info(
            "Harvest run {} finished: status={} mode={} reason={} checked={} found={} tenders={} awards={} enriched={}"
                + " notFound={} transientErrors={} dbErrors={} skipped={} duration={}s",
            summary.harvestRunId(),
            summary.status(),
            summary.mode(),
            summary.terminationReason(),
            stats.checked(),
            stats.found(),
            stats.tenders(),
            stats.awards(),
            stats.enriched(),
            stats.notFound(),
            stats.transientErrors(),
            stats.dbErrors(),
            stats.skipped(),
            Duration.between(summary.startedAt(), summary.finishedAt()).toSeconds()
        );
    }
}
