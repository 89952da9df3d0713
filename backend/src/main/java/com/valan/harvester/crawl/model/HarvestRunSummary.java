package com.valan.harvester.crawl.model;

import java.time.Instant;

public record HarvestRunSummary(
    long harvestRunId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    HarvestMode mode,
    TerminationReason terminationReason,
    Long startId,
    Long lowerBound,
    HarvestStats stats
) {}
