package com.valan.harvester.crawl.model;

import java.time.Instant;

public record HarvestRunMeta(
    long harvestRunId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    String mode,
    Long startId,
    Long lowerBound,
    String terminationReason,
    String notes
) {}
