package com.valan.harvester.crawl.model;

public record ScanResult(
    TerminationReason reason,
    long startId,
    long lowerBound,
    long lastVisitedId,
    HarvestStats stats
) {}
