package com.valan.harvester.crawl.api;

public record HarvestApiRunRequest(
    String mode,
    Long startId,
    Long endId,
    Boolean updateExisting,
    Integer missCeiling
) {
}
