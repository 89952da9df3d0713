package com.valan.harvester.crawl.model;

public record HarvestRunRequest(
    HarvestMode mode,
    Long startId,
    Long endId,
    Boolean updateExisting,
    Integer missCeiling
) {
    public static HarvestRunRequest incremental() {
        return new HarvestRunRequest(HarvestMode.INCREMENTAL, null, null, null, null);
    }

    public static HarvestRunRequest range(long startId, long endId, boolean updateExisting) {
        return new HarvestRunRequest(HarvestMode.RANGE, startId, endId, updateExisting, null);
    }

    public HarvestMode effectiveMode() {
        return mode == null ? HarvestMode.INCREMENTAL : mode;
    }
}
