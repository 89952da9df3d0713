package com.valan.harvester.crawl.model;

public record HarvestStats(
    int checked,
    int found,
    int tenders,
    int awards,
    int enriched,
    int dbErrors,
    int notFound,
    int transientErrors,
    int skipped
) {
    public static final HarvestStats EMPTY = new HarvestStats(0, 0, 0, 0, 0, 0, 0, 0, 0);
}
