package com.valan.harvester.crawl.model;

public enum HarvestMode {
    /** Newest registry ID down to the highest ID already stored. */
    INCREMENTAL,
    /** Explicit start and end IDs, both inclusive. */
    RANGE
}
