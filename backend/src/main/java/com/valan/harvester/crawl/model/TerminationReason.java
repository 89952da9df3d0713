package com.valan.harvester.crawl.model;

public enum TerminationReason {
    NO_NEW_DATA,
    RANGE_EXHAUSTED,
    MISS_CEILING,
    CANCELLED
}
