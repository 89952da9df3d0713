package com.valan.harvester.crawl.model;

import java.util.Map;

public record PromotionSummary(
    boolean dryRun,
    Map<String, Long> sourceCounts,
    Map<String, Long> promoted) {}
