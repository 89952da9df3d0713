package com.valan.harvester.crawl.model;

public record PromotionRequest(Boolean tenders, Boolean awards, Boolean dryRun) {

    public boolean includeTenders() {
        return tenders == null ? awards == null || !awards : tenders;
    }

    public boolean includeAwards() {
        return awards == null ? tenders == null || !tenders : awards;
    }

    public boolean isDryRun() {
        return dryRun != null && dryRun;
    }
}
