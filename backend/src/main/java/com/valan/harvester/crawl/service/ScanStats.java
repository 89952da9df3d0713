package com.valan.harvester.crawl.service;

import com.valan.harvester.crawl.model.HarvestStats;

/**
 * Mutable counters for one scan. Only the scanning thread writes them; readers get a
 * {@link HarvestStats} snapshot.
 */
class ScanStats {
    int checked;
    int found;
    int tenders;
    int awards;
    int enriched;
    int dbErrors;
    int notFound;
    int transientErrors;
    int skipped;

    HarvestStats snapshot() {
        return new HarvestStats(
            checked,
            found,
            tenders,
            awards,
            enriched,
            dbErrors,
            notFound,
            transientErrors,
            skipped
        );
    }
}
