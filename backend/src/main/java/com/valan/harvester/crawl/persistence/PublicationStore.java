package com.valan.harvester.crawl.persistence;

import com.valan.harvester.crawl.model.AwardEnrichment;
import com.valan.harvester.crawl.model.PublicationRecord;

/**
 * Persistence boundary the scanner works against. Upserts are idempotent per
 * {@code (source, id)} and report failure as {@code false} instead of throwing.
 */
public interface PublicationStore {

    /** Highest stored publication ID across tenders and awards, {@code 0} when empty. */
    long maxKnownId();

    boolean exists(long id);

    boolean upsertTender(PublicationRecord record);

    /**
     * Stores an award. Supplier fields already on the row are kept when the new
     * enrichment has no value for them.
     */
    boolean upsertAward(PublicationRecord record, AwardEnrichment enrichment);

    boolean isReachable();
}
