package com.valan.harvester.crawl.service;

import com.valan.harvester.config.HarvesterProperties;
import com.valan.harvester.crawl.classify.NoticeClassifier;
import com.valan.harvester.crawl.extract.AwardDocumentExtractor;
import com.valan.harvester.crawl.model.AwardEnrichment;
import com.valan.harvester.crawl.model.ExtractionResult;
import com.valan.harvester.crawl.model.FetchOutcome;
import com.valan.harvester.crawl.model.HarvestMode;
import com.valan.harvester.crawl.model.HarvestRunRequest;
import com.valan.harvester.crawl.model.NoticeCategory;
import com.valan.harvester.crawl.model.PublicationRecord;
import com.valan.harvester.crawl.model.ScanResult;
import com.valan.harvester.crawl.model.TerminationReason;
import com.valan.harvester.crawl.persistence.PublicationStore;
import com.valan.harvester.crawl.registry.RegistryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.function.BooleanSupplier;

/**
 * Walks the registry's ID space downward from a start ID to an exclusive lower bound,
 * one ID at a time. Stops early after too many consecutive misses or on cancellation.
 */
@Service
public class IdRangeScanner {
    private static final Logger log = LoggerFactory.getLogger(IdRangeScanner.class);

    private final RegistryClient registryClient;
    private final NoticeClassifier classifier;
    private final AwardDocumentExtractor extractor;
    private final PublicationStore store;
    private final HarvesterProperties properties;

    public IdRangeScanner(
        RegistryClient registryClient,
        NoticeClassifier classifier,
        AwardDocumentExtractor extractor,
        PublicationStore store,
        HarvesterProperties properties
    ) {
        this.registryClient = registryClient;
        this.classifier = classifier;
        this.extractor = extractor;
        this.store = store;
        this.properties = properties;
    }

    public ScanResult scan(HarvestRunRequest request, BooleanSupplier cancelled) {
        HarvestMode mode = request.effectiveMode();
        int missCeiling = request.missCeiling() == null
            ? properties.getScan().getMissCeiling()
            : Math.max(1, request.missCeiling());
        boolean updateExisting = request.updateExisting() == null
            ? properties.getScan().isUpdateExisting()
            : request.updateExisting();

        long startId;
        long lowerBound;
        if (mode == HarvestMode.RANGE) {
            if (request.startId() == null || request.endId() == null) {
                throw new IllegalArgumentException("Range harvest needs both startId and endId");
            }
            startId = request.startId();
            lowerBound = request.endId() - 1;
        } else {
            long maxKnown = store.maxKnownId();
            lowerBound = maxKnown > 0 ? maxKnown : properties.getScan().getInitialHighWaterMark();
            startId = registryClient.latestKnownId();
            if (startId <= lowerBound) {
                log.info("No new publications: latest={} highWaterMark={}", startId, lowerBound);
                return new ScanResult(TerminationReason.NO_NEW_DATA, startId, lowerBound, 0L, new ScanStats().snapshot());
            }
        }

        log.info(
            "Scanning IDs {} down to {} (mode={}, updateExisting={}, missCeiling={})",
            startId,
            lowerBound + 1,
            mode,
            updateExisting,
            missCeiling
        );
        ScanState state = new ScanState(startId, lowerBound);
        ScanStats stats = state.stats();
        Instant startedAt = Instant.now();
        int progressInterval = properties.getScan().getProgressLogInterval();

        while (state.hasNext()) {
            if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                log.info("Scan cancelled at ID {}", state.currentId());
                return result(TerminationReason.CANCELLED, startId, state);
            }
            long id = state.currentId();

            if (!updateExisting && store.exists(id)) {
                stats.skipped++;
                state.resetMisses();
                state.advance();
                continue;
            }

            FetchOutcome<PublicationRecord> outcome = registryClient.fetchPublication(id);
            stats.checked++;
            if (outcome.isMiss()) {
                if (outcome.status() == FetchOutcome.Status.NOT_FOUND) {
                    stats.notFound++;
                } else {
                    stats.transientErrors++;
                }
                int misses = state.recordMiss();
                state.advance();
                if (misses >= missCeiling) {
                    log.info("{} consecutive misses at ID {}, stopping", misses, id);
                    return result(TerminationReason.MISS_CEILING, startId, state);
                }
                continue;
            }

            state.resetMisses();
            stats.found++;
            store(outcome.value(), stats);
            state.advance();

            if (stats.found % progressInterval == 0) {
                logProgress(id, stats, startedAt);
            }
        }
        return result(TerminationReason.RANGE_EXHAUSTED, startId, state);
    }

    private void store(PublicationRecord record, ScanStats stats) {
        if (classifier.classify(record) == NoticeCategory.AWARD) {
            AwardEnrichment enrichment = enrich(record.id(), stats);
            if (store.upsertAward(record, enrichment)) {
                stats.awards++;
            } else {
                stats.dbErrors++;
            }
            return;
        }
        if (store.upsertTender(record)) {
            stats.tenders++;
        } else {
            stats.dbErrors++;
        }
    }

    private AwardEnrichment enrich(long id, ScanStats stats) {
        FetchOutcome<byte[]> document = registryClient.fetchDocument(id);
        if (!document.isFound()) {
            log.debug("No award document for {}: {}", id, document.status());
            return AwardEnrichment.EMPTY;
        }
        ExtractionResult extraction = extractor.extract(document.value());
        if (extraction.success()) {
            stats.enriched++;
            log.debug("{}: {} (KVK: {})", id, extraction.supplierName(), extraction.registrationNumber());
        } else if (extraction.error() != null) {
            log.debug("Extraction failed for {}: {}", id, extraction.error());
        }
        AwardEnrichment enrichment = AwardEnrichment.from(extraction);
        if (enrichment.isEmpty()) {
            log.debug("No supplier fields found in document {}", id);
        }
        return enrichment;
    }

    private void logProgress(long id, ScanStats stats, Instant startedAt) {
        double minutes = Math.max(Duration.between(startedAt, Instant.now()).toMillis() / 60000.0, 1.0 / 60);
        log.info(
            "Progress: ID {} | Found: {} | Tenders: {} | Awards: {} | Enriched: {} | Rate: {}/min",
            id,
            stats.found,
            stats.tenders,
            stats.awards,
            stats.enriched,
            Math.round(stats.checked / minutes)
        );
    }

    private ScanResult result(TerminationReason reason, long startId, ScanState state) {
        return new ScanResult(reason, startId, state.lowerBound(), state.lastVisitedId(), state.stats().snapshot());
    }
}
