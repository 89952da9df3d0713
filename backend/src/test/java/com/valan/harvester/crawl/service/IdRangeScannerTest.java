package com.valan.harvester.crawl.service;

import com.valan.harvester.config.HarvesterProperties;
import com.valan.harvester.crawl.classify.NoticeClassifier;
import com.valan.harvester.crawl.extract.AwardDocumentExtractor;
import com.valan.harvester.crawl.extract.DocumentTextReader;
import com.valan.harvester.crawl.extract.ExtractionRuleSet;
import com.valan.harvester.crawl.extract.LocaleVocabulary;
import com.valan.harvester.crawl.model.AwardEnrichment;
import com.valan.harvester.crawl.model.FetchOutcome;
import com.valan.harvester.crawl.model.HarvestMode;
import com.valan.harvester.crawl.model.HarvestRunRequest;
import com.valan.harvester.crawl.model.PublicationRecord;
import com.valan.harvester.crawl.model.ScanResult;
import com.valan.harvester.crawl.model.TerminationReason;
import com.valan.harvester.crawl.persistence.PublicationStore;
import com.valan.harvester.crawl.registry.RegistryClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IdRangeScannerTest {
    private static final String TENDER_TYPE = "Aankondiging van een opdracht";
    private static final String AWARD_TYPE = "Aankondiging van een gegunde opdracht";

    @Mock
    private RegistryClient registryClient;
    @Mock
    private PublicationStore store;

    private HarvesterProperties properties;
    private IdRangeScanner scanner;

    @BeforeEach
    void setUp() {
        properties = new HarvesterProperties();
        scanner = new IdRangeScanner(
            registryClient,
            new NoticeClassifier(LocaleVocabulary.DUTCH),
            new AwardDocumentExtractor(ExtractionRuleSet.dutch(), new DocumentTextReader()),
            store,
            properties
        );
    }

    @Test
    void stopsAfterConsecutiveMisses() {
        when(registryClient.fetchPublication(anyLong())).thenReturn(FetchOutcome.notFound());

        ScanResult result = scanner.scan(new HarvestRunRequest(HarvestMode.RANGE, 105L, 1L, true, 3), () -> false);

        assertThat(result.reason()).isEqualTo(TerminationReason.MISS_CEILING);
        assertThat(result.stats().checked()).isEqualTo(3);
        assertThat(result.stats().notFound()).isEqualTo(3);
        assertThat(result.lastVisitedId()).isEqualTo(103L);
        verify(registryClient, never()).fetchPublication(102L);
    }

    @Test
    void transientErrorsCountAsMissesAndAFindResetsThem() {
        when(registryClient.fetchPublication(anyLong())).thenAnswer(invocation -> {
            long id = invocation.getArgument(0);
            return id == 9L ? FetchOutcome.found(record(id, TENDER_TYPE)) : FetchOutcome.transientError("http_503");
        });
        when(store.upsertTender(any())).thenReturn(true);

        ScanResult result = scanner.scan(new HarvestRunRequest(HarvestMode.RANGE, 10L, 5L, true, 2), () -> false);

        assertThat(result.reason()).isEqualTo(TerminationReason.MISS_CEILING);
        assertThat(result.lastVisitedId()).isEqualTo(7L);
        assertThat(result.stats().transientErrors()).isEqualTo(3);
        assertThat(result.stats().found()).isEqualTo(1);
        assertThat(result.stats().tenders()).isEqualTo(1);
    }

    @Test
    void walksTheWholeRangeDownToTheEndId() {
        when(registryClient.fetchPublication(anyLong()))
            .thenAnswer(invocation -> FetchOutcome.found(record(invocation.getArgument(0), TENDER_TYPE)));
        when(store.upsertTender(any())).thenReturn(true);

        ScanResult result = scanner.scan(HarvestRunRequest.range(12L, 10L, true), () -> false);

        assertThat(result.reason()).isEqualTo(TerminationReason.RANGE_EXHAUSTED);
        assertThat(result.lowerBound()).isEqualTo(9L);
        assertThat(result.lastVisitedId()).isEqualTo(10L);
        assertThat(result.stats().checked()).isEqualTo(3);
        assertThat(result.stats().tenders()).isEqualTo(3);
        verify(registryClient, never()).fetchPublication(9L);
    }

    @Test
    void skipsStoredIdsWithoutFetching() {
        when(store.exists(5L)).thenReturn(true);
        when(store.exists(4L)).thenReturn(false);
        when(registryClient.fetchPublication(4L)).thenReturn(FetchOutcome.found(record(4L, TENDER_TYPE)));
        when(store.upsertTender(any())).thenReturn(true);

        ScanResult result = scanner.scan(HarvestRunRequest.range(5L, 4L, false), () -> false);

        assertThat(result.reason()).isEqualTo(TerminationReason.RANGE_EXHAUSTED);
        assertThat(result.stats().skipped()).isEqualTo(1);
        assertThat(result.stats().checked()).isEqualTo(1);
        assertThat(result.lastVisitedId()).isEqualTo(4L);
        verify(registryClient, never()).fetchPublication(5L);
    }

    @Test
    void incrementalRunWithNothingNewFetchesNothing() {
        when(store.maxKnownId()).thenReturn(500L);
        when(registryClient.latestKnownId()).thenReturn(500L);

        ScanResult result = scanner.scan(HarvestRunRequest.incremental(), () -> false);

        assertThat(result.reason()).isEqualTo(TerminationReason.NO_NEW_DATA);
        assertThat(result.lastVisitedId()).isZero();
        verify(registryClient, never()).fetchPublication(anyLong());
    }

    @Test
    void unreadableRegistryListingMeansNoNewData() {
        when(store.maxKnownId()).thenReturn(500L);
        when(registryClient.latestKnownId()).thenReturn(0L);

        ScanResult result = scanner.scan(HarvestRunRequest.incremental(), () -> false);

        assertThat(result.reason()).isEqualTo(TerminationReason.NO_NEW_DATA);
        verify(registryClient, never()).fetchPublication(anyLong());
    }

    @Test
    void emptyStoreFallsBackToConfiguredHighWaterMark() {
        properties.getScan().setInitialHighWaterMark(1000L);
        when(store.maxKnownId()).thenReturn(0L);
        when(registryClient.latestKnownId()).thenReturn(1002L);
        when(store.exists(anyLong())).thenReturn(false);
        when(registryClient.fetchPublication(1002L)).thenReturn(FetchOutcome.found(record(1002L, TENDER_TYPE)));
        when(registryClient.fetchPublication(1001L)).thenReturn(FetchOutcome.notFound());
        when(store.upsertTender(any())).thenReturn(true);

        ScanResult result = scanner.scan(HarvestRunRequest.incremental(), () -> false);

        assertThat(result.reason()).isEqualTo(TerminationReason.RANGE_EXHAUSTED);
        assertThat(result.startId()).isEqualTo(1002L);
        assertThat(result.lowerBound()).isEqualTo(1000L);
        assertThat(result.stats().checked()).isEqualTo(2);
        verify(registryClient, never()).fetchPublication(1000L);
    }

    @Test
    void awardWithoutDocumentIsStoredUnenriched() {
        PublicationRecord award = record(7L, AWARD_TYPE);
        when(registryClient.fetchPublication(7L)).thenReturn(FetchOutcome.found(award));
        when(registryClient.fetchDocument(7L)).thenReturn(FetchOutcome.notFound());
        when(store.upsertAward(eq(award), eq(AwardEnrichment.EMPTY))).thenReturn(true);

        ScanResult result = scanner.scan(HarvestRunRequest.range(7L, 7L, true), () -> false);

        assertThat(result.stats().awards()).isEqualTo(1);
        assertThat(result.stats().enriched()).isZero();
        verify(store, never()).upsertTender(any());
    }

    @Test
    void awardDocumentEnrichesTheRow() {
        PublicationRecord award = record(8L, AWARD_TYPE);
        byte[] document = "Winnaar:\nNaam:\nAcme B.V.\nKVK 12345678\n".getBytes(StandardCharsets.UTF_8);
        when(registryClient.fetchPublication(8L)).thenReturn(FetchOutcome.found(award));
        when(registryClient.fetchDocument(8L)).thenReturn(FetchOutcome.found(document));
        when(store.upsertAward(eq(award), any())).thenReturn(true);

        ScanResult result = scanner.scan(HarvestRunRequest.range(8L, 8L, true), () -> false);

        ArgumentCaptor<AwardEnrichment> enrichment = ArgumentCaptor.forClass(AwardEnrichment.class);
        verify(store).upsertAward(eq(award), enrichment.capture());
        assertThat(enrichment.getValue().supplierName()).isEqualTo("Acme B.V.");
        assertThat(enrichment.getValue().registrationNumber()).isEqualTo("12345678");
        assertThat(result.stats().enriched()).isEqualTo(1);
    }

    @Test
    void documentWithoutSupplierFieldsGivesEmptyEnrichment() {
        PublicationRecord award = record(9L, AWARD_TYPE);
        byte[] document = "Aankondiging zonder verdere gegevens".getBytes(StandardCharsets.UTF_8);
        when(registryClient.fetchPublication(9L)).thenReturn(FetchOutcome.found(award));
        when(registryClient.fetchDocument(9L)).thenReturn(FetchOutcome.found(document));
        when(store.upsertAward(eq(award), any())).thenReturn(true);

        ScanResult result = scanner.scan(HarvestRunRequest.range(9L, 9L, true), () -> false);

        ArgumentCaptor<AwardEnrichment> enrichment = ArgumentCaptor.forClass(AwardEnrichment.class);
        verify(store).upsertAward(eq(award), enrichment.capture());
        assertThat(enrichment.getValue().isEmpty()).isTrue();
        assertThat(result.stats().enriched()).isZero();
        assertThat(result.stats().awards()).isEqualTo(1);
    }

    @Test
    void failedWritesAreCountedAndTheScanContinues() {
        when(registryClient.fetchPublication(anyLong()))
            .thenAnswer(invocation -> FetchOutcome.found(record(invocation.getArgument(0), TENDER_TYPE)));
        when(store.upsertTender(any())).thenReturn(false, true);

        ScanResult result = scanner.scan(HarvestRunRequest.range(3L, 2L, true), () -> false);

        assertThat(result.reason()).isEqualTo(TerminationReason.RANGE_EXHAUSTED);
        assertThat(result.stats().dbErrors()).isEqualTo(1);
        assertThat(result.stats().tenders()).isEqualTo(1);
        assertThat(result.stats().found()).isEqualTo(2);
    }

    @Test
    void stopsWhenCancelled() {
        AtomicInteger checks = new AtomicInteger();
        when(registryClient.fetchPublication(anyLong()))
            .thenAnswer(invocation -> FetchOutcome.found(record(invocation.getArgument(0), TENDER_TYPE)));
        when(store.upsertTender(any())).thenReturn(true);

        ScanResult result = scanner.scan(HarvestRunRequest.range(10L, 1L, true), () -> checks.incrementAndGet() > 1);

        assertThat(result.reason()).isEqualTo(TerminationReason.CANCELLED);
        assertThat(result.stats().checked()).isEqualTo(1);
        assertThat(result.lastVisitedId()).isEqualTo(10L);
    }

    @Test
    void rangeWithoutBoundsIsRejected() {
        HarvestRunRequest request = new HarvestRunRequest(HarvestMode.RANGE, null, 5L, null, null);

        assertThatThrownBy(() -> scanner.scan(request, () -> false)).isInstanceOf(IllegalArgumentException.class);
    }

    private static PublicationRecord record(long id, String noticeType) {
        return new PublicationRecord(
            id,
            "Schoonmaakdiensten " + id,
            "Gemeente Utrecht",
            noticeType,
            null,
            null,
            false,
            List.of("90910000-9"),
            "90910000-9",
            List.of("NL310"),
            "Openbaar",
            "Diensten",
            null,
            "REF-" + id,
            null,
            null,
            Map.of()
        );
    }
}
