package com.valan.harvester.crawl.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.valan.harvester.config.HarvesterProperties;
import com.valan.harvester.crawl.http.RateLimiter;
import com.valan.harvester.crawl.http.RegistryHttpClient;
import com.valan.harvester.crawl.model.FetchOutcome;
import com.valan.harvester.crawl.model.PublicationRecord;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class RegistryClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private RegistryClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        HarvesterProperties properties = new HarvesterProperties();
        properties.getRegistry().setBaseUrl(server.url("/publicaties").toString());
        properties.getRegistry().setPublicationDelayMs(0);
        properties.getRegistry().setDocumentDelayMs(0);
        properties.getRegistry().setRequestTimeoutSeconds(5);
        properties.getRegistry().setDocumentTimeoutSeconds(5);
        executor = Executors.newFixedThreadPool(1);
        client = new RegistryClient(
            properties,
            new RegistryHttpClient(properties, executor),
            new RateLimiter(),
            new PublicationJsonMapper(new ObjectMapper())
        );
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void foundPublicationIsMappedAndRequestIsIdentified() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody("{\"publicatieId\": 123, \"aanbestedingNaam\": \"Schoonmaak kantoren\","
                + " \"typePublicatie\": {\"omschrijving\": \"Aankondiging van een opdracht\"}}"));

        FetchOutcome<PublicationRecord> outcome = client.fetchPublication(123);

        assertThat(outcome.isFound()).isTrue();
        assertThat(outcome.value().id()).isEqualTo(123L);
        assertThat(outcome.value().title()).isEqualTo("Schoonmaak kantoren");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/publicaties/123");
        assertThat(request.getHeader("User-Agent")).isEqualTo("Valan/1.0");
        assertThat(request.getHeader("Accept")).isEqualTo("application/json");
    }

    @Test
    void missingPublicationIsNotFound() {
        server.enqueue(new MockResponse().setResponseCode(404));

        FetchOutcome<PublicationRecord> outcome = client.fetchPublication(77);

        assertThat(outcome.status()).isEqualTo(FetchOutcome.Status.NOT_FOUND);
    }

    @Test
    void serverErrorIsTransient() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        FetchOutcome<PublicationRecord> outcome = client.fetchPublication(77);

        assertThat(outcome.status()).isEqualTo(FetchOutcome.Status.TRANSIENT_ERROR);
        assertThat(outcome.reason()).contains("500");
    }

    @Test
    void unparseableBodyIsTransient() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>maintenance</html>"));

        FetchOutcome<PublicationRecord> outcome = client.fetchPublication(77);

        assertThat(outcome.status()).isEqualTo(FetchOutcome.Status.TRANSIENT_ERROR);
    }

    @Test
    void documentBytesAreReturnedFromTheDocumentPath() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/pdf")
            .setBody(new Buffer().write(new byte[]{'%', 'P', 'D', 'F', '-', '1'})));

        FetchOutcome<byte[]> outcome = client.fetchDocument(55);

        assertThat(outcome.isFound()).isTrue();
        assertThat(outcome.value()).hasSize(6);
        assertThat(server.takeRequest().getPath()).isEqualTo("/publicaties/55/pdf");
    }

    @Test
    void emptyDocumentIsNotFound() {
        server.enqueue(new MockResponse().setResponseCode(200));

        assertThat(client.fetchDocument(55).status()).isEqualTo(FetchOutcome.Status.NOT_FOUND);
    }

    @Test
    void latestKnownIdReadsFirstListingEntry() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setBody("{\"content\": [{\"publicatieId\": 424242}, {\"publicatieId\": 424241}]}"));

        assertThat(client.latestKnownId()).isEqualTo(424242L);
        assertThat(server.takeRequest().getPath()).isEqualTo("/publicaties?page=0&size=1");
    }

    @Test
    void latestKnownIdIsZeroOnFailureOrEmptyListing() {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"content\": []}"));

        assertThat(client.latestKnownId()).isZero();
        assertThat(client.latestKnownId()).isZero();
    }
}
