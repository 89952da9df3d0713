package com.valan.harvester.crawl.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.valan.harvester.config.HarvesterProperties;
import com.valan.harvester.crawl.http.RateLimiter;
import com.valan.harvester.crawl.http.RegistryHttpClient;
import com.valan.harvester.crawl.model.FetchOutcome;
import com.valan.harvester.crawl.model.HttpFetchResult;
import com.valan.harvester.crawl.model.PublicationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Reads single publications, their attached documents and the newest ID from the
 * publication registry. Nothing thrown by the transport or the JSON parser leaves
 * this class; callers get a {@link FetchOutcome} instead.
 */
@Service
public class RegistryClient {
    private static final Logger log = LoggerFactory.getLogger(RegistryClient.class);
    private static final String JSON_ACCEPT = "application/json";
    private static final String DOCUMENT_ACCEPT = "application/pdf,*/*";

    private final HarvesterProperties properties;
    private final RegistryHttpClient httpClient;
    private final RateLimiter rateLimiter;
    private final PublicationJsonMapper mapper;

    public RegistryClient(
        HarvesterProperties properties,
        RegistryHttpClient httpClient,
        RateLimiter registryRateLimiter,
        PublicationJsonMapper mapper
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.rateLimiter = registryRateLimiter;
        this.mapper = mapper;
    }

    public FetchOutcome<PublicationRecord> fetchPublication(long id) {
        HarvesterProperties.Registry registry = properties.getRegistry();
        rateLimiter.await(Duration.ofMillis(registry.getPublicationDelayMs()));
        HttpFetchResult result = httpClient.get(
            registry.getBaseUrl() + "/" + id,
            JSON_ACCEPT,
            Duration.ofSeconds(registry.getRequestTimeoutSeconds())
        );
        if (result.isNotFound()) {
            return FetchOutcome.notFound();
        }
        if (!result.isSuccessful()) {
            log.debug("Fetch error {}: {}", id, result.failureReason());
            return FetchOutcome.transientError(result.failureReason());
        }
        try {
            JsonNode node = mapper.readTree(result.bodyBytes());
            if (node == null || !node.isObject()) {
                return FetchOutcome.transientError("unexpected_payload");
            }
            return FetchOutcome.found(mapper.toRecord(node, id));
        } catch (Exception e) {
            log.debug("Unreadable publication {}: {}", id, e.getMessage());
            return FetchOutcome.transientError("parse_error: " + e.getMessage());
        }
    }

    public FetchOutcome<byte[]> fetchDocument(long id) {
        HarvesterProperties.Registry registry = properties.getRegistry();
        rateLimiter.await(Duration.ofMillis(registry.getDocumentDelayMs()));
        HttpFetchResult result = httpClient.get(
            registry.getBaseUrl() + "/" + id + "/" + registry.getDocumentSuffix(),
            DOCUMENT_ACCEPT,
            Duration.ofSeconds(registry.getDocumentTimeoutSeconds())
        );
        if (result.isNotFound()) {
            return FetchOutcome.notFound();
        }
        if (!result.isSuccessful()) {
            log.debug("Document error {}: {}", id, result.failureReason());
            return FetchOutcome.transientError(result.failureReason());
        }
        if (!result.hasBody()) {
            return FetchOutcome.notFound();
        }
        return FetchOutcome.found(result.bodyBytes());
    }

    /**
     * Newest publication ID from the registry's newest-first listing, or {@code 0}
     * when the registry cannot be read. Zero means "no new data", never a bound.
     */
    public long latestKnownId() {
        HarvesterProperties.Registry registry = properties.getRegistry();
        rateLimiter.await(Duration.ofMillis(registry.getPublicationDelayMs()));
        HttpFetchResult result = httpClient.get(
            registry.getBaseUrl() + "?page=0&size=1",
            JSON_ACCEPT,
            Duration.ofSeconds(registry.getRequestTimeoutSeconds())
        );
        if (!result.isSuccessful()) {
            log.error("Error getting latest ID: {}", result.failureReason());
            return 0L;
        }
        try {
            return Math.max(0L, mapper.latestId(mapper.readTree(result.bodyBytes())));
        } catch (Exception e) {
            log.error("Error reading latest ID listing: {}", e.getMessage());
            return 0L;
        }
    }
}
