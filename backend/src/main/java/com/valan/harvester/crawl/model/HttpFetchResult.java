package com.valan.harvester.crawl.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    byte[] bodyBytes,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isNotFound() {
        return statusCode == 404 && errorCode == null;
    }

    public boolean hasBody() {
        return bodyBytes != null && bodyBytes.length > 0;
    }

    public String failureReason() {
        if (errorCode != null) {
            return errorMessage == null ? errorCode : errorCode + ": " + errorMessage;
        }
        return "http_" + statusCode;
    }
}
