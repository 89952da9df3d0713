package com.valan.harvester.crawl.http;

import com.valan.harvester.config.HarvesterProperties;
import com.valan.harvester.crawl.model.HttpFetchResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;

@Service
public class RegistryHttpClient {
    private final HarvesterProperties properties;
    private final HttpClient client;

    public RegistryHttpClient(
        HarvesterProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRegistry().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult get(String url, String acceptHeader, Duration timeout) {
        Instant startedAt = Instant.now();
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
        Duration safeTimeout = timeout == null
            ? Duration.ofSeconds(properties.getRegistry().getRequestTimeoutSeconds())
            : timeout;
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(safeTimeout)
            .header("User-Agent", HarvesterProperties.normalizeUserAgent(properties.getUserAgent()))
            .header("Accept", safeAccept)
            .GET()
            .build();
        try {
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                response.body(),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI toUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
