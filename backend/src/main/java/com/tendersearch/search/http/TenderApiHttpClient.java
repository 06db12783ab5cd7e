package com.tendersearch.search.http;

import com.tendersearch.config.SearchProperties;
import com.tendersearch.search.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Single-attempt HTTP access for the source adapters. Failures never throw: they come back as an
 * {@link HttpFetchResult} carrying an error code.
 */
@Service
public class TenderApiHttpClient {
    private static final Logger log = LoggerFactory.getLogger(TenderApiHttpClient.class);

    private final SearchProperties properties;
    private final HttpClient client;

    public TenderApiHttpClient(
        SearchProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult get(String url, String acceptHeader, Map<String, String> headers) {
        return send(url, "GET", acceptHeader, null, null, headers);
    }

    public HttpFetchResult postJson(String url, String jsonBody, String acceptHeader, Map<String, String> headers) {
        return send(url, "POST", acceptHeader, jsonBody == null ? "" : jsonBody, "application/json", headers);
    }

    private HttpFetchResult send(
        String url,
        String method,
        String acceptHeader,
        String body,
        String contentType,
        Map<String, String> headers
    ) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        try {
            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", SearchProperties.normalizeUserAgent(properties.getUserAgent()))
                .header("Accept", safeAccept);
            if (headers != null) {
                headers.forEach((name, value) -> {
                    if (value != null) {
                        builder.header(name, value);
                    }
                });
            }
            HttpRequest request;
            if ("POST".equalsIgnoreCase(method)) {
                request = builder
                    .header("Content-Type", contentType == null || contentType.isBlank() ? "application/json" : contentType)
                    .POST(HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8))
                    .build();
            } else {
                request = builder.GET().build();
            }

            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            log.debug("{} {} -> {} in {}", method, uri.getHost(), response.statusCode(), Duration.between(startedAt, Instant.now()));
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
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, "invalid_request", e.getMessage());
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String errorCode, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            errorCode,
            message
        );
    }

    private URI normalizeUri(String url) {
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
