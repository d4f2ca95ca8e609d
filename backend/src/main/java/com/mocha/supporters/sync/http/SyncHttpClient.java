package com.mocha.supporters.sync.http;

import com.mocha.supporters.config.SupportersProperties;
import com.mocha.supporters.sync.model.HttpFetchResult;
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
import java.util.concurrent.ExecutorService;

/**
 * Single-attempt HTTP client shared by the ledger fetcher and the avatar sync.
 * Failures come back as an {@link HttpFetchResult} with an error code; callers decide
 * whether that aborts their step.
 */
@Service
public class SyncHttpClient {
    private final SupportersProperties properties;
    private final HttpClient client;

    public SyncHttpClient(
        SupportersProperties properties,
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

    public HttpFetchResult get(String url, String acceptHeader) {
        return send(url, "GET", acceptHeader, null);
    }

    public HttpFetchResult postJson(String url, String jsonBody, String acceptHeader) {
        return send(url, "POST", acceptHeader, jsonBody == null ? "" : jsonBody);
    }

    private HttpFetchResult send(String url, String method, String acceptHeader, String body) {
        URI uri = uriFor(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, "invalid_url", "URL missing host or malformed");
        }

        String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("User-Agent", SupportersProperties.normalizeUserAgent(properties.getUserAgent()))
            .header("Accept", safeAccept);
        HttpRequest request;
        if ("POST".equalsIgnoreCase(method)) {
            request = builder
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8))
                .build();
        } else {
            request = builder.GET().build();
        }

        try {
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            return new HttpFetchResult(url, response.statusCode(), response.body(), null, null);
        } catch (HttpTimeoutException e) {
            return errorResult(url, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, "http_error", e.getMessage());
        }
    }

    private HttpFetchResult errorResult(String url, String code, String message) {
        return new HttpFetchResult(url, 0, null, code, message);
    }

    private URI uriFor(String url) {
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
