package com.structura.labeling.service.remote;

import com.structura.labeling.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link ClassifierTransport} posting to an OpenAI-compatible {@code /chat/completions} endpoint.
 *
 * <p>The connect timeout is fixed on the supplied {@link HttpClient}; the per-attempt timeout is
 * applied to each request, so the JDK raises {@link java.net.http.HttpConnectTimeoutException}
 * for the former and {@link java.net.http.HttpTimeoutException} for the latter.
 */
public class HttpClassifierTransport implements ClassifierTransport {

    private static final Logger LOG = LogManager.getLogger(HttpClassifierTransport.class);
    private static final int ERROR_BODY_PREVIEW = 200;

    private final HttpClient httpClient;
    private final URI endpoint;
    private final String apiKey;

    public HttpClassifierTransport(HttpClient httpClient, String baseUrl, String apiKey) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.endpoint = URI.create(trimmed + "/chat/completions");
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    @Override
    public String send(String payload, Duration timeout) throws IOException {
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (apiKey.isEmpty()) {
            throw new AuthenticationRejectedException("No API key configured for the remote classifier", 0);
        }
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Remote classification interrupted");
            interrupted.initCause(e);
            throw interrupted;
        }

        int status = response.statusCode();
        if (status == 401 || status == 403) {
            throw new AuthenticationRejectedException("Remote classifier rejected credentials (HTTP " + status + ")",
                    status);
        }
        if (status < 200 || status >= 300) {
            String preview = LogSanitizer.singleLine(response.body(), ERROR_BODY_PREVIEW);
            LOG.debug("Remote classifier returned HTTP {}: {}", status, preview);
            throw new TransportStatusException(status, preview);
        }
        return response.body();
    }

    URI getEndpoint() {
        return endpoint;
    }
}
