package com.meshci.orchestrator.artifact;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * Artifact store backed by a blob service speaking plain HTTP:
 * {@code PUT <base>/<key>} to write, {@code GET <base>/<key>} to read.
 *
 * Writes carry {@code If-None-Match: *}; a server that already holds the key
 * answers 412, which surfaces as an {@link ArtifactStoreException}.
 */
public class HttpArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(HttpArtifactStore.class);

    private final HttpClient http;
    private final String     baseUrl;
    private final String     authToken;
    private final Duration   requestTimeout;

    public HttpArtifactStore(String baseUrl, String authToken, Duration requestTimeout) {
        this(HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(Duration.ofSeconds(10))
                        .build(),
             baseUrl, authToken, requestTimeout);
    }

    HttpArtifactStore(HttpClient http, String baseUrl, String authToken, Duration requestTimeout) {
        this.http           = http;
        this.baseUrl        = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.authToken      = authToken;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public void put(String key, byte[] blob) {
        HttpRequest req = request(key)
                .header("Content-Type",  "application/octet-stream")
                .header("If-None-Match", "*")
                .PUT(HttpRequest.BodyPublishers.ofByteArray(blob))
                .build();
        HttpResponse<byte[]> resp = send(req, "put " + key);
        if (resp.statusCode() == 412) {
            throw new ArtifactStoreException("Artifact already exists: " + key);
        }
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new ArtifactStoreException("put " + key + " failed, HTTP " + resp.statusCode());
        }
        log.info("Uploaded artifact '{}' ({} bytes)", key, blob.length);
    }

    @Override
    public Optional<byte[]> get(String key) {
        HttpResponse<byte[]> resp = send(request(key).GET().build(), "get " + key);
        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new ArtifactStoreException("get " + key + " failed, HTTP " + resp.statusCode());
        }
        return Optional.of(resp.body());
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpRequest.Builder request(String key) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/" + key))
                .timeout(requestTimeout);
        if (authToken != null && !authToken.isBlank()) {
            builder.header("Authorization", "Bearer " + authToken);
        }
        return builder;
    }

    private HttpResponse<byte[]> send(HttpRequest req, String opName) {
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ArtifactStoreException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new ArtifactStoreException(opName + " failed", e);
        }
    }
}
