package com.landingzone.orchestrator.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.landingzone.orchestrator.storage.dto.ObjectListResponse;
import com.landingzone.orchestrator.storage.dto.RewriteResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ObjectStore} backed by the Cloud Storage JSON API.
 *
 * Uses java.net.http.HttpClient directly: three endpoints (list, rewrite,
 * delete) do not justify pulling in the full client library. A move is a
 * server-side rewrite followed by a delete of the source, which is what
 * {@code gsutil mv} does too.
 */
@Component
public class GcsObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(GcsObjectStore.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       accessToken;

    public GcsObjectStore(
            @Value("${landing.gcs.base-url}") String baseUrl,
            @Value("${landing.gcs.access-token:}") String accessToken,
            ObjectMapper objectMapper) {
        this.baseUrl     = stripTrailingSlash(baseUrl);
        this.accessToken = accessToken;
        this.json        = objectMapper;
        this.http        = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // ObjectStore
    // ------------------------------------------------------------------

    @Override
    public boolean exists(String bucket, String prefix, Duration timeout) {
        String path = objectsPath(bucket) + "?maxResults=1&prefix=" + encode(prefix);
        Duration bounded = timeout.compareTo(REQUEST_TIMEOUT) < 0 ? timeout : REQUEST_TIMEOUT;
        String body = send(request(path, bounded).GET().build(), "exists gs://" + bucket + "/" + prefix);
        ObjectListResponse page = parse(body, ObjectListResponse.class);
        return !page.itemsOrEmpty().isEmpty();
    }

    @Override
    public List<String> list(String bucket, String prefix) {
        List<String> names = new ArrayList<>();
        String pageToken = null;
        do {
            String path = objectsPath(bucket) + "?prefix=" + encode(prefix)
                    + (pageToken == null ? "" : "&pageToken=" + encode(pageToken));
            ObjectListResponse page = parse(get(path, "list gs://" + bucket + "/" + prefix),
                    ObjectListResponse.class);
            page.itemsOrEmpty().forEach(item -> names.add(item.name()));
            pageToken = page.nextPageToken();
        } while (pageToken != null && !pageToken.isEmpty());
        log.debug("Listed {} objects under gs://{}/{}", names.size(), bucket, prefix);
        return names;
    }

    @Override
    public void move(String sourceBucket, String sourceName, String targetBucket, String targetName) {
        String opName = "move gs://" + sourceBucket + "/" + sourceName
                + " -> gs://" + targetBucket + "/" + targetName;
        String rewritePath = objectsPath(sourceBucket) + "/" + encode(sourceName)
                + "/rewriteTo/b/" + encode(targetBucket) + "/o/" + encode(targetName);

        RewriteResponse rewrite = parse(post(rewritePath, opName), RewriteResponse.class);
        while (!rewrite.done()) {
            rewrite = parse(post(rewritePath + "?rewriteToken=" + encode(rewrite.rewriteToken()), opName),
                    RewriteResponse.class);
        }
        delete(objectsPath(sourceBucket) + "/" + encode(sourceName), opName);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String objectsPath(String bucket) {
        return "/storage/v1/b/" + encode(bucket) + "/o";
    }

    private String get(String path, String opName) {
        return send(request(path).GET().build(), opName);
    }

    private String post(String path, String opName) {
        return send(request(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString("{}"))
                .build(), opName);
    }

    private void delete(String path, String opName) {
        send(request(path).DELETE().build(), opName);
    }

    private HttpRequest.Builder request(String path) {
        return request(path, REQUEST_TIMEOUT);
    }

    private HttpRequest.Builder request(String path, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Accept", "application/json");
        if (accessToken != null && !accessToken.isBlank()) {
            builder.header("Authorization", "Bearer " + accessToken);
        }
        return builder;
    }

    private String send(HttpRequest req, String opName) {
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new StorageException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body(),
                        resp.statusCode());
            }
            return resp.body();
        } catch (StorageException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new StorageException(opName + " failed", e);
        }
    }

    private <T> T parse(String body, Class<T> type) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to parse storage response as " + type.getSimpleName(), e);
        }
    }

    // Object names go into a single path segment, so '/' must be escaped too.
    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
