package org.calista.formalizer.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.formalizer.core.CollaboratorException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * LeanSearch web API adapter.
 *
 * <p>Request: {@code {"query": [q], "num_results": n}}. Response: see {@link SearchResponses}.</p>
 */
public final class LeanSearchClient implements SearchClient {

    private static final Logger log = LogManager.getLogger(LeanSearchClient.class);
    private static final String NAME = "search";

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final URI endpoint;
    private final Duration timeout;

    public LeanSearchClient(HttpClient http, ObjectMapper mapper, URI endpoint, Duration timeout) {
        this.http = Objects.requireNonNull(http, "http");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public List<SearchHit> search(String query, int limit) throws CollaboratorException {
        if (query == null || query.isBlank() || limit <= 0) return List.of();

        ObjectNode payload = mapper.createObjectNode();
        payload.putArray("query").add(query);
        payload.put("num_results", limit);

        HttpRequest req;
        try {
            req = HttpRequest.newBuilder(endpoint)
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload), StandardCharsets.UTF_8))
                    .build();
        } catch (IOException e) {
            throw CollaboratorException.unavailable(NAME, "cannot encode request", e);
        }

        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw CollaboratorException.unavailable(NAME, "request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CollaboratorException.unavailable(NAME, "interrupted", e);
        }

        if (resp.statusCode() / 100 != 2) {
            throw new CollaboratorException(NAME, CollaboratorException.Kind.UNAVAILABLE, "HTTP " + resp.statusCode());
        }

        List<SearchHit> hits = parse(resp.body());
        log.debug("search '{}' -> {} hits", query, hits.size());
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : hits;
    }

    /** Validates the response envelope and maps it to hits, closest first. */
    List<SearchHit> parse(String body) throws CollaboratorException {
        return SearchResponses.parse(mapper, NAME, body);
    }
}
