package org.calista.formalizer.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
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
 * OpenAI-compatible {@code /chat/completions} adapter.
 */
public final class OpenAiChatModel implements LanguageModel {

    private static final Logger log = LogManager.getLogger(OpenAiChatModel.class);
    private static final String NAME = "llm";

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final URI endpoint;
    private final String apiKey;
    private final String model;
    private final Duration timeout;

    public OpenAiChatModel(HttpClient http, ObjectMapper mapper, String baseUrl, String apiKey, String model, Duration timeout) {
        this.http = Objects.requireNonNull(http, "http");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.endpoint = URI.create(stripSlash(Objects.requireNonNull(baseUrl, "baseUrl")) + "/chat/completions");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.model = Objects.requireNonNull(model, "model");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public String complete(List<ChatMessage> messages, double temperature) throws CollaboratorException {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", model);
        payload.put("temperature", temperature);
        ArrayNode arr = payload.putArray("messages");
        for (ChatMessage m : messages) {
            arr.addObject().put("role", m.wireRole()).put("content", m.content);
        }

        HttpRequest.Builder rb;
        try {
            rb = HttpRequest.newBuilder(endpoint)
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw CollaboratorException.unavailable(NAME, "cannot encode request", e);
        }
        if (!apiKey.isBlank()) rb.header("Authorization", "Bearer " + apiKey);

        HttpResponse<String> resp;
        try {
            resp = http.send(rb.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw CollaboratorException.unavailable(NAME, "request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CollaboratorException.unavailable(NAME, "interrupted", e);
        }

        if (resp.statusCode() / 100 != 2) {
            log.debug("llm error body: {}", resp.body());
            throw new CollaboratorException(NAME, CollaboratorException.Kind.UNAVAILABLE, "HTTP " + resp.statusCode());
        }

        String text = extractContent(resp.body());
        log.debug("llm response ({} chars):\n{}", text.length(), text);
        return text;
    }

    String extractContent(String body) throws CollaboratorException {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw CollaboratorException.malformed(NAME, "not JSON: " + e.getMessage());
        }
        JsonNode content = root == null ? null : root.at("/choices/0/message/content");
        if (content == null || content.isMissingNode() || content.isNull()) {
            throw CollaboratorException.malformed(NAME, "no choices[0].message.content");
        }
        String text = content.asText().trim();
        if (text.isEmpty()) throw CollaboratorException.malformed(NAME, "empty completion");
        return text;
    }

    private static String stripSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
