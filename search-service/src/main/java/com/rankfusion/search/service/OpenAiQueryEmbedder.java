package com.rankfusion.search.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rankfusion.search.error.EmbeddingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Embeds query text through an OpenAI-compatible {@code /v1/embeddings} endpoint.
 */
public class OpenAiQueryEmbedder implements QueryEmbedder {

    private static final Logger log = LoggerFactory.getLogger(OpenAiQueryEmbedder.class);
    public static final String DEFAULT_MODEL = "text-embedding-ada-002";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String model;
    private final long requestTimeoutMs;

    public OpenAiQueryEmbedder(String baseUrl, String apiKey, String model, long requestTimeoutMs, ObjectMapper objectMapper) {
        this(
                WebClient.builder()
                        .baseUrl(baseUrl)
                        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                        .build(),
                model,
                requestTimeoutMs,
                objectMapper
        );
    }

    public OpenAiQueryEmbedder(WebClient webClient, String model, long requestTimeoutMs, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.model = (model == null || model.isBlank()) ? DEFAULT_MODEL : model;
        this.requestTimeoutMs = Math.max(50L, requestTimeoutMs);
    }

    @Override
    public List<Double> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException(EmbeddingException.Kind.INVALID_INPUT, "text to embed is blank");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("input", List.of(text.replace("\n", " ")));
        payload.put("model", model);

        String body;
        try {
            body = webClient.post()
                    .uri("/v1/embeddings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(requestTimeoutMs))
                    .block();
        } catch (Exception ex) {
            throw translate(ex);
        }
        List<Double> vector = parseEmbedding(body);
        log.debug("embedded query model={} dimensions={}", model, vector.size());
        return vector;
    }

    private List<Double> parseEmbedding(String body) {
        if (body == null || body.isBlank()) {
            throw new EmbeddingException(EmbeddingException.Kind.UNAVAILABLE, "empty embeddings response");
        }
        JsonNode embeddingNode;
        try {
            embeddingNode = objectMapper.readTree(body).path("data").path(0).path("embedding");
        } catch (JsonProcessingException ex) {
            throw new EmbeddingException(EmbeddingException.Kind.UNAVAILABLE, "unparsable embeddings response", ex);
        }
        if (!embeddingNode.isArray() || embeddingNode.isEmpty()) {
            throw new EmbeddingException(EmbeddingException.Kind.UNAVAILABLE, "embeddings response carries no vector");
        }
        List<Double> vector = new ArrayList<>(embeddingNode.size());
        for (JsonNode node : embeddingNode) {
            if (!node.isNumber()) {
                throw new EmbeddingException(EmbeddingException.Kind.UNAVAILABLE, "non-numeric embedding component");
            }
            vector.add(node.asDouble());
        }
        return vector;
    }

    private static EmbeddingException translate(Exception ex) {
        if (BackendCalls.isTimeout(ex)) {
            return new EmbeddingException(EmbeddingException.Kind.UNAVAILABLE, "embedding request timed out", ex);
        }
        int status = BackendCalls.statusOf(ex);
        if (status == 429) {
            return new EmbeddingException(EmbeddingException.Kind.RATE_LIMITED, "embedding provider rate limited the request", ex);
        }
        if (status == 400) {
            return new EmbeddingException(EmbeddingException.Kind.INVALID_INPUT, "embedding provider rejected the input", ex);
        }
        String detail = status == 0 ? ex.toString() : "embedding provider returned HTTP " + status;
        return new EmbeddingException(EmbeddingException.Kind.UNAVAILABLE, detail, ex);
    }
}
