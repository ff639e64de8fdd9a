package com.rankfusion.search.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rankfusion.search.error.RetrievalException;
import com.rankfusion.search.error.RetrievalFailureKind;
import com.rankfusion.search.model.RankedHit;
import com.rankfusion.search.model.RetrievalQuery;
import com.rankfusion.search.model.RetrievalSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class VectorServiceRetriever implements VectorRetriever {

    private static final Logger log = LoggerFactory.getLogger(VectorServiceRetriever.class);
    static final int NUM_CANDIDATES_FACTOR = 5;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String indexName;
    private final long requestTimeoutMs;

    @Autowired
    public VectorServiceRetriever(
            @Value("${vector.url}") String vectorUrl,
            @Value("${vector.index-name:vectorIndex}") String indexName,
            @Value("${vector.request-timeout-ms:1000}") long requestTimeoutMs,
            ObjectMapper objectMapper
    ) {
        this(WebClient.builder().baseUrl(vectorUrl).build(), indexName, requestTimeoutMs, objectMapper);
    }

    public VectorServiceRetriever(WebClient webClient, String indexName, long requestTimeoutMs, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.indexName = (indexName == null || indexName.isBlank()) ? "vectorIndex" : indexName;
        this.requestTimeoutMs = Math.max(50L, requestTimeoutMs);
    }

    @Override
    public List<RankedHit> retrieve(RetrievalQuery query, int k) {
        if (query == null || !query.hasVector()) {
            throw new RetrievalException(RetrievalSource.VECTOR, RetrievalFailureKind.MALFORMED_QUERY, "query vector is missing");
        }
        if (k < 1) {
            throw new RetrievalException(RetrievalSource.VECTOR, RetrievalFailureKind.MALFORMED_QUERY, "k must be at least 1");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("index", indexName);
        payload.put("queryVector", query.vector());
        payload.put("topK", k);
        payload.put("numCandidates", k * NUM_CANDIDATES_FACTOR);

        String body = call(webClient.post()
                .uri("/api/vector/search")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofMillis(requestTimeoutMs)), "search");
        if (body == null || body.isBlank()) {
            throw new RetrievalException(RetrievalSource.VECTOR, RetrievalFailureKind.INVALID_RESPONSE, "empty search response");
        }
        return RankedHits.rank(RetrievalSource.VECTOR, parseHits(body), k);
    }

    @Override
    public void verifySetup() {
        call(webClient.get()
                .uri("/api/vector/index/{name}", indexName)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofMillis(requestTimeoutMs)), "index lookup");
        log.info("vector index reachable index={}", indexName);
    }

    private String call(Mono<String> request, String operation) {
        try {
            return request.block();
        } catch (Exception ex) {
            throw translate(ex, operation);
        }
    }

    private List<RankedHits.Candidate> parseHits(String body) {
        JsonNode arr;
        try {
            arr = objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new RetrievalException(RetrievalSource.VECTOR, RetrievalFailureKind.INVALID_RESPONSE, "unparsable search response", ex);
        }
        if (!arr.isArray()) {
            throw new RetrievalException(RetrievalSource.VECTOR, RetrievalFailureKind.INVALID_RESPONSE, "search response is not an array");
        }
        List<RankedHits.Candidate> candidates = new ArrayList<>(arr.size());
        for (JsonNode node : arr) {
            JsonNode idNode = node.get("documentId");
            if (idNode == null || idNode.isNull() || idNode.asText().isBlank()) {
                throw new RetrievalException(RetrievalSource.VECTOR, RetrievalFailureKind.INVALID_RESPONSE, "hit without documentId");
            }
            JsonNode scoreNode = node.get("similarityScore");
            Double score = (scoreNode != null && scoreNode.isNumber()) ? scoreNode.asDouble() : null;
            String text = node.path("text").asText("");
            if (text.isBlank()) {
                text = node.path("title").asText("");
            }
            candidates.add(new RankedHits.Candidate(idNode.asText(), score, text));
        }
        return candidates;
    }

    private static RetrievalException translate(Exception ex, String operation) {
        if (BackendCalls.isTimeout(ex)) {
            return new RetrievalException(RetrievalSource.VECTOR, RetrievalFailureKind.TIMEOUT, "vector " + operation + " timed out", ex);
        }
        int status = BackendCalls.statusOf(ex);
        if (status == 400) {
            return new RetrievalException(RetrievalSource.VECTOR, RetrievalFailureKind.MALFORMED_QUERY, "vector service rejected the query", ex);
        }
        String detail = status == 0 ? ex.toString() : "vector " + operation + " returned HTTP " + status;
        return new RetrievalException(RetrievalSource.VECTOR, RetrievalFailureKind.UNAVAILABLE, detail, ex);
    }
}
