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
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Service
public class SolrTextRetriever implements TextRetriever {

    private static final Logger log = LoggerFactory.getLogger(SolrTextRetriever.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String textField;
    private final long requestTimeoutMs;

    @Autowired
    public SolrTextRetriever(
            @Value("${solr.url}") String solrUrl,
            @Value("${solr.text-field:text}") String textField,
            @Value("${solr.request-timeout-ms:1000}") long requestTimeoutMs,
            ObjectMapper objectMapper
    ) {
        this(WebClient.builder().baseUrl(solrUrl).build(), textField, requestTimeoutMs, objectMapper);
    }

    public SolrTextRetriever(WebClient webClient, String textField, long requestTimeoutMs, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.textField = (textField == null || textField.isBlank()) ? "text" : textField;
        this.requestTimeoutMs = Math.max(50L, requestTimeoutMs);
    }

    @Override
    public List<RankedHit> retrieve(RetrievalQuery query, int k) {
        if (query == null || !query.hasText()) {
            throw new RetrievalException(RetrievalSource.TEXT, RetrievalFailureKind.MALFORMED_QUERY, "query text is blank");
        }
        if (k < 1) {
            throw new RetrievalException(RetrievalSource.TEXT, RetrievalFailureKind.MALFORMED_QUERY, "k must be at least 1");
        }
        String body = call(webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/select")
                        .queryParam("q", "{q}")
                        .queryParam("df", "{df}")
                        .queryParam("fl", "{fl}")
                        .queryParam("rows", k)
                        .queryParam("wt", "json")
                        .build(query.text(), textField, "id," + textField + ",score"))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofMillis(requestTimeoutMs)), "select");
        return RankedHits.rank(RetrievalSource.TEXT, parseDocs(body), k);
    }

    @Override
    public void verifySetup() {
        String body = call(webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/admin/ping")
                        .queryParam("wt", "json")
                        .build())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofMillis(requestTimeoutMs)), "ping");
        String status;
        try {
            status = objectMapper.readTree(body).path("status").asText("");
        } catch (JsonProcessingException ex) {
            throw new RetrievalException(RetrievalSource.TEXT, RetrievalFailureKind.UNAVAILABLE, "unreadable ping response", ex);
        }
        if (!"OK".equalsIgnoreCase(status)) {
            throw new RetrievalException(RetrievalSource.TEXT, RetrievalFailureKind.UNAVAILABLE, "solr ping status=" + status);
        }
        log.info("solr text index reachable text_field={}", textField);
    }

    private String call(Mono<String> request, String operation) {
        String body;
        try {
            body = request.block();
        } catch (Exception ex) {
            throw translate(ex, operation);
        }
        if (body == null || body.isBlank()) {
            throw new RetrievalException(RetrievalSource.TEXT, RetrievalFailureKind.INVALID_RESPONSE, "empty " + operation + " response");
        }
        return body;
    }

    private List<RankedHits.Candidate> parseDocs(String body) {
        JsonNode docs;
        try {
            docs = objectMapper.readTree(body).path("response").path("docs");
        } catch (JsonProcessingException ex) {
            throw new RetrievalException(RetrievalSource.TEXT, RetrievalFailureKind.INVALID_RESPONSE, "unparsable select response", ex);
        }
        if (!docs.isArray()) {
            throw new RetrievalException(RetrievalSource.TEXT, RetrievalFailureKind.INVALID_RESPONSE, "select response has no docs array");
        }
        List<RankedHits.Candidate> candidates = new ArrayList<>(docs.size());
        for (JsonNode node : docs) {
            String id = node.path("id").asText("");
            if (id.isBlank()) {
                throw new RetrievalException(RetrievalSource.TEXT, RetrievalFailureKind.INVALID_RESPONSE, "document without id in select response");
            }
            candidates.add(new RankedHits.Candidate(id, extractScore(node.get("score")), extractText(node.get(textField))));
        }
        return candidates;
    }

    private static String extractText(JsonNode textNode) {
        if (textNode == null || textNode.isNull()) {
            return "";
        }
        if (textNode.isTextual()) {
            return textNode.asText("");
        }
        if (textNode.isArray() && !textNode.isEmpty()) {
            JsonNode first = textNode.get(0);
            if (first != null && first.isTextual()) {
                return first.asText("");
            }
        }
        return "";
    }

    private static Double extractScore(JsonNode scoreNode) {
        if (scoreNode != null && scoreNode.isNumber()) {
            return scoreNode.asDouble();
        }
        if (scoreNode != null && scoreNode.isTextual()) {
            try {
                return Double.parseDouble(scoreNode.asText());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    private static RetrievalException translate(Exception ex, String operation) {
        if (BackendCalls.isTimeout(ex)) {
            return new RetrievalException(RetrievalSource.TEXT, RetrievalFailureKind.TIMEOUT, "solr " + operation + " timed out", ex);
        }
        int status = BackendCalls.statusOf(ex);
        if (status == 400) {
            return new RetrievalException(RetrievalSource.TEXT, RetrievalFailureKind.MALFORMED_QUERY, "solr rejected the query", ex);
        }
        String detail = status == 0 ? ex.toString() : "solr " + operation + " returned HTTP " + status;
        return new RetrievalException(RetrievalSource.TEXT, RetrievalFailureKind.UNAVAILABLE, detail, ex);
    }
}
