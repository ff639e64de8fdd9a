package com.rankfusion.search.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rankfusion.search.error.RetrievalException;
import com.rankfusion.search.error.RetrievalFailureKind;
import com.rankfusion.search.model.RankedHit;
import com.rankfusion.search.model.RetrievalQuery;
import com.rankfusion.search.model.RetrievalSource;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SolrTextRetrieverTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testRanksDocumentsByScoreAndSendsSelectQuery() {
        StubBackend backend = StubBackend.ok("""
                {"response":{"numFound":3,"docs":[
                  {"id":"doc-2","text":"second","score":1.5},
                  {"id":"doc-1","text":["first","ignored"],"score":3.25},
                  {"id":"doc-3","score":"0.5"}
                ]}}
                """);
        SolrTextRetriever retriever = new SolrTextRetriever(backend.webClient(), "text", 1000, objectMapper);

        List<RankedHit> hits = retriever.retrieve(new RetrievalQuery("time travel", null), 5);

        assertThat(hits).extracting(RankedHit::getDocumentId).containsExactly("doc-1", "doc-2", "doc-3");
        assertThat(hits).extracting(RankedHit::getRank).containsExactly(1, 2, 3);
        assertThat(hits).allSatisfy(hit -> assertThat(hit.getSource()).isEqualTo(RetrievalSource.TEXT));
        assertThat(hits.get(0).getPayload()).isEqualTo("first");
        assertThat(hits.get(2).getPayload()).isEmpty();

        assertThat(backend.lastRequest().method()).isEqualTo(HttpMethod.GET);
        assertThat(backend.lastRequest().url().getPath()).isEqualTo("/select");
        assertThat(backend.lastRequest().url().getQuery())
                .contains("q=time travel")
                .contains("df=text")
                .contains("fl=id,text,score")
                .contains("rows=5")
                .contains("wt=json");
    }

    @Test
    void testKeepsBackendOrderWhenScoresAreMissing() {
        StubBackend backend = StubBackend.ok("""
                {"response":{"docs":[{"id":"b"},{"id":"a","score":9.0},{"id":"b"},{"id":"c"}]}}
                """);
        SolrTextRetriever retriever = new SolrTextRetriever(backend.webClient(), "text", 1000, objectMapper);

        List<RankedHit> hits = retriever.retrieve(new RetrievalQuery("q", null), 2);

        assertThat(hits).extracting(RankedHit::getDocumentId).containsExactly("b", "a");
    }

    @Test
    void testDocumentWithoutIdIsInvalidResponse() {
        StubBackend backend = StubBackend.ok("{\"response\":{\"docs\":[{\"text\":\"orphan\"}]}}");
        SolrTextRetriever retriever = new SolrTextRetriever(backend.webClient(), "text", 1000, objectMapper);

        assertFailure(() -> retriever.retrieve(new RetrievalQuery("q", null), 3), RetrievalFailureKind.INVALID_RESPONSE);
    }

    @Test
    void testMissingDocsArrayIsInvalidResponse() {
        StubBackend backend = StubBackend.ok("{\"error\":{\"msg\":\"boom\"}}");
        SolrTextRetriever retriever = new SolrTextRetriever(backend.webClient(), "text", 1000, objectMapper);

        assertFailure(() -> retriever.retrieve(new RetrievalQuery("q", null), 3), RetrievalFailureKind.INVALID_RESPONSE);
    }

    @Test
    void testBadRequestIsMalformedQuery() {
        StubBackend backend = StubBackend.answering(HttpStatus.BAD_REQUEST, "{\"error\":{\"msg\":\"syntax\"}}");
        SolrTextRetriever retriever = new SolrTextRetriever(backend.webClient(), "text", 1000, objectMapper);

        assertFailure(() -> retriever.retrieve(new RetrievalQuery("title:(", null), 3), RetrievalFailureKind.MALFORMED_QUERY);
    }

    @Test
    void testServerErrorIsUnavailable() {
        StubBackend backend = StubBackend.answering(HttpStatus.SERVICE_UNAVAILABLE, "{}");
        SolrTextRetriever retriever = new SolrTextRetriever(backend.webClient(), "text", 1000, objectMapper);

        assertFailure(() -> retriever.retrieve(new RetrievalQuery("q", null), 3), RetrievalFailureKind.UNAVAILABLE);
    }

    @Test
    void testSlowBackendIsTimeout() {
        StubBackend backend = StubBackend.hanging();
        SolrTextRetriever retriever = new SolrTextRetriever(backend.webClient(), "text", 50, objectMapper);

        assertFailure(() -> retriever.retrieve(new RetrievalQuery("q", null), 3), RetrievalFailureKind.TIMEOUT);
    }

    @Test
    void testBlankTextIsRejectedWithoutCallingSolr() {
        StubBackend backend = StubBackend.ok("{}");
        SolrTextRetriever retriever = new SolrTextRetriever(backend.webClient(), "text", 1000, objectMapper);

        assertFailure(() -> retriever.retrieve(new RetrievalQuery("  ", List.of(0.1)), 3), RetrievalFailureKind.MALFORMED_QUERY);
        assertThat(backend.requestCount()).isZero();
    }

    @Test
    void testVerifySetupRequiresOkPing() {
        SolrTextRetriever healthy = new SolrTextRetriever(
                StubBackend.ok("{\"status\":\"OK\"}").webClient(), "text", 1000, objectMapper);
        SolrTextRetriever unhealthy = new SolrTextRetriever(
                StubBackend.ok("{\"status\":\"FAIL\"}").webClient(), "text", 1000, objectMapper);

        assertThatCode(healthy::verifySetup).doesNotThrowAnyException();
        assertThatThrownBy(unhealthy::verifySetup).isInstanceOf(RetrievalException.class);
    }

    private static void assertFailure(Runnable call, RetrievalFailureKind kind) {
        assertThatThrownBy(call::run)
                .isInstanceOfSatisfying(RetrievalException.class, ex -> {
                    assertThat(ex.getSource()).isEqualTo(RetrievalSource.TEXT);
                    assertThat(ex.getKind()).isEqualTo(kind);
                });
    }
}
