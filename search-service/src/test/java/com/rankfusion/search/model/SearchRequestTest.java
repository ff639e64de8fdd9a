package com.rankfusion.search.model;

import com.rankfusion.search.error.ConfigException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchRequestTest {

    @Test
    void testDefaultsAreAppliedAtConstruction() {
        SearchRequest request = SearchRequest.ofText("space opera");

        assertThat(request.getQueryText()).contains("space opera");
        assertThat(request.getQueryVector()).isEmpty();
        assertThat(request.getK()).isEqualTo(10);
        assertThat(request.getRankConstant()).isEqualTo(60);
        assertThat(request.weightOf(RetrievalSource.VECTOR)).isEqualTo(1.0);
        assertThat(request.weightOf(RetrievalSource.TEXT)).isEqualTo(1.0);
        assertThat(request.isDegradeOnPartialFailure()).isTrue();
        assertThat(request.getCandidateDepth()).isEqualTo(20);
        assertThat(request.getSourceTimeout()).isEmpty();
    }

    @Test
    void testCandidateDepthNeverBelowK() {
        SearchRequest request = SearchRequest.builder().queryText("q").k(50).candidateDepth(20).build();

        assertThat(request.getCandidateDepth()).isEqualTo(50);
    }

    @Test
    void testVectorOnlyRequestIsAccepted() {
        SearchRequest request = SearchRequest.builder().queryVector(List.of(0.1, 0.2)).build();

        assertThat(request.getQueryText()).isEmpty();
        assertThat(request.getQueryVector()).contains(List.of(0.1, 0.2));
    }

    @Test
    void testRejectsInvalidK() {
        assertThatThrownBy(() -> SearchRequest.builder().queryText("q").k(0).build())
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("k must be at least 1");
    }

    @Test
    void testRejectsNonPositiveWeights() {
        assertThatThrownBy(() -> SearchRequest.builder().queryText("q").weight(RetrievalSource.TEXT, 0.0).build())
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("text");
        assertThatThrownBy(() -> SearchRequest.builder().queryText("q").weight(RetrievalSource.VECTOR, -1.0).build())
                .isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> SearchRequest.builder().queryText("q").weight(RetrievalSource.VECTOR, Double.NaN).build())
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void testRejectsNonPositiveRankConstant() {
        assertThatThrownBy(() -> SearchRequest.builder().queryText("q").rankConstant(0).build())
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("rank constant");
    }

    @Test
    void testRejectsMissingQuery() {
        assertThatThrownBy(() -> SearchRequest.builder().queryText("   ").build())
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void testRejectsNonPositiveTimeout() {
        assertThatThrownBy(() -> SearchRequest.builder().queryText("q").sourceTimeout(Duration.ZERO).build())
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void testToBuilderKeepsEveryField() {
        SearchRequest original = SearchRequest.builder()
                .queryText("q")
                .queryVector(List.of(1.0))
                .k(3)
                .weight(RetrievalSource.TEXT, 2.0)
                .rankConstant(10)
                .degradeOnPartialFailure(false)
                .candidateDepth(7)
                .sourceTimeout(Duration.ofMillis(250))
                .build();

        SearchRequest copy = original.toBuilder().build();

        assertThat(copy.getK()).isEqualTo(3);
        assertThat(copy.getWeights()).isEqualTo(original.getWeights());
        assertThat(copy.getRankConstant()).isEqualTo(10);
        assertThat(copy.isDegradeOnPartialFailure()).isFalse();
        assertThat(copy.getCandidateDepth()).isEqualTo(7);
        assertThat(copy.getSourceTimeout()).contains(Duration.ofMillis(250));
        assertThat(copy.getQueryVector()).contains(List.of(1.0));
    }
}
