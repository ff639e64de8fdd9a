package com.rankfusion.search.service;

import com.rankfusion.search.model.QueryRequest;
import com.rankfusion.search.model.RetrievalSource;
import com.rankfusion.search.model.SearchRequest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Turns the loosely typed wire request into a validated {@link SearchRequest}, filling absent
 * fields from configuration. Invalid values surface as {@link com.rankfusion.search.error.ConfigException}.
 */
@Component
public class SearchRequestFactory {

    private final int defaultTopK;
    private final double defaultVectorWeight;
    private final double defaultTextWeight;
    private final int defaultRankConstant;
    private final boolean defaultDegrade;
    private final int defaultCandidateDepth;

    public SearchRequestFactory() {
        this(
                SearchRequest.DEFAULT_K,
                SearchRequest.DEFAULT_WEIGHT,
                SearchRequest.DEFAULT_WEIGHT,
                SearchRequest.DEFAULT_RANK_CONSTANT,
                true,
                SearchRequest.DEFAULT_CANDIDATE_DEPTH
        );
    }

    @Autowired
    public SearchRequestFactory(
            @Value("${search.default-top-k:10}") int defaultTopK,
            @Value("${search.fusion.vector-weight:1.0}") double defaultVectorWeight,
            @Value("${search.fusion.text-weight:1.0}") double defaultTextWeight,
            @Value("${search.fusion.rank-constant:60}") int defaultRankConstant,
            @Value("${search.degrade-on-partial-failure:true}") boolean defaultDegrade,
            @Value("${search.retrieval.candidate-depth:20}") int defaultCandidateDepth
    ) {
        this.defaultTopK = defaultTopK;
        this.defaultVectorWeight = defaultVectorWeight;
        this.defaultTextWeight = defaultTextWeight;
        this.defaultRankConstant = defaultRankConstant;
        this.defaultDegrade = defaultDegrade;
        this.defaultCandidateDepth = defaultCandidateDepth;
    }

    public SearchRequest create(QueryRequest request) {
        QueryRequest source = request == null ? new QueryRequest() : request;
        SearchRequest.Builder builder = SearchRequest.builder()
                .queryText(source.getQuery())
                .queryVector(source.getQueryVector())
                .k(orDefault(source.getTopK(), defaultTopK))
                .weight(RetrievalSource.VECTOR, orDefault(source.getVectorWeight(), defaultVectorWeight))
                .weight(RetrievalSource.TEXT, orDefault(source.getTextWeight(), defaultTextWeight))
                .rankConstant(orDefault(source.getRankConstant(), defaultRankConstant))
                .degradeOnPartialFailure(source.getDegradeOnPartialFailure() == null
                        ? defaultDegrade
                        : source.getDegradeOnPartialFailure())
                .candidateDepth(orDefault(source.getCandidateDepth(), defaultCandidateDepth));
        if (source.getTimeoutMs() != null) {
            builder.sourceTimeout(Duration.ofMillis(source.getTimeoutMs()));
        }
        return builder.build();
    }

    private static int orDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }

    private static double orDefault(Double value, double fallback) {
        return value == null ? fallback : value;
    }
}
