package com.rankfusion.search.model;

import com.rankfusion.search.error.ConfigException;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class SearchRequest {
    public static final int DEFAULT_K = 10;
    public static final int DEFAULT_RANK_CONSTANT = 60;
    public static final int DEFAULT_CANDIDATE_DEPTH = 20;
    public static final double DEFAULT_WEIGHT = 1.0;

    private final String queryText;
    private final List<Double> queryVector;
    private final int k;
    private final Map<RetrievalSource, Double> weights;
    private final int rankConstant;
    private final boolean degradeOnPartialFailure;
    private final int candidateDepth;
    private final Duration sourceTimeout;

    private SearchRequest(Builder builder) {
        boolean hasText = builder.queryText != null && !builder.queryText.isBlank();
        boolean hasVector = builder.queryVector != null && !builder.queryVector.isEmpty();
        if (!hasText && !hasVector) {
            throw new ConfigException("query text or query vector is required");
        }
        if (builder.k < 1) {
            throw new ConfigException("k must be at least 1, got: " + builder.k);
        }
        if (builder.rankConstant <= 0) {
            throw new ConfigException("rank constant must be positive, got: " + builder.rankConstant);
        }
        if (builder.candidateDepth < 1) {
            throw new ConfigException("candidate depth must be at least 1, got: " + builder.candidateDepth);
        }
        if (builder.sourceTimeout != null
                && (builder.sourceTimeout.isNegative() || builder.sourceTimeout.isZero())) {
            throw new ConfigException("source timeout must be positive, got: " + builder.sourceTimeout);
        }
        EnumMap<RetrievalSource, Double> resolvedWeights = new EnumMap<>(RetrievalSource.class);
        for (RetrievalSource source : RetrievalSource.values()) {
            Double weight = builder.weights.getOrDefault(source, DEFAULT_WEIGHT);
            if (weight == null || weight.isNaN() || weight.isInfinite() || weight <= 0.0) {
                throw new ConfigException("weight for " + source.label() + " must be a positive number, got: " + weight);
            }
            resolvedWeights.put(source, weight);
        }
        if (hasVector) {
            for (Double component : builder.queryVector) {
                if (component == null || component.isNaN() || component.isInfinite()) {
                    throw new ConfigException("query vector contains a non-finite component");
                }
            }
        }

        this.queryText = hasText ? builder.queryText : null;
        this.queryVector = hasVector ? List.copyOf(builder.queryVector) : null;
        this.k = builder.k;
        this.weights = Collections.unmodifiableMap(resolvedWeights);
        this.rankConstant = builder.rankConstant;
        this.degradeOnPartialFailure = builder.degradeOnPartialFailure;
        this.candidateDepth = Math.max(builder.candidateDepth, builder.k);
        this.sourceTimeout = builder.sourceTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SearchRequest ofText(String queryText) {
        return builder().queryText(queryText).build();
    }

    public Optional<String> getQueryText() {
        return Optional.ofNullable(queryText);
    }

    public Optional<List<Double>> getQueryVector() {
        return Optional.ofNullable(queryVector);
    }

    public int getK() {
        return k;
    }

    public Map<RetrievalSource, Double> getWeights() {
        return weights;
    }

    public double weightOf(RetrievalSource source) {
        return weights.get(source);
    }

    public int getRankConstant() {
        return rankConstant;
    }

    public boolean isDegradeOnPartialFailure() {
        return degradeOnPartialFailure;
    }

    public int getCandidateDepth() {
        return candidateDepth;
    }

    public Optional<Duration> getSourceTimeout() {
        return Optional.ofNullable(sourceTimeout);
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .queryText(queryText)
                .queryVector(queryVector)
                .k(k)
                .rankConstant(rankConstant)
                .degradeOnPartialFailure(degradeOnPartialFailure)
                .candidateDepth(candidateDepth)
                .sourceTimeout(sourceTimeout);
        weights.forEach(builder::weight);
        return builder;
    }

    public static final class Builder {
        private String queryText;
        private List<Double> queryVector;
        private int k = DEFAULT_K;
        private final Map<RetrievalSource, Double> weights = new EnumMap<>(RetrievalSource.class);
        private int rankConstant = DEFAULT_RANK_CONSTANT;
        private boolean degradeOnPartialFailure = true;
        private int candidateDepth = DEFAULT_CANDIDATE_DEPTH;
        private Duration sourceTimeout;

        private Builder() {
        }

        public Builder queryText(String queryText) {
            this.queryText = queryText;
            return this;
        }

        public Builder queryVector(List<Double> queryVector) {
            this.queryVector = queryVector;
            return this;
        }

        public Builder k(int k) {
            this.k = k;
            return this;
        }

        public Builder weight(RetrievalSource source, double weight) {
            this.weights.put(source, weight);
            return this;
        }

        public Builder rankConstant(int rankConstant) {
            this.rankConstant = rankConstant;
            return this;
        }

        public Builder degradeOnPartialFailure(boolean degradeOnPartialFailure) {
            this.degradeOnPartialFailure = degradeOnPartialFailure;
            return this;
        }

        public Builder candidateDepth(int candidateDepth) {
            this.candidateDepth = candidateDepth;
            return this;
        }

        public Builder sourceTimeout(Duration sourceTimeout) {
            this.sourceTimeout = sourceTimeout;
            return this;
        }

        public SearchRequest build() {
            return new SearchRequest(this);
        }
    }
}
