package com.rankfusion.search.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

public final class FusedResult {
    private final String documentId;
    private final String payload;
    private final double fusedScore;
    private final Map<RetrievalSource, Integer> contributingRanks;

    public FusedResult(
            String documentId,
            String payload,
            double fusedScore,
            Map<RetrievalSource, Integer> contributingRanks
    ) {
        this.documentId = Objects.requireNonNull(documentId, "documentId");
        this.payload = payload == null ? "" : payload;
        this.fusedScore = fusedScore;
        EnumMap<RetrievalSource, Integer> ranks = new EnumMap<>(RetrievalSource.class);
        if (contributingRanks != null) {
            ranks.putAll(contributingRanks);
        }
        this.contributingRanks = Collections.unmodifiableMap(ranks);
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getPayload() {
        return payload;
    }

    public double getFusedScore() {
        return fusedScore;
    }

    public Map<RetrievalSource, Integer> getContributingRanks() {
        return contributingRanks;
    }

    public int sourceCount() {
        return contributingRanks.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FusedResult other)) {
            return false;
        }
        return Double.compare(fusedScore, other.fusedScore) == 0
                && documentId.equals(other.documentId)
                && payload.equals(other.payload)
                && contributingRanks.equals(other.contributingRanks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(documentId, payload, fusedScore, contributingRanks);
    }

    @Override
    public String toString() {
        return "FusedResult{" + documentId + " score=" + fusedScore + " ranks=" + contributingRanks + "}";
    }
}
