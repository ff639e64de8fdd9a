package com.rankfusion.search.model;

import java.util.Objects;

public final class RankedHit {
    private final String documentId;
    private final int rank;
    private final RetrievalSource source;
    private final String payload;

    public RankedHit(String documentId, int rank, RetrievalSource source, String payload) {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("documentId must not be blank");
        }
        if (rank < 1) {
            throw new IllegalArgumentException("rank must be >= 1, got: " + rank);
        }
        this.documentId = documentId;
        this.rank = rank;
        this.source = Objects.requireNonNull(source, "source");
        this.payload = payload == null ? "" : payload;
    }

    public String getDocumentId() {
        return documentId;
    }

    public int getRank() {
        return rank;
    }

    public RetrievalSource getSource() {
        return source;
    }

    public String getPayload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RankedHit other)) {
            return false;
        }
        return rank == other.rank
                && documentId.equals(other.documentId)
                && source == other.source
                && payload.equals(other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(documentId, rank, source, payload);
    }

    @Override
    public String toString() {
        return "RankedHit{" + source.label() + ":" + documentId + "@" + rank + "}";
    }
}
