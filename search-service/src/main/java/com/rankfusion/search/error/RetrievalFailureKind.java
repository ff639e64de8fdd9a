package com.rankfusion.search.error;

public enum RetrievalFailureKind {
    TIMEOUT,
    UNAVAILABLE,
    MALFORMED_QUERY,
    INVALID_RESPONSE,
    EMBEDDING_FAILED
}
