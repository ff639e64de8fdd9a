package com.rankfusion.search.error;

import com.rankfusion.search.model.RetrievalSource;

/**
 * One source that did not produce a hit list for a call. {@code error} is the exception raised on
 * the source's behalf, an {@link EmbeddingException} when the vector could not be derived.
 */
public record SourceFailure(RetrievalSource source, RetrievalFailureKind kind, RuntimeException error) {

    public static SourceFailure of(RetrievalException ex) {
        return new SourceFailure(ex.getSource(), ex.getKind(), ex);
    }

    public static SourceFailure of(RetrievalSource source, EmbeddingException ex) {
        return new SourceFailure(source, RetrievalFailureKind.EMBEDDING_FAILED, ex);
    }

    public String describe() {
        return source.label() + "=" + kind + " (" + error.getMessage() + ")";
    }
}
