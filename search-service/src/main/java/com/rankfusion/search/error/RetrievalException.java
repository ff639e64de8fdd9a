package com.rankfusion.search.error;

import com.rankfusion.search.model.RetrievalSource;

import java.util.Objects;

public class RetrievalException extends RuntimeException {

    private final RetrievalSource source;
    private final RetrievalFailureKind kind;

    public RetrievalException(RetrievalSource source, RetrievalFailureKind kind, String message) {
        this(source, kind, message, null);
    }

    public RetrievalException(RetrievalSource source, RetrievalFailureKind kind, String message, Throwable cause) {
        super(source.label() + " retrieval failed [" + kind + "]: " + message, cause);
        this.source = Objects.requireNonNull(source, "source");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public RetrievalSource getSource() {
        return source;
    }

    public RetrievalFailureKind getKind() {
        return kind;
    }
}
