package com.rankfusion.search.error;

import java.util.Objects;

public class EmbeddingException extends RuntimeException {

    public enum Kind {
        RATE_LIMITED,
        INVALID_INPUT,
        UNAVAILABLE
    }

    private final Kind kind;

    public EmbeddingException(Kind kind, String message) {
        this(kind, message, null);
    }

    public EmbeddingException(Kind kind, String message, Throwable cause) {
        super("embedding failed [" + kind + "]: " + message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind getKind() {
        return kind;
    }
}
