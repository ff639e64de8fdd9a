package com.rankfusion.search.model;

import java.util.Locale;

public enum RetrievalSource {
    VECTOR,
    TEXT;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
