package com.rankfusion.search.model;

import java.util.List;

/**
 * Modality payloads handed to a retriever for one call; either side may be null.
 */
public record RetrievalQuery(String text, List<Double> vector) {

    public RetrievalQuery {
        vector = vector == null ? null : List.copyOf(vector);
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    public boolean hasVector() {
        return vector != null && !vector.isEmpty();
    }

    public RetrievalQuery withVector(List<Double> derived) {
        return new RetrievalQuery(text, derived);
    }
}
