package com.rankfusion.search.service;

import java.util.List;

public interface QueryEmbedder {

    /**
     * @throws com.rankfusion.search.error.EmbeddingException when the provider rejects or cannot
     *     serve the request
     */
    List<Double> embed(String text);
}
