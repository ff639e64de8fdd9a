package com.rankfusion.search.service;

import com.rankfusion.search.model.RetrievalSource;

public interface VectorRetriever extends Retriever {

    @Override
    default RetrievalSource source() {
        return RetrievalSource.VECTOR;
    }
}
