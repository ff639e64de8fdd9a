package com.rankfusion.search.service;

import com.rankfusion.search.model.RetrievalSource;

public interface TextRetriever extends Retriever {

    @Override
    default RetrievalSource source() {
        return RetrievalSource.TEXT;
    }
}
