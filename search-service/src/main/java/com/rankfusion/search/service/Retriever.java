package com.rankfusion.search.service;

import com.rankfusion.search.model.RankedHit;
import com.rankfusion.search.model.RetrievalQuery;
import com.rankfusion.search.model.RetrievalSource;

import java.util.List;

/**
 * Adapter to an external ranked-retrieval backend.
 *
 * <p>{@link #retrieve} returns hits ordered by the backend's relevance, ranked 1..n with n &lt;= k
 * and no repeated document ids. Any failure, including a response that cannot be turned into a
 * complete ranking, is raised as a {@link com.rankfusion.search.error.RetrievalException}.
 */
public interface Retriever {

    RetrievalSource source();

    List<RankedHit> retrieve(RetrievalQuery query, int k);

    void verifySetup();
}
