package com.rankfusion.search.controller;

import com.rankfusion.search.model.QueryRequest;
import com.rankfusion.search.model.SearchRequest;
import com.rankfusion.search.model.SearchResponse;
import com.rankfusion.search.service.HybridSearchOrchestrator;
import com.rankfusion.search.service.SearchRequestFactory;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/search")
@CrossOrigin(origins = "*")
public class QueryController {

    private final HybridSearchOrchestrator orchestrator;
    private final SearchRequestFactory searchRequestFactory;

    public QueryController(HybridSearchOrchestrator orchestrator, SearchRequestFactory searchRequestFactory) {
        this.orchestrator = orchestrator;
        this.searchRequestFactory = searchRequestFactory;
    }

    @PostMapping
    public SearchResponse search(
            @RequestBody QueryRequest request,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceId
    ) {
        String effectiveTraceId = (traceId == null || traceId.isBlank()) ? UUID.randomUUID().toString() : traceId;
        SearchRequest searchRequest = searchRequestFactory.create(request);
        return orchestrator.executeHybridSearch(searchRequest, effectiveTraceId);
    }
}
