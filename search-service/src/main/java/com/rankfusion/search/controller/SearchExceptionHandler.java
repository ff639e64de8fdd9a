package com.rankfusion.search.controller;

import com.rankfusion.search.error.ConfigException;
import com.rankfusion.search.error.HybridSearchException;
import com.rankfusion.search.error.SearchCancelledException;
import com.rankfusion.search.error.SourceFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps search failures to RFC 9457 problem details. Request validation errors become 400; a search
 * that could not be served from any usable source becomes 503 with the failed sources listed.
 */
@RestControllerAdvice
public class SearchExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(SearchExceptionHandler.class);

    @ExceptionHandler(ConfigException.class)
    ProblemDetail handleConfig(ConfigException ex) {
        return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(HybridSearchException.class)
    ProblemDetail handleSearchFailure(HybridSearchException ex) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
        Map<String, String> failures = new LinkedHashMap<>();
        for (SourceFailure failure : ex.getFailures()) {
            failures.put(failure.source().name(), failure.kind().name());
        }
        problem.setProperty("failedSources", failures);
        return problem;
    }

    @ExceptionHandler(SearchCancelledException.class)
    ProblemDetail handleCancelled(SearchCancelledException ex) {
        log.info("search request cancelled: {}", ex.getMessage());
        return ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }
}
