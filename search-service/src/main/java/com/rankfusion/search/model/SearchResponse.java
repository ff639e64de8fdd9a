package com.rankfusion.search.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.rankfusion.search.error.RetrievalFailureKind;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class SearchResponse {
    private final List<FusedResult> results;
    private final Duration elapsedTime;
    private final boolean degraded;
    private final Map<RetrievalSource, RetrievalFailureKind> failedSources;

    public SearchResponse(
            List<FusedResult> results,
            Duration elapsedTime,
            boolean degraded,
            Map<RetrievalSource, RetrievalFailureKind> failedSources
    ) {
        this.results = List.copyOf(results);
        this.elapsedTime = elapsedTime == null ? Duration.ZERO : elapsedTime;
        this.degraded = degraded;
        EnumMap<RetrievalSource, RetrievalFailureKind> failures = new EnumMap<>(RetrievalSource.class);
        if (failedSources != null) {
            failures.putAll(failedSources);
        }
        this.failedSources = Collections.unmodifiableMap(failures);
    }

    public List<FusedResult> getResults() {
        return results;
    }

    @JsonIgnore
    public Duration getElapsedTime() {
        return elapsedTime;
    }

    public double getElapsedMs() {
        return elapsedTime.toNanos() / 1_000_000.0;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public Map<RetrievalSource, RetrievalFailureKind> getFailedSources() {
        return failedSources;
    }
}
