package com.rankfusion.search.error;

import com.rankfusion.search.model.RetrievalSource;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

public class HybridSearchException extends RuntimeException {

    private final List<SourceFailure> failures;

    public HybridSearchException(List<SourceFailure> failures) {
        super("hybrid search failed: " + failures.stream()
                .map(SourceFailure::describe)
                .collect(Collectors.joining(", ")));
        this.failures = List.copyOf(failures);
        failures.forEach(f -> addSuppressed(f.error()));
    }

    public List<SourceFailure> getFailures() {
        return failures;
    }

    public Optional<SourceFailure> failureFor(RetrievalSource source) {
        return failures.stream().filter(f -> f.source() == source).findFirst();
    }
}
