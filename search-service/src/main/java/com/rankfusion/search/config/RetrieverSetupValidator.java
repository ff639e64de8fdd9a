package com.rankfusion.search.config;

import com.rankfusion.search.error.RetrievalException;
import com.rankfusion.search.service.Retriever;
import com.rankfusion.search.service.TextRetriever;
import com.rankfusion.search.service.VectorRetriever;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class RetrieverSetupValidator implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(RetrieverSetupValidator.class);

    private final List<Retriever> retrievers;
    private final boolean enabled;
    private final boolean failFast;

    public RetrieverSetupValidator(
            VectorRetriever vectorRetriever,
            TextRetriever textRetriever,
            @Value("${search.setup-validation.enabled:false}") boolean enabled,
            @Value("${search.setup-validation.fail-fast:true}") boolean failFast
    ) {
        this.retrievers = List.of(vectorRetriever, textRetriever);
        this.enabled = enabled;
        this.failFast = failFast;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!enabled) {
            return;
        }
        List<RetrievalException> failures = new ArrayList<>();
        for (Retriever retriever : retrievers) {
            try {
                retriever.verifySetup();
                log.info("retriever setup validated source={}", retriever.source().label());
            } catch (RetrievalException ex) {
                log.error("retriever setup invalid source={} kind={}: {}",
                        ex.getSource().label(), ex.getKind(), ex.getMessage());
                failures.add(ex);
            }
        }
        if (!failures.isEmpty() && failFast) {
            IllegalStateException error = new IllegalStateException(
                    failures.size() + " retrieval backend(s) failed setup validation");
            failures.forEach(error::addSuppressed);
            throw error;
        }
    }
}
