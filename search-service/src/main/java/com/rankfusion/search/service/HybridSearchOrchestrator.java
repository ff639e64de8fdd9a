package com.rankfusion.search.service;

import com.rankfusion.search.error.EmbeddingException;
import com.rankfusion.search.error.HybridSearchException;
import com.rankfusion.search.error.RetrievalException;
import com.rankfusion.search.error.RetrievalFailureKind;
import com.rankfusion.search.error.SearchCancelledException;
import com.rankfusion.search.error.SourceFailure;
import com.rankfusion.search.model.FusedResult;
import com.rankfusion.search.model.RankedHit;
import com.rankfusion.search.model.RetrievalQuery;
import com.rankfusion.search.model.RetrievalSource;
import com.rankfusion.search.model.SearchRequest;
import com.rankfusion.search.model.SearchResponse;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class HybridSearchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(HybridSearchOrchestrator.class);

    public static final Duration DEFAULT_SOURCE_TIMEOUT = Duration.ofMillis(1000);

    private final VectorRetriever vectorRetriever;
    private final TextRetriever textRetriever;
    private final QueryEmbedder queryEmbedder;
    private final RankFuser rankFuser;
    private final ResultAssembler resultAssembler;
    private final ExecutorService retrievalExecutor;
    private final MeterRegistry meterRegistry;
    private final Duration vectorTimeout;
    private final Duration textTimeout;

    public HybridSearchOrchestrator(
            VectorRetriever vectorRetriever,
            TextRetriever textRetriever,
            ExecutorService retrievalExecutor
    ) {
        this(
                vectorRetriever,
                textRetriever,
                null,
                new RankFuser(),
                new ResultAssembler(),
                retrievalExecutor,
                null,
                DEFAULT_SOURCE_TIMEOUT,
                DEFAULT_SOURCE_TIMEOUT
        );
    }

    public HybridSearchOrchestrator(
            VectorRetriever vectorRetriever,
            TextRetriever textRetriever,
            QueryEmbedder queryEmbedder,
            RankFuser rankFuser,
            ResultAssembler resultAssembler,
            ExecutorService retrievalExecutor,
            MeterRegistry meterRegistry,
            Duration vectorTimeout,
            Duration textTimeout
    ) {
        this.vectorRetriever = Objects.requireNonNull(vectorRetriever, "vectorRetriever");
        this.textRetriever = Objects.requireNonNull(textRetriever, "textRetriever");
        if (vectorRetriever.source() != RetrievalSource.VECTOR || textRetriever.source() != RetrievalSource.TEXT) {
            throw new IllegalArgumentException("retrievers must serve the vector and text sources respectively");
        }
        this.queryEmbedder = queryEmbedder;
        this.rankFuser = Objects.requireNonNull(rankFuser, "rankFuser");
        this.resultAssembler = Objects.requireNonNull(resultAssembler, "resultAssembler");
        this.retrievalExecutor = Objects.requireNonNull(retrievalExecutor, "retrievalExecutor");
        this.meterRegistry = meterRegistry;
        this.vectorTimeout = positiveOrDefault(vectorTimeout);
        this.textTimeout = positiveOrDefault(textTimeout);
    }

    public SearchResponse executeHybridSearch(SearchRequest request) {
        return executeHybridSearch(request, UUID.randomUUID().toString());
    }

    public SearchResponse executeHybridSearch(SearchRequest request, String traceId) {
        Objects.requireNonNull(request, "request");
        String effectiveTraceId = (traceId == null || traceId.isBlank()) ? UUID.randomUUID().toString() : traceId;
        long totalStart = System.nanoTime();
        Phase phase = Phase.IDLE;
        log.info(
                "trace_id={} event=query_start query=\"{}\" has_vector={} top_k={} depth={} degrade={}",
                effectiveTraceId,
                sanitizeForLog(request.getQueryText().orElse(null)),
                request.getQueryVector().isPresent(),
                request.getK(),
                request.getCandidateDepth(),
                request.isDegradeOnPartialFailure()
        );

        RetrievalQuery query = new RetrievalQuery(
                request.getQueryText().orElse(null),
                request.getQueryVector().orElse(null)
        );
        int depth = request.getCandidateDepth();
        Map<RetrievalSource, SourceCall> calls = new EnumMap<>(RetrievalSource.class);
        calls.put(RetrievalSource.VECTOR, dispatch(
                RetrievalSource.VECTOR,
                () -> retrieveVector(query, depth),
                request.getSourceTimeout().orElse(vectorTimeout)
        ));
        calls.put(RetrievalSource.TEXT, dispatch(
                RetrievalSource.TEXT,
                () -> textRetriever.retrieve(query, depth),
                request.getSourceTimeout().orElse(textTimeout)
        ));
        phase = transition(effectiveTraceId, phase, Phase.DISPATCHED);
        phase = transition(effectiveTraceId, phase, Phase.AWAITING_SOURCES);

        Map<RetrievalSource, List<RankedHit>> hitsBySource = new EnumMap<>(RetrievalSource.class);
        List<SourceFailure> failures = new ArrayList<>();
        try {
            for (RetrievalSource source : RetrievalSource.values()) {
                SourceCall call = calls.get(source);
                try {
                    List<RankedHit> hits = await(call, depth);
                    hitsBySource.put(source, hits);
                    logStage(effectiveTraceId, call, "SUCCESS", hits.size());
                } catch (RetrievalException ex) {
                    failures.add(SourceFailure.of(ex));
                    logStage(effectiveTraceId, call, ex.getKind().name(), 0);
                } catch (EmbeddingException ex) {
                    failures.add(SourceFailure.of(source, ex));
                    logStage(effectiveTraceId, call, RetrievalFailureKind.EMBEDDING_FAILED.name(), 0);
                }
            }
        } catch (InterruptedException ex) {
            calls.values().forEach(SourceCall::cancel);
            Thread.currentThread().interrupt();
            transition(effectiveTraceId, phase, Phase.FAILED);
            incrementCounter("hybrid_search_cancelled_total");
            log.info("trace_id={} event=query_cancelled total_ms={}", effectiveTraceId, elapsedMillis(totalStart));
            throw new SearchCancelledException("hybrid search cancelled before both sources settled");
        }

        for (SourceFailure failure : failures) {
            incrementCounter("retrieval_failure_total", "source", failure.source().label(), "kind", failure.kind().name());
        }
        boolean degraded = !failures.isEmpty();
        if (degraded && (hitsBySource.isEmpty() || !request.isDegradeOnPartialFailure())) {
            transition(effectiveTraceId, phase, Phase.FAILED);
            incrementCounter("hybrid_search_failed_total");
            HybridSearchException error = new HybridSearchException(failures);
            log.warn(
                    "trace_id={} event=query_failed total_ms={} reason=\"{}\"",
                    effectiveTraceId,
                    elapsedMillis(totalStart),
                    error.getMessage()
            );
            throw error;
        }
        if (degraded) {
            incrementCounter("hybrid_search_degraded_total");
            for (SourceFailure failure : failures) {
                log.warn(
                        "trace_id={} event=source_degraded source={} kind={} cause=\"{}\"",
                        effectiveTraceId,
                        failure.source().label(),
                        failure.kind(),
                        failure.error().getMessage()
                );
            }
        }

        phase = transition(effectiveTraceId, phase, Phase.FUSING);
        long fuseStart = System.nanoTime();
        Map<String, FusedResult> fused = rankFuser.fuse(hitsBySource, request.getWeights(), request.getRankConstant());
        List<FusedResult> results = resultAssembler.assemble(fused.values(), request.getK());
        recordTimer("fusion_duration_ms", fuseStart);
        log.info(
                "trace_id={} stage=fusion duration_ms={} union_docs={} ranked_docs={}",
                effectiveTraceId,
                elapsedMillis(fuseStart),
                fused.size(),
                results.size()
        );

        Duration elapsed = Duration.ofNanos(System.nanoTime() - totalStart);
        transition(effectiveTraceId, phase, Phase.COMPLETE);
        recordTimer("hybrid_search_latency_ms", totalStart);
        Map<RetrievalSource, RetrievalFailureKind> failedSources = new EnumMap<>(RetrievalSource.class);
        failures.forEach(f -> failedSources.put(f.source(), f.kind()));
        log.info(
                "trace_id={} event=query_complete total_ms={} top_k={} status={}",
                effectiveTraceId,
                elapsed.toNanos() / 1_000_000.0,
                request.getK(),
                executionStatus(failures)
        );
        return new SearchResponse(results, elapsed, degraded, failedSources);
    }

    /**
     * Runs {@link #executeHybridSearch(SearchRequest)} off the calling thread. Cancelling the
     * returned future before both sources settle cancels the in-flight retrievals and skips fusion.
     */
    public CompletableFuture<SearchResponse> executeHybridSearchAsync(SearchRequest request) {
        return executeHybridSearchAsync(request, UUID.randomUUID().toString());
    }

    public CompletableFuture<SearchResponse> executeHybridSearchAsync(SearchRequest request, String traceId) {
        CompletableFuture<SearchResponse> result = new CompletableFuture<>();
        Future<?> coordinator = retrievalExecutor.submit(() -> {
            try {
                result.complete(executeHybridSearch(request, traceId));
            } catch (RuntimeException ex) {
                result.completeExceptionally(ex);
            }
        });
        result.whenComplete((ignored, ex) -> {
            if (result.isCancelled()) {
                coordinator.cancel(true);
            }
        });
        return result;
    }

    private List<RankedHit> retrieveVector(RetrievalQuery query, int depth) {
        RetrievalQuery effective = query;
        if (!query.hasVector()) {
            if (queryEmbedder == null || !query.hasText()) {
                throw new RetrievalException(
                        RetrievalSource.VECTOR,
                        RetrievalFailureKind.MALFORMED_QUERY,
                        "no query vector supplied and none can be derived"
                );
            }
            long embedStart = System.nanoTime();
            effective = query.withVector(queryEmbedder.embed(query.text()));
            recordTimer("query_embedding_latency_ms", embedStart);
        }
        return vectorRetriever.retrieve(effective, depth);
    }

    private SourceCall dispatch(RetrievalSource source, Callable<List<RankedHit>> task, Duration timeout) {
        SourceCall call = new SourceCall(source, timeout, System.nanoTime());
        call.future = retrievalExecutor.submit(() -> {
            try {
                return task.call();
            } finally {
                call.settledNanos = System.nanoTime();
                recordTimer("retrieval_latency_ms", call.dispatchedNanos, "source", source.label());
            }
        });
        return call;
    }

    private static List<RankedHit> await(SourceCall call, int depth) throws InterruptedException {
        long remainingNanos = Math.max(0L, call.deadlineNanos() - System.nanoTime());
        List<RankedHit> hits;
        try {
            hits = call.future.get(remainingNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            call.cancel();
            throw new RetrievalException(
                    call.source,
                    RetrievalFailureKind.TIMEOUT,
                    "no answer within " + call.timeout.toMillis() + " ms",
                    ex
            );
        } catch (CancellationException ex) {
            throw new RetrievalException(call.source, RetrievalFailureKind.UNAVAILABLE, "retrieval was cancelled", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof RetrievalException retrievalException) {
                throw retrievalException;
            }
            if (cause instanceof EmbeddingException embeddingException) {
                throw embeddingException;
            }
            throw new RetrievalException(call.source, RetrievalFailureKind.UNAVAILABLE, cause.toString(), cause);
        }
        RankedHits.validate(call.source, hits, depth);
        return hits;
    }

    private static Phase transition(String traceId, Phase from, Phase to) {
        log.debug("trace_id={} event=phase from={} to={}", traceId, from, to);
        return to;
    }

    private static void logStage(String traceId, SourceCall call, String outcome, int hits) {
        log.info(
                "trace_id={} stage={}_search duration_ms={} outcome={} hits={}",
                traceId,
                call.source.label(),
                call.durationMs(),
                outcome,
                hits
        );
    }

    private static String executionStatus(List<SourceFailure> failures) {
        if (failures.isEmpty()) {
            return "SUCCESS";
        }
        SourceFailure failure = failures.get(0);
        return "PARTIAL_" + failure.source().name() + "_" + failure.kind().name();
    }

    private static Duration positiveOrDefault(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            return DEFAULT_SOURCE_TIMEOUT;
        }
        return timeout;
    }

    private void recordTimer(String metricName, long startNanos, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.timer(metricName, tags).record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    private void incrementCounter(String metricName, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName, tags).increment();
    }

    private static String sanitizeForLog(String query) {
        if (query == null) {
            return "";
        }
        String trimmed = query.trim().replaceAll("\\s+", " ");
        return trimmed.length() > 120 ? trimmed.substring(0, 120) + "..." : trimmed;
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    enum Phase {
        IDLE,
        DISPATCHED,
        AWAITING_SOURCES,
        FUSING,
        COMPLETE,
        FAILED
    }

    private static final class SourceCall {
        private final RetrievalSource source;
        private final Duration timeout;
        private final long dispatchedNanos;
        private volatile long settledNanos;
        private Future<List<RankedHit>> future;

        private SourceCall(RetrievalSource source, Duration timeout, long dispatchedNanos) {
            this.source = source;
            this.timeout = timeout;
            this.dispatchedNanos = dispatchedNanos;
        }

        private long deadlineNanos() {
            return dispatchedNanos + timeout.toNanos();
        }

        private double durationMs() {
            long end = settledNanos == 0L ? System.nanoTime() : settledNanos;
            return (end - dispatchedNanos) / 1_000_000.0;
        }

        private void cancel() {
            if (future != null) {
                future.cancel(true);
            }
        }
    }
}
