package com.rankfusion.search.service;

import com.rankfusion.search.error.ConfigException;
import com.rankfusion.search.model.FusedResult;
import com.rankfusion.search.model.RankedHit;
import com.rankfusion.search.model.RetrievalSource;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Weighted reciprocal rank fusion.
 *
 * <p>{@code score(d) = sum over sources s listing d of weight[s] / (C + rank_s(d))}. A source that
 * does not list a document adds nothing to it. Sources are folded in {@link RetrievalSource}
 * order and documents are keyed by id, so the output depends only on the hit lists, the weights
 * and {@code C}.
 */
@Component
public class RankFuser {

    public Map<String, FusedResult> fuse(
            Map<RetrievalSource, List<RankedHit>> hitsBySource,
            Map<RetrievalSource, Double> weights,
            int rankConstant
    ) {
        if (rankConstant <= 0) {
            throw new ConfigException("rank constant must be positive, got: " + rankConstant);
        }
        Map<String, Accumulator> byDocument = new TreeMap<>();
        for (RetrievalSource source : RetrievalSource.values()) {
            List<RankedHit> hits = hitsBySource.get(source);
            if (hits == null || hits.isEmpty()) {
                continue;
            }
            double weight = weightOf(weights, source);
            for (RankedHit hit : hits) {
                Accumulator acc = byDocument.computeIfAbsent(hit.getDocumentId(), Accumulator::new);
                acc.score += term(weight, rankConstant, hit.getRank());
                acc.ranks.put(source, hit.getRank());
                if (acc.payload.isBlank()) {
                    acc.payload = hit.getPayload();
                }
            }
        }

        Map<String, FusedResult> fused = new LinkedHashMap<>();
        for (Accumulator acc : byDocument.values()) {
            fused.put(acc.documentId, new FusedResult(acc.documentId, acc.payload, acc.score, acc.ranks));
        }
        return Collections.unmodifiableMap(fused);
    }

    public static double term(double weight, int rankConstant, int rank) {
        return weight / (rankConstant + rank);
    }

    private static double weightOf(Map<RetrievalSource, Double> weights, RetrievalSource source) {
        Double weight = weights == null ? null : weights.get(source);
        if (weight == null) {
            return 1.0;
        }
        if (weight.isNaN() || weight.isInfinite() || weight <= 0.0) {
            throw new ConfigException("weight for " + source.label() + " must be a positive number, got: " + weight);
        }
        return weight;
    }

    private static final class Accumulator {
        private final String documentId;
        private final EnumMap<RetrievalSource, Integer> ranks = new EnumMap<>(RetrievalSource.class);
        private String payload = "";
        private double score;

        private Accumulator(String documentId) {
            this.documentId = documentId;
        }
    }
}
