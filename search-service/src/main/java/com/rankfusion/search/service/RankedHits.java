package com.rankfusion.search.service;

import com.rankfusion.search.error.RetrievalException;
import com.rankfusion.search.error.RetrievalFailureKind;
import com.rankfusion.search.model.RankedHit;
import com.rankfusion.search.model.RetrievalSource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class RankedHits {

    private RankedHits() {
    }

    /**
     * Converts backend candidates into a ranked hit list. Candidates are ordered by score, highest
     * first, when every candidate carries one; otherwise the backend order is kept. A repeated
     * document id keeps its first position.
     */
    public static List<RankedHit> rank(RetrievalSource source, List<Candidate> candidates, int k) {
        List<Candidate> ordered = new ArrayList<>(candidates);
        boolean allScored = ordered.stream().allMatch(c -> c.score() != null);
        if (allScored) {
            ordered.sort(Comparator.comparingDouble((Candidate c) -> c.score()).reversed());
        }

        List<RankedHit> hits = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Candidate candidate : ordered) {
            if (hits.size() >= k) {
                break;
            }
            if (!seen.add(candidate.documentId())) {
                continue;
            }
            hits.add(new RankedHit(candidate.documentId(), hits.size() + 1, source, candidate.payload()));
        }
        return List.copyOf(hits);
    }

    public static void validate(RetrievalSource source, List<RankedHit> hits, int k) {
        if (hits == null) {
            throw invalid(source, "retriever returned no hit list");
        }
        if (hits.size() > k) {
            throw invalid(source, "expected at most " + k + " hits, got " + hits.size());
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < hits.size(); i++) {
            RankedHit hit = hits.get(i);
            if (hit == null) {
                throw invalid(source, "null hit at position " + (i + 1));
            }
            if (hit.getSource() != source) {
                throw invalid(source, "hit " + hit.getDocumentId() + " is tagged " + hit.getSource());
            }
            if (hit.getRank() != i + 1) {
                throw invalid(source, "rank " + hit.getRank() + " found at position " + (i + 1));
            }
            if (!seen.add(hit.getDocumentId())) {
                throw invalid(source, "duplicate document id " + hit.getDocumentId());
            }
        }
    }

    private static RetrievalException invalid(RetrievalSource source, String message) {
        return new RetrievalException(source, RetrievalFailureKind.INVALID_RESPONSE, message);
    }

    public record Candidate(String documentId, Double score, String payload) {
    }
}
