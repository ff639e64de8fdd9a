package com.rankfusion.search.service;

import com.rankfusion.search.model.FusedResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

@Component
public class ResultAssembler {

    // Score first, then documents seen by more sources, then smallest id.
    static final Comparator<FusedResult> RESULT_ORDER = Comparator
            .comparingDouble(FusedResult::getFusedScore).reversed()
            .thenComparing(Comparator.comparingInt(FusedResult::sourceCount).reversed())
            .thenComparing(FusedResult::getDocumentId);

    public List<FusedResult> assemble(Collection<FusedResult> fused, int k) {
        if (fused == null || fused.isEmpty() || k < 1) {
            return List.of();
        }
        List<FusedResult> ordered = new ArrayList<>(fused);
        ordered.sort(RESULT_ORDER);
        if (ordered.size() <= k) {
            return List.copyOf(ordered);
        }
        return List.copyOf(ordered.subList(0, k));
    }
}
