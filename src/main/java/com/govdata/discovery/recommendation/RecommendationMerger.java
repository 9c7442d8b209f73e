package com.govdata.discovery.recommendation;

import com.govdata.discovery.recommendation.RecommendationModels.Recommendation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Joins strategy outputs: the first recommendation for a dataset wins, then a stable sort by
 * score keeps strategy order among equal scores.
 */
@Component
public class RecommendationMerger {
    public List<Recommendation> merge(List<List<Recommendation>> batches, Collection<String> excludedIds, int limit) {
        if (limit <= 0) return List.of();
        Set<String> seen = new HashSet<>(excludedIds == null ? Set.of() : excludedIds);
        List<Recommendation> merged = new ArrayList<>();
        for (List<Recommendation> batch : batches) {
            for (Recommendation r : batch) {
                if (r.datasetId() != null && seen.add(r.datasetId())) {
                    merged.add(r);
                }
            }
        }
        merged.sort(Comparator.comparingDouble(Recommendation::score).reversed());
        return merged.size() > limit ? List.copyOf(merged.subList(0, limit)) : merged;
    }
}
