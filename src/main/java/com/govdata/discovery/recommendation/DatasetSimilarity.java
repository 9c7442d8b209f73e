package com.govdata.discovery.recommendation;

import com.govdata.discovery.domain.DomainModels.Dataset;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Additive similarity between two datasets. Unbounded; more shared signals means a larger value.
 */
@Component
public class DatasetSimilarity {
    static final double PER_SHARED_DOMAIN = 0.3;
    static final double PER_OVERLAPPING_KEYWORD = 0.2;
    static final double PER_SHARED_TAG = 0.25;
    static final double SAME_AGENCY = 0.1;
    static final double BOTH_API = 0.15;

    public double similarity(Dataset a, Dataset b) {
        if (a == null || b == null) return 0.0;
        double similarity = 0.0;

        long sharedDomains = a.domains().stream().filter(b.domains()::contains).count();
        similarity += sharedDomains * PER_SHARED_DOMAIN;

        List<String> otherKeywords = b.keywords().stream().map(DatasetSimilarity::lower).toList();
        long overlappingKeywords = a.keywords().stream()
                .map(DatasetSimilarity::lower)
                .filter(k -> otherKeywords.stream().anyMatch(k2 -> k2.contains(k) || k.contains(k2)))
                .count();
        similarity += overlappingKeywords * PER_OVERLAPPING_KEYWORD;

        long sharedTags = a.tags().stream().filter(b.tags()::contains).count();
        similarity += sharedTags * PER_SHARED_TAG;

        if (a.agencyId() != null && Objects.equals(a.agencyId(), b.agencyId())) {
            similarity += SAME_AGENCY;
        }
        if (a.apiAccessible() && b.apiAccessible()) {
            similarity += BOTH_API;
        }
        return similarity;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
