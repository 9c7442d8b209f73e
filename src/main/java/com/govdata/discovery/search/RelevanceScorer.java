package com.govdata.discovery.search;

import com.govdata.discovery.domain.DomainModels.Dataset;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Additive, rule-based relevance score. Exact substring hits dominate, keyword overlap and
 * tag hits follow, and well-connected datasets get a per-relation boost.
 */
@Component
public class RelevanceScorer {
    static final double NAME_MATCH = 100;
    static final double DESCRIPTION_MATCH = 50;
    static final double KEYWORD_MATCH = 25;
    static final double TAG_MATCH = 20;
    static final double PER_RELATION = 10;

    public double score(Dataset dataset, String rawQuery, List<String> keywords) {
        if (dataset == null) return 0.0;
        String query = lower(rawQuery).trim();
        double score = 0.0;

        if (!query.isEmpty() && lower(dataset.name()).contains(query)) {
            score += NAME_MATCH;
        }
        if (!query.isEmpty() && lower(dataset.description()).contains(query)) {
            score += DESCRIPTION_MATCH;
        }

        if (keywords != null) {
            for (String term : keywords) {
                String t = lower(term);
                if (t.isEmpty()) continue;
                boolean matched = dataset.keywords().stream()
                        .map(RelevanceScorer::lower)
                        .anyMatch(k -> !k.isEmpty() && (k.contains(t) || t.contains(k)));
                if (matched) score += KEYWORD_MATCH;
            }
        }

        if (!query.isEmpty()) {
            for (String tag : dataset.tags()) {
                if (lower(tag).contains(query)) score += TAG_MATCH;
            }
        }

        score += PER_RELATION * Math.max(0, dataset.relationCount());
        return score;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
