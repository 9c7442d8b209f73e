package com.govdata.discovery.recommendation;

import com.fasterxml.jackson.annotation.JsonValue;
import com.govdata.discovery.domain.DomainModels.Dataset;

import java.util.List;
import java.util.Locale;

public class RecommendationModels {
    public record Recommendation(Dataset dataset, double score, String reason, StrategyType type) {
        public String datasetId() {
            return dataset == null ? null : dataset.id();
        }
    }

    /**
     * Input shared by every strategy. A dataset seed drives the relation, domain and agency
     * strategies; domains and keywords describe a search context.
     */
    public record RecommendationSeed(Dataset dataset, List<String> domains, List<String> keywords, int limit) {
        public RecommendationSeed {
            domains = domains == null ? List.of() : List.copyOf(domains);
            keywords = keywords == null ? List.of() : List.copyOf(keywords);
        }

        public static RecommendationSeed forDataset(Dataset dataset) {
            return new RecommendationSeed(dataset, List.of(), List.of(), 0);
        }

        public static RecommendationSeed forContext(List<String> domains, List<String> keywords) {
            return new RecommendationSeed(null, domains, keywords, 0);
        }

        public static RecommendationSeed unseeded(int limit) {
            return new RecommendationSeed(null, List.of(), List.of(), limit);
        }

        public boolean hasDataset() {
            return dataset != null;
        }
    }

    public record RecommendationRequest(RecommendationKind kind,
                                        String datasetId,
                                        String query,
                                        List<String> domains,
                                        List<String> keywords,
                                        List<String> datasetIds,
                                        int limit) {
        public RecommendationRequest {
            domains = domains == null ? List.of() : List.copyOf(domains);
            keywords = keywords == null ? List.of() : List.copyOf(keywords);
            datasetIds = datasetIds == null ? List.of() : List.copyOf(datasetIds);
        }
    }

    public record RecommendationResponse(RecommendationKind type, List<Recommendation> recommendations, int total) {}

    public enum StrategyType {
        RELATED, DOMAIN, KEYWORD, AGENCY, TRENDING;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum RecommendationKind {
        RELATED, SEARCH, TRENDING, COMPLEMENTARY;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static RecommendationKind fromValue(String value) {
            if (value == null) return null;
            for (RecommendationKind kind : values()) {
                if (kind.value().equalsIgnoreCase(value.trim())) return kind;
            }
            return null;
        }
    }
}
