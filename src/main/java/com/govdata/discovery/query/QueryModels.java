package com.govdata.discovery.query;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

public class QueryModels {
    public record StructuredQuery(String originalQuery,
                                  List<String> keywords,
                                  List<String> domains,
                                  Intent intent,
                                  List<String> entities,
                                  double confidence) {
        public StructuredQuery {
            keywords = keywords == null ? List.of() : List.copyOf(keywords);
            domains = domains == null ? List.of() : List.copyOf(domains);
            entities = entities == null ? List.of() : List.copyOf(entities);
            intent = intent == null ? Intent.SEARCH : intent;
        }
    }

    public record QueryExpansion(List<String> relatedTerms, List<String> suggestions) {
        public static QueryExpansion empty() {
            return new QueryExpansion(List.of(), List.of());
        }
    }

    public enum Intent {
        SEARCH, COMPARISON, TREND;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
