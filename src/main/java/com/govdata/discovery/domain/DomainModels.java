package com.govdata.discovery.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public class DomainModels {
    public record Agency(String id, String code, String name, String description, String website) {}

    public record Dataset(String id,
                          String name,
                          String description,
                          List<String> keywords,
                          List<String> domains,
                          List<String> tags,
                          Agency agency,
                          Accessibility accessibility,
                          String frequency,
                          String format,
                          String apiEndpoint,
                          String downloadUrl,
                          String dataPortalUrl,
                          LocalDate collectionDate,
                          Instant updatedAt,
                          int incomingRelations,
                          int outgoingRelations) {
        public Dataset {
            keywords = keywords == null ? List.of() : List.copyOf(keywords);
            domains = domains == null ? List.of() : List.copyOf(domains);
            tags = tags == null ? List.of() : List.copyOf(tags);
            accessibility = accessibility == null ? Accessibility.PUBLIC : accessibility;
        }

        public String agencyId() {
            return agency == null ? null : agency.id();
        }

        public String primaryDomain() {
            return domains.isEmpty() ? null : domains.get(0);
        }

        public int relationCount() {
            return incomingRelations + outgoingRelations;
        }

        public boolean apiAccessible() {
            return accessibility == Accessibility.API;
        }
    }

    public record DatasetRelation(String id, String fromId, String toId, String kind, String description) {
        public String otherEnd(String datasetId) {
            return datasetId != null && datasetId.equals(fromId) ? toId : fromId;
        }
    }

    public enum Accessibility {
        PUBLIC("public"),
        API("api"),
        REQUEST_ONLY("request-only");

        private final String value;

        Accessibility(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }

        public static Accessibility fromValue(String value) {
            if (value == null) return PUBLIC;
            for (Accessibility a : values()) {
                if (a.value.equalsIgnoreCase(value.trim())) return a;
            }
            return PUBLIC;
        }
    }
}
