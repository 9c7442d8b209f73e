package com.govdata.discovery.search;

import com.govdata.discovery.domain.DomainModels.Dataset;
import com.govdata.discovery.query.QueryModels.QueryExpansion;
import com.govdata.discovery.query.QueryModels.StructuredQuery;

import java.util.List;

public class SearchModels {
    public record RankedDataset(Dataset dataset, double relevanceScore) {}

    public record SearchResponse(String query,
                                 List<RankedDataset> results,
                                 int total,
                                 NlpSummary nlp) {}

    public record NlpSummary(StructuredQuery processedQuery, List<String> relatedTerms, List<String> suggestions) {
        public static NlpSummary of(StructuredQuery query, QueryExpansion expansion) {
            return new NlpSummary(query, expansion.relatedTerms(), expansion.suggestions());
        }
    }
}
