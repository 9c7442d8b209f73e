package com.govdata.discovery.search;

import com.govdata.discovery.domain.DomainModels.Dataset;
import com.govdata.discovery.query.QueryExpansionService;
import com.govdata.discovery.query.QueryInterpreter;
import com.govdata.discovery.query.QueryModels.StructuredQuery;
import com.govdata.discovery.repository.DatasetStore;
import com.govdata.discovery.search.SearchModels.NlpSummary;
import com.govdata.discovery.search.SearchModels.RankedDataset;
import com.govdata.discovery.search.SearchModels.SearchResponse;
import com.govdata.discovery.validation.RequestValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
public class SearchService {
    private static final Logger log = LoggerFactory.getLogger(SearchService.class);

    private final QueryInterpreter interpreter;
    private final QueryExpansionService expansionService;
    private final RelevanceScorer scorer;
    private final DatasetStore store;
    private final RequestValidator validator;
    private final int maxResults;

    public SearchService(QueryInterpreter interpreter,
                         QueryExpansionService expansionService,
                         RelevanceScorer scorer,
                         DatasetStore store,
                         RequestValidator validator,
                         @Value("${search.max-results:20}") int maxResults) {
        this.interpreter = interpreter;
        this.expansionService = expansionService;
        this.scorer = scorer;
        this.store = store;
        this.validator = validator;
        this.maxResults = Math.max(1, maxResults);
    }

    public SearchResponse search(String text, String domainFilter, String agencyFilter) {
        validator.requireValid(validator.validateSearch(text));

        StructuredQuery query = interpreter.interpret(text);
        List<Dataset> candidates = fetchCandidates(query, domainFilter, agencyFilter);

        // List.sort is stable, so equal scores keep the store's newest-first order
        List<RankedDataset> ranked = new ArrayList<>(candidates.stream()
                .map(d -> new RankedDataset(d, scorer.score(d, text, query.keywords())))
                .toList());
        ranked.sort(Comparator.comparingDouble(RankedDataset::relevanceScore).reversed());

        log.info("event=search query=\"{}\" keywords={} domains={} intent={} results={}",
                text, query.keywords().size(), query.domains(), query.intent(), ranked.size());
        return new SearchResponse(text, ranked, ranked.size(), NlpSummary.of(query, expansionService.expand(query)));
    }

    private List<Dataset> fetchCandidates(StructuredQuery query, String domainFilter, String agencyFilter) {
        List<String> terms = new ArrayList<>();
        terms.add(query.originalQuery().trim());
        terms.addAll(query.keywords());
        terms.addAll(query.domains());
        try {
            return store.findByTextMatch(terms, emptyToNull(domainFilter), emptyToNull(agencyFilter), maxResults);
        } catch (RuntimeException ex) {
            log.warn("event=search_fetch_failed query=\"{}\" cause={}", query.originalQuery(), ex.toString());
            return List.of();
        }
    }

    private String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
