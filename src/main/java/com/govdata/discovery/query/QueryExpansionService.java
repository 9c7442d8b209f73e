package com.govdata.discovery.query;

import com.govdata.discovery.query.QueryModels.QueryExpansion;
import com.govdata.discovery.query.QueryModels.StructuredQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;

@Component
public class QueryExpansionService {
    private static final Logger log = LoggerFactory.getLogger(QueryExpansionService.class);

    private static final Pattern FOUR_DIGITS = Pattern.compile("\\d{4}");
    private static final int TERMS_PER_DOMAIN = 3;
    private static final int MAX_SUGGESTIONS = 4;

    private static final Map<String, List<String>> SYNONYMS = synonyms();

    private static final Map<String, List<String>> REFINEMENTS = Map.of(
            DomainVocabulary.LABOUR, List.of("by state", "trends", "by age group", "and skills"),
            DomainVocabulary.HEALTH, List.of("by region", "statistics", "and demographics"),
            DomainVocabulary.HOUSING, List.of("affordability", "by location", "and income"));

    public QueryExpansion expand(StructuredQuery query) {
        try {
            return new QueryExpansion(relatedTerms(query), suggestions(query));
        } catch (RuntimeException ex) {
            log.warn("query expansion skipped: {}", ex.toString());
            return QueryExpansion.empty();
        }
    }

    public List<String> relatedTerms(StructuredQuery query) {
        LinkedHashSet<String> related = new LinkedHashSet<>();
        for (String domain : query.domains()) {
            DomainVocabulary.termsOf(domain).stream().limit(TERMS_PER_DOMAIN).forEach(related::add);
        }
        for (String keyword : query.keywords()) {
            SYNONYMS.forEach((term, synonyms) -> {
                if (keyword.contains(term) || term.contains(keyword)) {
                    related.addAll(synonyms);
                }
            });
        }
        return List.copyOf(related);
    }

    public List<String> suggestions(StructuredQuery query) {
        String text = query.originalQuery();
        List<String> suggestions = new ArrayList<>();
        for (String domain : query.domains()) {
            REFINEMENTS.getOrDefault(domain, List.of()).forEach(r -> suggestions.add(text + " " + r));
        }
        boolean hasYear = query.entities().stream().anyMatch(e -> FOUR_DIGITS.matcher(e).find());
        if (!hasYear) {
            suggestions.add(text + " in 2023");
            suggestions.add(text + " since 2015");
        }
        return suggestions.stream().limit(MAX_SUGGESTIONS).toList();
    }

    private static Map<String, List<String>> synonyms() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put("employment", List.of("jobs", "workforce", "labor"));
        map.put("unemployment", List.of("jobless", "out of work"));
        map.put("housing", List.of("accommodation", "shelter", "dwelling"));
        map.put("aged care", List.of("elderly care", "senior care", "geriatric care"));
        map.put("education", List.of("learning", "training", "qualification"));
        map.put("inequality", List.of("disparity", "gap", "imbalance"));
        return Collections.unmodifiableMap(map);
    }
}
