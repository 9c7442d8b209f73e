package com.govdata.discovery.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed subject-area vocabulary used to classify queries. Iteration order of {@link #TERMS}
 * is the tie-break order for equally scored domains.
 */
public final class DomainVocabulary {
    public static final String LABOUR = "labour";
    public static final String HEALTH = "health";
    public static final String HOUSING = "housing";
    public static final String EDUCATION = "education";
    public static final String AGEING = "ageing";
    public static final String INEQUALITY = "inequality";
    public static final String POPULATION = "population";

    public static final Map<String, List<String>> TERMS = build();

    private DomainVocabulary() {}

    public static List<String> termsOf(String domain) {
        return TERMS.getOrDefault(domain, List.of());
    }

    private static Map<String, List<String>> build() {
        Map<String, List<String>> terms = new LinkedHashMap<>();
        terms.put(LABOUR, List.of(
                "employment", "unemployment", "workforce", "job", "labor", "labour", "occupation",
                "wage", "salary", "income", "participation", "work", "career", "skill", "training"));
        terms.put(HEALTH, List.of(
                "health", "medical", "hospital", "disease", "wellbeing", "mental", "aged care",
                "elderly", "nursing", "doctor", "patient", "treatment", "medicine"));
        terms.put(HOUSING, List.of(
                "housing", "home", "property", "rent", "mortgage", "affordable", "homeless",
                "accommodation", "dwelling", "real estate", "rental", "household"));
        terms.put(EDUCATION, List.of(
                "education", "school", "university", "training", "learning", "student",
                "teacher", "qualification", "degree", "course", "skill development"));
        terms.put(AGEING, List.of(
                "ageing", "elderly", "senior", "retirement", "pension", "aged", "population ageing",
                "longevity", "geriatric", "older people"));
        terms.put(INEQUALITY, List.of(
                "inequality", "poverty", "wealth", "disparity", "gap", "distribution", "equity",
                "socioeconomic", "disadvantage", "income distribution"));
        terms.put(POPULATION, List.of(
                "population", "demographic", "census", "birth", "death", "migration", "fertility",
                "mortality", "age structure", "regional"));
        return Collections.unmodifiableMap(terms);
    }
}
