package com.govdata.discovery.query;

import com.govdata.discovery.query.QueryModels.Intent;
import com.govdata.discovery.query.QueryModels.StructuredQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free text into a {@link StructuredQuery}. Stateless and deterministic; never throws.
 */
@Component
public class QueryInterpreter {
    private static final Logger log = LoggerFactory.getLogger(QueryInterpreter.class);

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
            "is", "are", "was", "were", "be", "been", "being", "have", "has", "had", "do", "does", "did",
            "will", "would", "could", "should", "may", "might", "must", "can", "shall");

    private static final List<IntentRule> INTENT_RULES = List.of(
            new IntentRule(Pattern.compile("\\b(what|which|where|how many|how much)\\b"), Intent.SEARCH),
            new IntentRule(Pattern.compile("\\b(show me|tell me|give me)\\b"), Intent.SEARCH),
            new IntentRule(Pattern.compile("\\b(compare|versus|vs|difference)\\b"), Intent.COMPARISON),
            new IntentRule(Pattern.compile("\\b(trend|change|over time|since|from.*to)\\b"), Intent.TREND));

    private static final List<Pattern> ENTITY_PATTERNS = List.of(
            Pattern.compile("\\b(act|nsw|qld|sa|tas|vic|wa|nt)\\b"),
            Pattern.compile("\\b(201\\d|202\\d)\\b"),
            Pattern.compile("\\b(january|february|march|april|may|june|july|august|september|october|november|december)\\b"));

    private static final double BASE_CONFIDENCE = 0.5;
    private static final double MAX_CONFIDENCE = 0.9;

    public StructuredQuery interpret(String text) {
        String raw = text == null ? "" : text;
        try {
            String normalized = raw.toLowerCase(Locale.ROOT).trim();
            List<String> keywords = extractKeywords(normalized);
            List<String> domains = detectDomains(normalized, keywords);
            Intent intent = detectIntent(normalized);
            List<String> entities = extractEntities(normalized);
            double confidence = confidence(keywords, domains, entities);
            return new StructuredQuery(raw, keywords, domains, intent, entities, confidence);
        } catch (RuntimeException ex) {
            log.warn("query interpretation degraded to whitespace split: {}", ex.toString());
            return fallback(raw);
        }
    }

    StructuredQuery fallback(String raw) {
        List<String> tokens = Arrays.stream(WHITESPACE.split(raw.trim()))
                .filter(t -> !t.isEmpty())
                .toList();
        return new StructuredQuery(raw, tokens, List.of(), Intent.SEARCH, List.of(), BASE_CONFIDENCE);
    }

    List<String> extractKeywords(String normalized) {
        String stripped = PUNCTUATION.matcher(normalized).replaceAll(" ");
        LinkedHashSet<String> keywords = new LinkedHashSet<>();
        for (String token : WHITESPACE.split(stripped)) {
            if (token.length() > 2 && !STOP_WORDS.contains(token)) {
                keywords.add(token);
            }
        }
        return List.copyOf(keywords);
    }

    List<String> detectDomains(String normalized, List<String> keywords) {
        Map<String, Integer> scores = new LinkedHashMap<>();
        for (var entry : DomainVocabulary.TERMS.entrySet()) {
            int score = 0;
            for (String keyword : keywords) {
                if (entry.getValue().stream().anyMatch(term -> term.contains(keyword) || keyword.contains(term))) {
                    score++;
                }
            }
            if (normalized.contains(entry.getKey())) {
                score += 2;
            }
            if (score > 0) {
                scores.put(entry.getKey(), score);
            }
        }
        // stable sort, ties stay in vocabulary order
        return scores.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .map(Map.Entry::getKey)
                .toList();
    }

    Intent detectIntent(String normalized) {
        for (IntentRule rule : INTENT_RULES) {
            if (rule.pattern().matcher(normalized).find()) {
                return rule.intent();
            }
        }
        return Intent.SEARCH;
    }

    List<String> extractEntities(String normalized) {
        LinkedHashSet<String> entities = new LinkedHashSet<>();
        for (Pattern pattern : ENTITY_PATTERNS) {
            Matcher matcher = pattern.matcher(normalized);
            while (matcher.find()) {
                entities.add(matcher.group());
            }
        }
        return List.copyOf(entities);
    }

    private double confidence(List<String> keywords, List<String> domains, List<String> entities) {
        double confidence = BASE_CONFIDENCE;
        confidence += Math.min(keywords.size() * 0.1, 0.3);
        confidence += domains.size() * 0.1;
        confidence += entities.size() * 0.1;
        return Math.min(confidence, MAX_CONFIDENCE);
    }

    private record IntentRule(Pattern pattern, Intent intent) {}
}
