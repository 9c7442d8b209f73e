package com.govdata.discovery.recommendation;

import com.govdata.discovery.domain.DomainModels.Dataset;
import com.govdata.discovery.recommendation.RecommendationModels.Recommendation;
import com.govdata.discovery.recommendation.RecommendationModels.RecommendationSeed;
import com.govdata.discovery.recommendation.RecommendationModels.StrategyType;
import com.govdata.discovery.repository.DatasetStore;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Datasets whose keywords contain any of the search keywords. The score grows with the
 * number of search keywords the dataset matches.
 */
@Component
public class KeywordStrategy implements RecommendationStrategy {
    static final int FETCH_LIMIT = 8;
    static final double BASE_SCORE = 0.5;
    static final double PER_MATCH = 0.1;

    private final DatasetStore store;

    public KeywordStrategy(DatasetStore store) {
        this.store = store;
    }

    @Override
    public StrategyType type() {
        return StrategyType.KEYWORD;
    }

    @Override
    public List<Recommendation> produce(RecommendationSeed seed) {
        if (seed.keywords().isEmpty()) return List.of();
        return store.findByKeywords(seed.keywords(), FETCH_LIMIT).stream()
                .map(d -> {
                    long matches = matchCount(d, seed.keywords());
                    return new Recommendation(d, BASE_SCORE + matches * PER_MATCH, "Matches " + matches + " search terms", type());
                })
                .toList();
    }

    static long matchCount(Dataset dataset, List<String> keywords) {
        List<String> own = dataset.keywords().stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
        return keywords.stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .filter(k -> own.stream().anyMatch(o -> o.contains(k)))
                .count();
    }
}
