package com.govdata.discovery.recommendation;

import com.govdata.discovery.recommendation.RecommendationModels.Recommendation;
import com.govdata.discovery.recommendation.RecommendationModels.RecommendationSeed;
import com.govdata.discovery.recommendation.RecommendationModels.StrategyType;
import com.govdata.discovery.repository.DatasetStore;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * A few API-accessible datasets appended to search-context recommendations.
 */
@Component
public class LiveDataStrategy implements RecommendationStrategy {
    static final int FETCH_LIMIT = 3;
    static final double SCORE = 0.6;
    static final String REASON = "Live data available";

    private final DatasetStore store;

    public LiveDataStrategy(DatasetStore store) {
        this.store = store;
    }

    @Override
    public StrategyType type() {
        return StrategyType.KEYWORD;
    }

    @Override
    public List<Recommendation> produce(RecommendationSeed seed) {
        return store.findApiAccessible(FETCH_LIMIT).stream()
                .map(d -> new Recommendation(d, SCORE, REASON, type()))
                .toList();
    }
}
