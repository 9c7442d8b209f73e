package com.govdata.discovery.recommendation;

import com.govdata.discovery.recommendation.RecommendationModels.Recommendation;
import com.govdata.discovery.recommendation.RecommendationModels.RecommendationSeed;
import com.govdata.discovery.recommendation.RecommendationModels.StrategyType;
import com.govdata.discovery.repository.DatasetStore;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class TrendingStrategy implements RecommendationStrategy {
    static final double PER_RELATION = 10.0;
    static final String REASON = "Trending dataset based on relationships";

    private final DatasetStore store;

    public TrendingStrategy(DatasetStore store) {
        this.store = store;
    }

    @Override
    public StrategyType type() {
        return StrategyType.TRENDING;
    }

    @Override
    public List<Recommendation> produce(RecommendationSeed seed) {
        if (seed.limit() <= 0) return List.of();
        return store.findRecentlyUpdated(seed.limit()).stream()
                .map(d -> new Recommendation(d, d.relationCount() * PER_RELATION, REASON, type()))
                .toList();
    }
}
