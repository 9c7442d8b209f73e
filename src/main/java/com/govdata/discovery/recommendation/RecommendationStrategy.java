package com.govdata.discovery.recommendation;

import com.govdata.discovery.recommendation.RecommendationModels.Recommendation;
import com.govdata.discovery.recommendation.RecommendationModels.RecommendationSeed;
import com.govdata.discovery.recommendation.RecommendationModels.StrategyType;

import java.util.List;

/**
 * One independent way of proposing related datasets. A strategy returns an empty list when
 * the seed lacks what it needs; store failures propagate to the caller, which drops the
 * strategy's output for that request.
 */
public interface RecommendationStrategy {
    StrategyType type();

    List<Recommendation> produce(RecommendationSeed seed);
}
