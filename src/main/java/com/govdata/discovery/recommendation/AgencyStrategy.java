package com.govdata.discovery.recommendation;

import com.govdata.discovery.domain.DomainModels.Dataset;
import com.govdata.discovery.recommendation.RecommendationModels.Recommendation;
import com.govdata.discovery.recommendation.RecommendationModels.RecommendationSeed;
import com.govdata.discovery.recommendation.RecommendationModels.StrategyType;
import com.govdata.discovery.repository.DatasetStore;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class AgencyStrategy implements RecommendationStrategy {
    static final int FETCH_LIMIT = 5;
    static final double SIMILARITY_WEIGHT = 0.6;

    private final DatasetStore store;
    private final DatasetSimilarity similarity;

    public AgencyStrategy(DatasetStore store, DatasetSimilarity similarity) {
        this.store = store;
        this.similarity = similarity;
    }

    @Override
    public StrategyType type() {
        return StrategyType.AGENCY;
    }

    @Override
    public List<Recommendation> produce(RecommendationSeed seed) {
        if (!seed.hasDataset() || seed.dataset().agencyId() == null) return List.of();
        Dataset source = seed.dataset();
        String reason = "From same agency: " + source.agency().name();
        return store.findByAgency(source.agencyId(), source.id(), FETCH_LIMIT).stream()
                .map(d -> new Recommendation(d, similarity.similarity(source, d) * SIMILARITY_WEIGHT, reason, type()))
                .toList();
    }
}
