package com.govdata.discovery.recommendation;

import com.govdata.discovery.domain.DomainModels.DatasetRelation;
import com.govdata.discovery.recommendation.RecommendationModels.Recommendation;
import com.govdata.discovery.recommendation.RecommendationModels.RecommendationSeed;
import com.govdata.discovery.recommendation.RecommendationModels.StrategyType;
import com.govdata.discovery.repository.DatasetStore;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Datasets explicitly linked to the seed, in either direction. Outgoing links come first.
 */
@Component
public class DirectRelationStrategy implements RecommendationStrategy {
    static final double SCORE = 1.0;
    static final String FALLBACK_REASON = "Direct relationship";

    private final DatasetStore store;

    public DirectRelationStrategy(DatasetStore store) {
        this.store = store;
    }

    @Override
    public StrategyType type() {
        return StrategyType.RELATED;
    }

    @Override
    public List<Recommendation> produce(RecommendationSeed seed) {
        if (!seed.hasDataset()) return List.of();
        String seedId = seed.dataset().id();

        List<Recommendation> out = new ArrayList<>();
        for (DatasetRelation relation : store.getRelations(seedId)) {
            String otherId = relation.otherEnd(seedId);
            if (otherId == null || otherId.equals(seedId)) continue;
            store.findById(otherId).ifPresent(other -> out.add(new Recommendation(other, SCORE, reason(relation), type())));
        }
        return out;
    }

    private String reason(DatasetRelation relation) {
        String description = relation.description();
        return relation.kind() + ": " + (description == null || description.isBlank() ? FALLBACK_REASON : description);
    }
}
