package com.govdata.discovery.recommendation;

import com.govdata.discovery.domain.DomainModels.Dataset;
import com.govdata.discovery.recommendation.RecommendationModels.Recommendation;
import com.govdata.discovery.recommendation.RecommendationModels.RecommendationSeed;
import com.govdata.discovery.recommendation.RecommendationModels.StrategyType;
import com.govdata.discovery.repository.DatasetStore;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Datasets sharing the seed's primary domain. For a search context the first detected
 * domain is used and every hit gets a flat score.
 */
@Component
public class DomainStrategy implements RecommendationStrategy {
    static final int FETCH_LIMIT = 10;
    static final double MIN_SIMILARITY = 0.3;
    static final double SIMILARITY_WEIGHT = 0.8;
    static final double CONTEXT_SCORE = 0.7;

    private final DatasetStore store;
    private final DatasetSimilarity similarity;

    public DomainStrategy(DatasetStore store, DatasetSimilarity similarity) {
        this.store = store;
        this.similarity = similarity;
    }

    @Override
    public StrategyType type() {
        return StrategyType.DOMAIN;
    }

    @Override
    public List<Recommendation> produce(RecommendationSeed seed) {
        if (seed.hasDataset()) {
            return fromDataset(seed.dataset());
        }
        if (seed.domains().isEmpty()) return List.of();
        String domain = seed.domains().get(0);
        return store.findByDomain(domain, null, FETCH_LIMIT).stream()
                .map(d -> new Recommendation(d, CONTEXT_SCORE, "Popular in " + domain + " domain", type()))
                .toList();
    }

    private List<Recommendation> fromDataset(Dataset source) {
        String domain = source.primaryDomain();
        if (domain == null) return List.of();
        return store.findByDomain(domain, source.id(), FETCH_LIMIT).stream()
                .map(d -> new Scored(d, similarity.similarity(source, d)))
                .filter(s -> s.similarity() > MIN_SIMILARITY)
                .map(s -> new Recommendation(s.dataset(), s.similarity() * SIMILARITY_WEIGHT, "Same domain: " + domain, type()))
                .toList();
    }

    private record Scored(Dataset dataset, double similarity) {}
}
