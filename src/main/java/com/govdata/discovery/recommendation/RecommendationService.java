package com.govdata.discovery.recommendation;

import com.govdata.discovery.domain.DomainModels.Dataset;
import com.govdata.discovery.query.QueryInterpreter;
import com.govdata.discovery.query.QueryModels.StructuredQuery;
import com.govdata.discovery.recommendation.RecommendationModels.Recommendation;
import com.govdata.discovery.recommendation.RecommendationModels.RecommendationRequest;
import com.govdata.discovery.recommendation.RecommendationModels.RecommendationResponse;
import com.govdata.discovery.recommendation.RecommendationModels.RecommendationSeed;
import com.govdata.discovery.repository.DatasetStore;
import com.govdata.discovery.validation.RequestValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

@Service
public class RecommendationService {
    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    static final int COMPLEMENTARY_PER_DATASET = 2;
    static final int COMPLEMENTARY_LIMIT = 5;

    private final DatasetStore store;
    private final QueryInterpreter interpreter;
    private final RequestValidator validator;
    private final RecommendationMerger merger;
    private final DirectRelationStrategy directRelation;
    private final DomainStrategy domain;
    private final AgencyStrategy agency;
    private final KeywordStrategy keyword;
    private final LiveDataStrategy liveData;
    private final TrendingStrategy trending;
    private final Executor executor;
    private final long strategyTimeoutMs;

    public RecommendationService(DatasetStore store,
                                 QueryInterpreter interpreter,
                                 RequestValidator validator,
                                 RecommendationMerger merger,
                                 DirectRelationStrategy directRelation,
                                 DomainStrategy domain,
                                 AgencyStrategy agency,
                                 KeywordStrategy keyword,
                                 LiveDataStrategy liveData,
                                 TrendingStrategy trending,
                                 @Qualifier("recommendationExecutor") Executor executor,
                                 @Value("${recommendation.strategy-timeout-ms:2000}") long strategyTimeoutMs) {
        this.store = store;
        this.interpreter = interpreter;
        this.validator = validator;
        this.merger = merger;
        this.directRelation = directRelation;
        this.domain = domain;
        this.agency = agency;
        this.keyword = keyword;
        this.liveData = liveData;
        this.trending = trending;
        this.executor = executor;
        this.strategyTimeoutMs = Math.max(1, strategyTimeoutMs);
    }

    public RecommendationResponse recommend(RecommendationRequest request) {
        validator.requireValid(validator.validateRecommendation(request));
        long started = System.currentTimeMillis();

        List<Recommendation> recommendations = switch (request.kind()) {
            case RELATED -> related(request.datasetId(), request.limit());
            case SEARCH -> forSearch(request.query(), request.domains(), request.keywords(), request.limit());
            case TRENDING -> trending(request.limit());
            case COMPLEMENTARY -> complementary(request.datasetIds());
        };

        log.info("event=recommend kind={} returned={} duration_ms={}",
                request.kind().value(), recommendations.size(), System.currentTimeMillis() - started);
        return new RecommendationResponse(request.kind(), recommendations, recommendations.size());
    }

    public List<Recommendation> related(String datasetId, int limit) {
        Optional<Dataset> seed = loadSeed(datasetId);
        if (seed.isEmpty()) return List.of();
        RecommendationSeed input = RecommendationSeed.forDataset(seed.get());
        List<List<Recommendation>> batches = runAll(List.of(
                task(directRelation, input),
                task(domain, input),
                task(agency, input)));
        return merger.merge(batches, Set.of(datasetId), limit);
    }

    public List<Recommendation> forSearch(String query, List<String> domains, List<String> keywords, int limit) {
        List<String> effectiveDomains = domains == null ? List.of() : domains;
        List<String> effectiveKeywords = keywords == null ? List.of() : keywords;
        if (effectiveDomains.isEmpty() && effectiveKeywords.isEmpty() && query != null && !query.isBlank()) {
            StructuredQuery structured = interpreter.interpret(query);
            effectiveDomains = structured.domains();
            effectiveKeywords = structured.keywords();
        }
        RecommendationSeed input = RecommendationSeed.forContext(effectiveDomains, effectiveKeywords);
        List<List<Recommendation>> batches = runAll(List.of(
                task(domain, input),
                task(keyword, input),
                task(liveData, input)));
        return merger.merge(batches, Set.of(), limit);
    }

    public List<Recommendation> trending(int limit) {
        List<List<Recommendation>> batches = runAll(List.of(task(trending, RecommendationSeed.unseeded(limit))));
        return merger.merge(batches, Set.of(), limit);
    }

    public List<Recommendation> complementary(List<String> datasetIds) {
        Set<String> ids = new LinkedHashSet<>(datasetIds);
        List<StrategyTask> tasks = ids.stream()
                .map(id -> new StrategyTask("related:" + id, () -> topDirectRelations(id)))
                .toList();
        return merger.merge(runAll(tasks), ids, COMPLEMENTARY_LIMIT);
    }

    private List<Recommendation> topDirectRelations(String datasetId) {
        return store.findById(datasetId)
                .map(d -> merger.merge(List.of(directRelation.produce(RecommendationSeed.forDataset(d))),
                        Set.of(datasetId), COMPLEMENTARY_PER_DATASET))
                .orElse(List.of());
    }

    private Optional<Dataset> loadSeed(String datasetId) {
        try {
            return store.findById(datasetId);
        } catch (RuntimeException ex) {
            log.warn("event=recommend_seed_failed dataset_id={} cause={}", datasetId, ex.toString());
            return Optional.empty();
        }
    }

    private StrategyTask task(RecommendationStrategy strategy, RecommendationSeed seed) {
        return new StrategyTask(strategy.getClass().getSimpleName(), () -> strategy.produce(seed));
    }

    /**
     * Starts every task on the executor, then waits for each one in submission order. All tasks
     * share one deadline, so a request waits at most one timeout in total. A task the executor
     * rejects contributes nothing.
     */
    private List<List<Recommendation>> runAll(List<StrategyTask> tasks) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(strategyTimeoutMs);
        List<CompletableFuture<List<Recommendation>>> futures = new ArrayList<>(tasks.size());
        for (StrategyTask t : tasks) {
            futures.add(submit(t));
        }

        List<List<Recommendation>> batches = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            batches.add(await(tasks.get(i).name(), futures.get(i), deadline));
        }
        return batches;
    }

    private CompletableFuture<List<Recommendation>> submit(StrategyTask task) {
        try {
            return CompletableFuture.supplyAsync(task.body(), executor);
        } catch (RejectedExecutionException ex) {
            log.warn("event=strategy_rejected strategy={} cause={}", task.name(), ex.toString());
            return CompletableFuture.completedFuture(List.of());
        }
    }

    private List<Recommendation> await(String name, CompletableFuture<List<Recommendation>> future, long deadline) {
        long remaining = Math.max(0, deadline - System.nanoTime());
        try {
            List<Recommendation> result = future.get(remaining, TimeUnit.NANOSECONDS);
            return result == null ? List.of() : result;
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("event=strategy_timeout strategy={} timeout_ms={}", name, strategyTimeoutMs);
            return List.of();
        } catch (ExecutionException ex) {
            log.warn("event=strategy_failed strategy={} cause={}", name, String.valueOf(ex.getCause()));
            return List.of();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("event=strategy_interrupted strategy={}", name);
            return List.of();
        }
    }

    private record StrategyTask(String name, Supplier<List<Recommendation>> body) {}
}
