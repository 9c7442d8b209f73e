package com.govdata.discovery.recommendation;

import com.govdata.discovery.domain.DomainModels.Dataset;
import com.govdata.discovery.domain.DomainModels.DatasetRelation;
import com.govdata.discovery.query.QueryInterpreter;
import com.govdata.discovery.recommendation.RecommendationModels.Recommendation;
import com.govdata.discovery.recommendation.RecommendationModels.StrategyType;
import com.govdata.discovery.repository.DatasetStore;
import com.govdata.discovery.support.StubDatasetStore;
import com.govdata.discovery.support.SampleDatasets;
import com.govdata.discovery.validation.RequestValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RecommendationFanOutTest {
    private final Dataset seed = SampleDatasets.dataset("seed", List.of("workforce"), List.of("labour"));
    private final Dataset linked = SampleDatasets.dataset("linked", List.of("nursing"), List.of("health"));
    private final Dataset sameDomain = SampleDatasets.dataset("peer", List.of("workforce planning"), List.of("labour"));

    private final ThreadPoolTaskExecutor executor = executor();

    @AfterEach
    void shutdown() {
        executor.shutdown();
    }

    @Test
    void slowStrategyIsDroppedAfterTimeout() {
        StubDatasetStore store = new BaseStore() {
            @Override
            public List<DatasetRelation> getRelations(String datasetId) {
                try {
                    Thread.sleep(2_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of(new DatasetRelation("r1", "seed", "linked", "feeds-into", "slow"));
            }
        };

        long started = System.currentTimeMillis();
        List<Recommendation> recs = service(store, 200).related("seed", 5);

        assertTrue(System.currentTimeMillis() - started < 1_500);
        assertTrue(recs.stream().noneMatch(r -> r.type() == StrategyType.RELATED));
        assertTrue(recs.stream().anyMatch(r -> "peer".equals(r.datasetId())));
    }

    @Test
    void saturatedExecutorDoesNotRunStrategiesOnCallerThread() throws Exception {
        ThreadPoolTaskExecutor single = new ThreadPoolTaskExecutor();
        single.setCorePoolSize(1);
        single.setMaxPoolSize(1);
        single.setQueueCapacity(0);
        single.initialize();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch busy = new CountDownLatch(1);
        single.execute(() -> {
            busy.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertTrue(busy.await(1, TimeUnit.SECONDS));

        StubDatasetStore store = new BaseStore() {
            @Override
            public List<Dataset> findByDomain(String domain, String excludeId, int limit) {
                try {
                    Thread.sleep(3_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of(sameDomain);
            }
        };

        try {
            long started = System.currentTimeMillis();
            List<Recommendation> recs = service(store, 200, single).related("seed", 5);

            assertTrue(System.currentTimeMillis() - started < 1_000);
            assertTrue(recs.isEmpty());
        } finally {
            release.countDown();
            single.shutdown();
        }
    }

    @Test
    void failingStrategyDoesNotAffectOthers() {
        StubDatasetStore store = new BaseStore() {
            @Override
            public List<Dataset> findByDomain(String domain, String excludeId, int limit) {
                throw new DataAccessResourceFailureException("database down");
            }
        };

        List<Recommendation> recs = service(store, 2_000).related("seed", 5);

        assertEquals(List.of("linked"), recs.stream().map(Recommendation::datasetId).toList());
    }

    @Test
    void failingSeedLookupGivesEmptyList() {
        StubDatasetStore store = new StubDatasetStore() {
            @Override
            public Optional<Dataset> findById(String id) {
                throw new DataAccessResourceFailureException("database down");
            }
        };

        assertTrue(service(store, 2_000).related("seed", 5).isEmpty());
        assertTrue(service(store, 2_000).complementary(List.of("seed")).isEmpty());
    }

    private RecommendationService service(DatasetStore store, long timeoutMs) {
        return service(store, timeoutMs, executor);
    }

    private RecommendationService service(DatasetStore store, long timeoutMs, Executor executor) {
        DatasetSimilarity similarity = new DatasetSimilarity();
        return new RecommendationService(store, new QueryInterpreter(), new RequestValidator(), new RecommendationMerger(),
                new DirectRelationStrategy(store), new DomainStrategy(store, similarity), new AgencyStrategy(store, similarity),
                new KeywordStrategy(store), new LiveDataStrategy(store), new TrendingStrategy(store),
                executor, timeoutMs);
    }

    private static ThreadPoolTaskExecutor executor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.setThreadNamePrefix("test-recommend-");
        executor.initialize();
        return executor;
    }

    private class BaseStore extends StubDatasetStore {
        private final Map<String, Dataset> byId = Map.of("seed", seed, "linked", linked, "peer", sameDomain);

        @Override
        public Optional<Dataset> findById(String id) {
            return Optional.ofNullable(byId.get(id));
        }

        @Override
        public List<DatasetRelation> getRelations(String datasetId) {
            return List.of(new DatasetRelation("r1", "seed", "linked", "feeds-into", "fast"));
        }

        @Override
        public List<Dataset> findByDomain(String domain, String excludeId, int limit) {
            return List.of(sameDomain);
        }
    }
}
