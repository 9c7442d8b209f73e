package com.govdata.discovery.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class RecommendationExecutorConfig {
    @Bean(name = "recommendationExecutor")
    public ThreadPoolTaskExecutor recommendationExecutor(@Value("${recommendation.executor.core-pool-size:4}") int corePoolSize,
                                                         @Value("${recommendation.executor.max-pool-size:8}") int maxPoolSize,
                                                         @Value("${recommendation.executor.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(Math.max(corePoolSize, maxPoolSize));
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("recommend-");
        executor.initialize();
        return executor;
    }
}
