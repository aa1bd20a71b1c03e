package com.queryengine.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wiring for the pieces Spring Boot does not autoconfigure.
 */
@Configuration
@EnableConfigurationProperties(QueryEngineProperties.class)
public class QueryEngineConfig {

    /**
     * Runs the two halves of a period comparison and fire-and-forget cache writes.
     */
    @Bean(name = "analyticsTaskExecutor")
    public AsyncTaskExecutor analyticsTaskExecutor(QueryEngineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecutor().getCorePoolSize());
        executor.setMaxPoolSize(properties.getExecutor().getMaxPoolSize());
        executor.setQueueCapacity(properties.getExecutor().getQueueCapacity());
        executor.setThreadNamePrefix("analytics-query-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean
    public Retry analyticsQueryRetry(QueryEngineProperties properties) {
        return analyticsRetry(properties.getRetry());
    }

    /**
     * Retries only failures Spring classifies as transient: connection resets,
     * deadlock losers, lock and query timeouts.
     */
    public static Retry analyticsRetry(QueryEngineProperties.Retry settings) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Math.max(1, settings.getInitialBackoffMs()),
                        settings.getBackoffMultiplier()))
                .retryOnException(QueryEngineConfig::isTransient)
                .build();
        return Retry.of("analyticsQuery", config);
    }

    public static boolean isTransient(Throwable e) {
        return e instanceof TransientDataAccessException
                || e instanceof RecoverableDataAccessException
                // PostgreSQL reports a reset connection as SQLState 08xxx
                || e instanceof DataAccessResourceFailureException;
    }
}
