package com.todayatsg.backend.config;

import com.todayatsg.backend.exception.FetchException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The single retry policy injected into the source fetcher.
 */
@Configuration
@Slf4j
public class RetryPolicyConfig {

    public static final String SOURCE_FETCH = "sourceFetch";

    @Bean
    public RetryRegistry retryRegistry(ScrapingConfig scrapingConfig) {
        return RetryRegistry.of(sourceFetchRetryConfig(scrapingConfig));
    }

    @Bean
    public Retry sourceFetchRetry(RetryRegistry retryRegistry) {
        Retry retry = retryRegistry.retry(SOURCE_FETCH);
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying fetch (attempt {}) after {}: {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }

    /**
     * Bounded exponential backoff; only failures flagged transient are retried.
     */
    public static RetryConfig sourceFetchRetryConfig(ScrapingConfig scrapingConfig) {
        return RetryConfig.custom()
                .maxAttempts(Math.max(1, scrapingConfig.getMaxRetries()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Math.max(1L, scrapingConfig.getRetryInitialDelayMillis()),
                        Math.max(1.0, scrapingConfig.getRetryBackoffMultiplier())))
                .retryOnException(e -> e instanceof FetchException fetchException && fetchException.isTransient())
                .failAfterMaxAttempts(false)
                .build();
    }
}
