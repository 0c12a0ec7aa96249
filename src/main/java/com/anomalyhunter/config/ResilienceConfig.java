package com.anomalyhunter.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j decorators, built programmatically from our own properties.
 *
 * <ul>
 *   <li><b>Circuit breaker</b> ({@code oracle}): opens after the configured failure rate in a
 *       10-call window, so an unreachable oracle stops costing a timeout per detector</li>
 *   <li><b>Time limiter</b> ({@code oracle}): bounds each oracle call; expiry means fallback</li>
 *   <li><b>Retry</b> ({@code learningStore}): exponential backoff for learning-state writes</li>
 * </ul>
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public CircuitBreaker oracleCircuitBreaker(OracleProperties oracleProperties) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .failureRateThreshold(oracleProperties.getFailureRateThreshold())
                .waitDurationInOpenState(oracleProperties.getWaitInOpenState())
                .build();
        return CircuitBreaker.of("oracle", config);
    }

    @Bean
    public TimeLimiter oracleTimeLimiter(OracleProperties oracleProperties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(oracleProperties.getTimeout())
                .cancelRunningFuture(true)
                .build();
        return TimeLimiter.of("oracle", config);
    }

    @Bean
    public Retry learningStoreRetry(LearningProperties learningProperties) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(learningProperties.getPersistenceMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        learningProperties.getPersistenceInitialBackoff().toMillis(), 2.0))
                .build();
        return Retry.of("learningStore", config);
    }
}
