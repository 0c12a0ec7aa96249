package com.anomalyhunter.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis configuration for durable learning state.
 *
 * <p>Values are stored as plain strings (numbers, or JSON written by the repository's own
 * mapper), so no type information ends up in Redis and the data stays readable from
 * {@code redis-cli}.
 *
 * <p>All keys are prefixed with "anomaly:" because the Redis server may be shared.
 *
 * <p>Key schema:
 * <pre>
 *   anomaly:learning:strategies        → Hash: strategy key → StrategyPerformanceRecord JSON
 *   anomaly:learning:total-detections  → Number of completed detection runs
 *   anomaly:learning:patterns          → List of SuccessfulPattern JSON, oldest first
 * </pre>
 */
@Configuration
public class RedisConfig {

    /** Global prefix for all keys; the Redis server may be shared. */
    public static final String KEY_PREFIX = "anomaly:";

    public static final String KEY_LEARNING_STRATEGIES = KEY_PREFIX + "learning:strategies";
    public static final String KEY_LEARNING_TOTAL_DETECTIONS = KEY_PREFIX + "learning:total-detections";
    public static final String KEY_LEARNING_PATTERNS = KEY_PREFIX + "learning:patterns";

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory redisConnectionFactory) {
        return new StringRedisTemplate(redisConnectionFactory);
    }
}
