package com.anomalyhunter.repository.redis;

import com.anomalyhunter.config.RedisConfig;
import com.anomalyhunter.domain.enums.StrategyId;
import com.anomalyhunter.domain.model.StrategyPerformanceRecord;
import com.anomalyhunter.domain.model.SuccessfulPattern;
import com.anomalyhunter.exception.LearningStoreException;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Redis repository for the adaptive learning state.
 *
 * <p>Strategy records live in one hash keyed by strategy key, so a restart reloads all three
 * with a single {@code HGETALL}. Patterns are appended to a list that is trimmed to the
 * configured history size on every write.
 *
 * <p>Redis and JSON failures are rethrown as {@link LearningStoreException}; retrying them
 * is the caller's business.
 */
@Repository
public class LearningStateRedisRepository {

    private static final Logger log = LoggerFactory.getLogger(LearningStateRedisRepository.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public LearningStateRedisRepository(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    public void saveRecords(Collection<StrategyPerformanceRecord> records) {
        try {
            Map<String, String> fields = new LinkedHashMap<>();
            for (StrategyPerformanceRecord record : records) {
                fields.put(record.getStrategyId().getKey(), objectMapper.writeValueAsString(record));
            }
            redisTemplate.opsForHash().putAll(RedisConfig.KEY_LEARNING_STRATEGIES, fields);
        } catch (DataAccessException | JacksonException e) {
            throw new LearningStoreException("Failed to save strategy records", e);
        }
    }

    /** Records keyed by strategy; unknown or unreadable fields are skipped. */
    public Map<StrategyId, StrategyPerformanceRecord> findAllRecords() {
        Map<Object, Object> entries;
        try {
            entries = redisTemplate.opsForHash().entries(RedisConfig.KEY_LEARNING_STRATEGIES);
        } catch (DataAccessException e) {
            throw new LearningStoreException("Failed to load strategy records", e);
        }

        Map<StrategyId, StrategyPerformanceRecord> records = new EnumMap<>(StrategyId.class);
        if (entries == null) {
            return records;
        }
        for (Map.Entry<Object, Object> entry : entries.entrySet()) {
            try {
                StrategyId strategyId = StrategyId.fromKey(String.valueOf(entry.getKey()));
                StrategyPerformanceRecord record =
                        objectMapper.readValue(String.valueOf(entry.getValue()), StrategyPerformanceRecord.class);
                record.setStrategyId(strategyId);
                records.put(strategyId, record);
            } catch (IllegalArgumentException | JacksonException e) {
                log.warn("Skipping unreadable learning record {}: {}", entry.getKey(), e.getMessage());
            }
        }
        return records;
    }

    public void saveTotalDetections(long totalDetections) {
        try {
            redisTemplate.opsForValue().set(RedisConfig.KEY_LEARNING_TOTAL_DETECTIONS, Long.toString(totalDetections));
        } catch (DataAccessException e) {
            throw new LearningStoreException("Failed to save detection count", e);
        }
    }

    public long findTotalDetections() {
        String value;
        try {
            value = redisTemplate.opsForValue().get(RedisConfig.KEY_LEARNING_TOTAL_DETECTIONS);
        } catch (DataAccessException e) {
            throw new LearningStoreException("Failed to load detection count", e);
        }
        if (value == null) {
            return 0L;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed detection count '{}'", value);
            return 0L;
        }
    }

    /** Appends a pattern and keeps only the newest {@code maxPatterns} entries. */
    public void appendPattern(SuccessfulPattern pattern, int maxPatterns) {
        try {
            String json = objectMapper.writeValueAsString(pattern);
            redisTemplate.opsForList().rightPush(RedisConfig.KEY_LEARNING_PATTERNS, json);
            redisTemplate.opsForList().trim(RedisConfig.KEY_LEARNING_PATTERNS, -maxPatterns, -1);
        } catch (DataAccessException | JacksonException e) {
            throw new LearningStoreException("Failed to append successful pattern", e);
        }
    }

    /** Stored patterns, oldest first. */
    public List<SuccessfulPattern> findPatterns() {
        List<String> values;
        try {
            values = redisTemplate.opsForList().range(RedisConfig.KEY_LEARNING_PATTERNS, 0, -1);
        } catch (DataAccessException e) {
            throw new LearningStoreException("Failed to load successful patterns", e);
        }
        if (values == null || values.isEmpty()) {
            return Collections.emptyList();
        }
        return values.stream()
                .map(this::readPattern)
                .filter(Objects::nonNull)
                .toList();
    }

    private SuccessfulPattern readPattern(String json) {
        try {
            return objectMapper.readValue(json, SuccessfulPattern.class);
        } catch (JacksonException e) {
            log.warn("Skipping unreadable successful pattern: {}", e.getMessage());
            return null;
        }
    }
}
