package com.anomalyhunter.learning;

import com.anomalyhunter.config.LearningProperties;
import com.anomalyhunter.domain.model.StrategyPerformanceRecord;
import com.anomalyhunter.domain.model.SuccessfulPattern;
import com.anomalyhunter.repository.redis.LearningStateRedisRepository;
import io.github.resilience4j.retry.Retry;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Writes learning state to Redis off the investigation thread.
 *
 * <p>Writes are queued on the single-threaded {@code learningPersistenceExecutor}, so they
 * reach Redis in submission order and an older state never overwrites a newer one. Each
 * write is retried with exponential backoff; once retries are exhausted the failure is
 * logged and dropped. The in-memory state stays authoritative until the next write succeeds.
 */
@Component
public class LearningStatePersister {

    private static final Logger log = LoggerFactory.getLogger(LearningStatePersister.class);

    private final LearningStateRedisRepository learningStateRedisRepository;
    private final Retry learningStoreRetry;
    private final Executor learningPersistenceExecutor;
    private final int patternHistorySize;

    public LearningStatePersister(
            LearningStateRedisRepository learningStateRedisRepository,
            Retry learningStoreRetry,
            @Qualifier("learningPersistenceExecutor") Executor learningPersistenceExecutor,
            LearningProperties learningProperties) {
        this.learningStateRedisRepository = learningStateRedisRepository;
        this.learningStoreRetry = learningStoreRetry;
        this.learningPersistenceExecutor = learningPersistenceExecutor;
        this.patternHistorySize = learningProperties.getPatternHistorySize();
    }

    /**
     * Queues a write of the given state.
     *
     * @param pattern the pattern stored by this run, or null
     * @return completes with {@code true} when the write landed, {@code false} when it was dropped;
     *     never completes exceptionally
     */
    public CompletableFuture<Boolean> persistAsync(
            List<StrategyPerformanceRecord> records, long totalDetections, SuccessfulPattern pattern) {
        Runnable write = Retry.decorateRunnable(learningStoreRetry, () -> {
            learningStateRedisRepository.saveRecords(records);
            learningStateRedisRepository.saveTotalDetections(totalDetections);
            if (pattern != null) {
                learningStateRedisRepository.appendPattern(pattern, patternHistorySize);
            }
        });

        try {
            return CompletableFuture.runAsync(write, learningPersistenceExecutor)
                    .thenApply(ignored -> true)
                    .exceptionally(e -> {
                        log.warn(
                                "Learning state write failed after retries (detections={}): {}",
                                totalDetections,
                                e.getMessage());
                        return false;
                    });
        } catch (RejectedExecutionException e) {
            log.warn("Learning state write rejected (detections={}): {}", totalDetections, e.getMessage());
            return CompletableFuture.completedFuture(false);
        }
    }
}
