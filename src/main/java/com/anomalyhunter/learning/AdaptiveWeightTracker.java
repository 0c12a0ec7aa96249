package com.anomalyhunter.learning;

import com.anomalyhunter.config.LearningProperties;
import com.anomalyhunter.domain.enums.StrategyId;
import com.anomalyhunter.domain.model.Finding;
import com.anomalyhunter.domain.model.LearningSnapshot;
import com.anomalyhunter.domain.model.StrategyPerformanceRecord;
import com.anomalyhunter.domain.model.SuccessfulPattern;
import com.anomalyhunter.domain.model.Verdict;
import com.anomalyhunter.exception.LearningStoreException;
import com.anomalyhunter.repository.redis.LearningStateRedisRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Tracks each strategy's historical confidence and derives the adaptive weight used by
 * synthesis.
 *
 * <p>The weight of a strategy is the plain cumulative mean of the confidences it reported,
 * {@code runningConfidenceSum / totalRuns}, or 0.5 before its first run. There is no decay
 * and no window: early runs weigh more while {@code totalRuns} is small.
 *
 * <p>Thread safety: all records sit behind one {@link ReadWriteLock}. {@link #weightsSnapshot()}
 * reads under the read lock, so it never observes half of a {@link #recordOutcome(Verdict)};
 * updates take the write lock, which serializes concurrent runs and prevents lost updates.
 *
 * <p>Every update is handed to {@link LearningStatePersister} while the write lock is still
 * held, so persisted states queue up in the order they were produced. Persistence never
 * blocks the caller.
 */
@Service
public class AdaptiveWeightTracker {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveWeightTracker.class);

    public static final double COLD_START_WEIGHT = 0.5;

    static final double LOW_CONFIDENCE_THRESHOLD = 0.6;
    static final long HIGH_VOLUME_DETECTIONS = 50;

    private final LearningStateRedisRepository learningStateRedisRepository;
    private final LearningStatePersister learningStatePersister;
    private final PatternLibrary patternLibrary;
    private final int suggestionMinRuns;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<StrategyId, StrategyPerformanceRecord> records = new EnumMap<>(StrategyId.class);
    private long totalDetections;

    public AdaptiveWeightTracker(
            LearningStateRedisRepository learningStateRedisRepository,
            LearningStatePersister learningStatePersister,
            PatternLibrary patternLibrary,
            LearningProperties learningProperties) {
        this.learningStateRedisRepository = learningStateRedisRepository;
        this.learningStatePersister = learningStatePersister;
        this.patternLibrary = patternLibrary;
        this.suggestionMinRuns = learningProperties.getSuggestionMinRuns();
        for (StrategyId strategyId : StrategyId.values()) {
            records.put(strategyId, StrategyPerformanceRecord.empty(strategyId));
        }
    }

    /**
     * Restores persisted learning state once the application is ready. An unreachable store
     * leaves the tracker on cold-start weights.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void loadState() {
        Map<StrategyId, StrategyPerformanceRecord> stored;
        long storedDetections;
        List<SuccessfulPattern> storedPatterns;
        try {
            stored = learningStateRedisRepository.findAllRecords();
            storedDetections = learningStateRedisRepository.findTotalDetections();
            storedPatterns = learningStateRedisRepository.findPatterns();
        } catch (LearningStoreException e) {
            log.warn("Could not load learning state, starting cold: {}", e.getMessage());
            return;
        }

        lock.writeLock().lock();
        try {
            records.putAll(stored);
            totalDetections = storedDetections;
        } finally {
            lock.writeLock().unlock();
        }
        patternLibrary.restore(storedPatterns);

        log.info(
                "Learning state loaded: strategies={} totalDetections={} patterns={}",
                stored.size(),
                storedDetections,
                storedPatterns.size());
    }

    /** Historical mean confidence of the strategy, or {@link #COLD_START_WEIGHT} before its first run. */
    public double weightFor(StrategyId strategyId) {
        lock.readLock().lock();
        try {
            return records.get(strategyId).averageConfidenceOr(COLD_START_WEIGHT);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Weights of all strategies, read atomically with respect to {@link #recordOutcome(Verdict)}. */
    public Map<StrategyId, Double> weightsSnapshot() {
        lock.readLock().lock();
        try {
            Map<StrategyId, Double> weights = new EnumMap<>(StrategyId.class);
            records.forEach((id, record) -> weights.put(id, record.averageConfidenceOr(COLD_START_WEIGHT)));
            return Collections.unmodifiableMap(weights);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Folds every finding of the verdict into its strategy's record and counts the detection.
     * Strategies that failed in this run are left untouched.
     */
    public void recordOutcome(Verdict verdict) {
        lock.writeLock().lock();
        try {
            Instant now = Instant.now();
            for (Finding finding : verdict.getFindings()) {
                StrategyPerformanceRecord record = records.get(finding.getStrategyId());
                record.setTotalRuns(record.getTotalRuns() + 1);
                record.setRunningConfidenceSum(record.getRunningConfidenceSum() + finding.getConfidence());
                record.setLastUpdated(now);
            }
            totalDetections++;

            SuccessfulPattern pattern = patternLibrary.consider(verdict).orElse(null);
            if (pattern != null) {
                log.debug("Stored successful pattern for verdict {}", verdict.getId());
            }

            List<StrategyPerformanceRecord> copies =
                    records.values().stream().map(r -> r.toBuilder().build()).toList();
            learningStatePersister.persistAsync(copies, totalDetections, pattern);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public LearningSnapshot getLearningSnapshot() {
        lock.readLock().lock();
        try {
            Map<String, LearningSnapshot.StrategyStats> strategies = new LinkedHashMap<>();
            records.forEach((id, record) -> strategies.put(
                    id.getKey(),
                    new LearningSnapshot.StrategyStats(record.getTotalRuns(), record.averageConfidenceOr(0.0))));
            return LearningSnapshot.builder()
                    .totalDetections(totalDetections)
                    .strategies(strategies)
                    .capturedAt(Instant.now())
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Flags strategies with at least {@code suggestionMinRuns} runs whose average confidence is
     * below 0.6, and suggests pattern analysis once more than 50 detections were processed.
     */
    public List<String> suggestImprovements() {
        lock.readLock().lock();
        try {
            List<String> suggestions = new ArrayList<>();
            for (StrategyPerformanceRecord record : records.values()) {
                if (record.getTotalRuns() < suggestionMinRuns) {
                    continue;
                }
                double avgConfidence = record.averageConfidenceOr(0.0);
                if (avgConfidence < LOW_CONFIDENCE_THRESHOLD) {
                    suggestions.add(String.format(
                            Locale.ROOT,
                            "%s shows low confidence (%.1f%%). May need additional training data or context.",
                            record.getStrategyId().getKey(),
                            avgConfidence * 100));
                }
            }
            if (totalDetections > HIGH_VOLUME_DETECTIONS) {
                suggestions.add(String.format(
                        Locale.ROOT,
                        "System has processed %d detections. Consider analyzing patterns for automation opportunities.",
                        totalDetections));
            }
            return suggestions;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<SuccessfulPattern> getPatterns() {
        return patternLibrary.getPatterns();
    }

    public long getTotalDetections() {
        lock.readLock().lock();
        try {
            return totalDetections;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Copy of the strategy's record. */
    public StrategyPerformanceRecord getRecord(StrategyId strategyId) {
        lock.readLock().lock();
        try {
            return records.get(strategyId).toBuilder().build();
        } finally {
            lock.readLock().unlock();
        }
    }
}
