package com.anomalyhunter.learning;

import com.anomalyhunter.config.LearningProperties;
import com.anomalyhunter.domain.model.Finding;
import com.anomalyhunter.domain.model.SuccessfulPattern;
import com.anomalyhunter.domain.model.Verdict;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Bounded library of high-confidence detections.
 *
 * <p>A verdict whose confidence is strictly above the configured threshold is condensed into a
 * {@link SuccessfulPattern}. Only the newest {@code patternHistorySize} patterns are kept.
 */
@Component
public class PatternLibrary {

    static final int MAX_SUMMARY_LENGTH = 200;

    private final double confidenceThreshold;
    private final int historySize;
    private final Deque<SuccessfulPattern> patterns = new ArrayDeque<>();

    public PatternLibrary(LearningProperties learningProperties) {
        this.confidenceThreshold = learningProperties.getPatternConfidenceThreshold();
        this.historySize = learningProperties.getPatternHistorySize();
    }

    /** Stores the verdict as a pattern if it qualifies; returns the stored pattern. */
    public synchronized Optional<SuccessfulPattern> consider(Verdict verdict) {
        if (verdict.getConfidence() <= confidenceThreshold) {
            return Optional.empty();
        }
        SuccessfulPattern pattern = SuccessfulPattern.builder()
                .verdictId(verdict.getId())
                .recordedAt(verdict.getCompletedAt())
                .severity(verdict.getSeverity())
                .confidence(verdict.getConfidence())
                .anomalyCount(verdict.getAnomalyIndices().size())
                .agentAgreement(agentAgreement(verdict.getFindings()))
                .summary(truncate(verdict.getSummary()))
                .build();
        add(pattern);
        return Optional.of(pattern);
    }

    /** Replaces the library with previously persisted patterns, oldest first. */
    public synchronized void restore(List<SuccessfulPattern> stored) {
        patterns.clear();
        stored.forEach(this::add);
    }

    /** Oldest first. */
    public synchronized List<SuccessfulPattern> getPatterns() {
        return List.copyOf(patterns);
    }

    public synchronized int size() {
        return patterns.size();
    }

    /** {@code 1 / (1 + population variance of the finding severities)}; 1.0 for fewer than two findings. */
    static double agentAgreement(List<Finding> findings) {
        if (findings.size() < 2) {
            return 1.0;
        }
        double mean = findings.stream().mapToInt(Finding::getSeverity).average().orElse(0.0);
        double variance = findings.stream()
                .mapToDouble(f -> (f.getSeverity() - mean) * (f.getSeverity() - mean))
                .sum()
                / findings.size();
        return 1.0 / (1.0 + variance);
    }

    private void add(SuccessfulPattern pattern) {
        patterns.addLast(pattern);
        while (patterns.size() > historySize) {
            patterns.removeFirst();
        }
    }

    private static String truncate(String summary) {
        if (summary == null || summary.length() <= MAX_SUMMARY_LENGTH) {
            return summary;
        }
        return summary.substring(0, MAX_SUMMARY_LENGTH);
    }
}
