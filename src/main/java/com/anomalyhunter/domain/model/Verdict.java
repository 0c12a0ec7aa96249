package com.anomalyhunter.domain.model;

import com.anomalyhunter.domain.enums.Recommendation;
import com.anomalyhunter.domain.enums.StrategyId;
import java.time.Instant;
import java.util.List;
import java.util.SortedSet;
import lombok.Builder;
import lombok.Value;

/**
 * Synthesized result of one detection run.
 *
 * <p>A verdict built from fewer than three findings is degraded: the strategies listed in
 * {@code failedStrategies} were skipped, and consumers may discount the confidence.
 */
@Value
@Builder
public class Verdict {

    String id;

    /** Confidence-weighted severity, 1-10. */
    int severity;

    /** Plain mean of the finding confidences; adaptive weights do not touch it. */
    double confidence;

    /** Union of every finding's anomaly indices. */
    SortedSet<Integer> anomalyIndices;

    Recommendation recommendation;

    String summary;

    List<Finding> findings;

    List<StrategyId> failedStrategies;

    Instant completedAt;

    public boolean isDegraded() {
        return findings.size() < StrategyId.values().length;
    }
}
