package com.anomalyhunter.domain.model;

import com.anomalyhunter.domain.enums.StrategyId;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cumulative per-strategy history owned by the {@code AdaptiveWeightTracker}.
 *
 * <p>Created with {@code totalRuns = 0} the first time a strategy is seen, incremented after
 * every run that produced a finding for it, never deleted. Persisted as
 * {@code {totalRuns, runningConfidenceSum}} so the mean survives restarts.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StrategyPerformanceRecord {

    private StrategyId strategyId;

    private long totalRuns;

    private double runningConfidenceSum;

    private Instant lastUpdated;

    public static StrategyPerformanceRecord empty(StrategyId strategyId) {
        return StrategyPerformanceRecord.builder()
                .strategyId(strategyId)
                .totalRuns(0)
                .runningConfidenceSum(0.0)
                .build();
    }

    /** Mean confidence over all runs, or {@code defaultValue} before the first run. */
    public double averageConfidenceOr(double defaultValue) {
        return totalRuns == 0 ? defaultValue : runningConfidenceSum / totalRuns;
    }
}
