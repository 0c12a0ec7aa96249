package com.anomalyhunter.domain.model;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Read-only export of the adaptive learning state, keyed by strategy key. */
@Value
@Builder
public class LearningSnapshot {

    long totalDetections;

    Map<String, StrategyStats> strategies;

    Instant capturedAt;

    @Value
    public static class StrategyStats {
        long totalRuns;
        double avgConfidence;
    }
}
