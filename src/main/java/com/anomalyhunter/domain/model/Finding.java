package com.anomalyhunter.domain.model;

import com.anomalyhunter.domain.enums.StrategyId;
import java.time.Instant;
import java.util.Map;
import java.util.SortedSet;
import lombok.Builder;
import lombok.Value;

/**
 * Output of one detector for one series.
 *
 * <p>{@code confidence} reflects the strength of the statistical evidence and is computed by
 * each detector's own formula; it is never a constant. {@code evidence} holds
 * detector-specific facts (max z-score, drift percentage, cluster count, ...) and is opaque to
 * synthesis. {@code summary} is the oracle's prose when one answered, otherwise a
 * deterministic sentence.
 */
@Value
@Builder
public class Finding {

    StrategyId strategyId;

    /** Flagged positions, unique and ascending, each in [0, series.size()). */
    SortedSet<Integer> anomalyIndices;

    /** 1-10. */
    int severity;

    /** 0.0-1.0. */
    double confidence;

    Map<String, Object> evidence;

    String summary;

    Instant detectedAt;
}
