package com.anomalyhunter.domain.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Compact record of a high-confidence detection, kept as a library of approaches that
 * worked. {@code agentAgreement} is {@code 1 / (1 + variance of finding severities)}:
 * 1.0 when every strategy reported the same severity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuccessfulPattern {

    private String verdictId;

    private Instant recordedAt;

    private int severity;

    private double confidence;

    private int anomalyCount;

    private double agentAgreement;

    /** Verdict summary, truncated to 200 characters. */
    private String summary;
}
