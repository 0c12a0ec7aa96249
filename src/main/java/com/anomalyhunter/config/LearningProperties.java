package com.anomalyhunter.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Adaptive learning settings bound from application.yml under {@code anomaly.learning}.
 */
@Data
@ConfigurationProperties(prefix = "anomaly.learning")
public class LearningProperties {

    /** Verdicts strictly above this confidence are stored in the pattern library. */
    private double patternConfidenceThreshold = 0.85;

    private int patternHistorySize = 100;

    private int persistenceMaxAttempts = 3;

    /** First retry delay; doubled on every further attempt. */
    private Duration persistenceInitialBackoff = Duration.ofMillis(200);

    /** Runs a strategy needs before improvement suggestions consider it. */
    private int suggestionMinRuns = 10;
}
