package com.anomalyhunter.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Detection run settings bound from application.yml under {@code anomaly.detection}.
 */
@Data
@ConfigurationProperties(prefix = "anomaly.detection")
public class DetectionProperties {

    /** Budget for a single detector; on expiry that detector counts as failed for the run. */
    private Duration detectorTimeout = Duration.ofSeconds(10);

    /** Threads in the detector pool. Three per concurrent run keeps the fan-out unqueued. */
    private int poolSize = 6;
}
