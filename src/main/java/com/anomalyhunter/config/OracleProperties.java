package com.anomalyhunter.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Text-and-severity oracle call settings bound from application.yml under {@code anomaly.oracle}.
 * The timeout must stay below {@code anomaly.detection.detector-timeout}, otherwise a hanging
 * oracle fails the whole detector instead of triggering its fallback.
 */
@Data
@ConfigurationProperties(prefix = "anomaly.oracle")
public class OracleProperties {

    private Duration timeout = Duration.ofSeconds(5);

    /** Failure rate (percent) over the sliding window that opens the circuit. */
    private float failureRateThreshold = 50.0f;

    private Duration waitInOpenState = Duration.ofSeconds(30);
}
