package com.anomalyhunter.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Registers common tags applied to all metrics so that custom and auto-configured meters
 * share the same dimensions. The custom meter definitions live in {@link
 * com.anomalyhunter.observability.DetectionMetricsService}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    public MetricsConfig(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config().commonTags("application", "anomaly-hunter");
    }
}
