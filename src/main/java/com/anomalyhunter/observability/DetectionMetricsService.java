package com.anomalyhunter.observability;

import com.anomalyhunter.domain.enums.StrategyId;
import com.anomalyhunter.event.DetectionEvent;
import com.anomalyhunter.event.DetectorFailureEvent;
import com.anomalyhunter.learning.AdaptiveWeightTracker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer meters for the detection pipeline.
 * <ul>
 *   <li><b>investigations.completed</b> (counter, tag {@code recommendation})</li>
 *   <li><b>detector.failures</b> (counter, tag {@code strategy})</li>
 *   <li><b>investigation.duration</b> (timer): fan-out to synthesized verdict</li>
 *   <li><b>learning.weight</b> (gauge, tag {@code strategy}): current adaptive weight</li>
 *   <li><b>learning.total.runs</b> (gauge, tag {@code strategy})</li>
 * </ul>
 *
 * <p>Gauges are polled from the tracker on scrape; counters and the timer are driven by
 * application events.
 */
@Service
public class DetectionMetricsService {

    private final MeterRegistry meterRegistry;
    private final Timer investigationTimer;

    public DetectionMetricsService(MeterRegistry meterRegistry, AdaptiveWeightTracker adaptiveWeightTracker) {
        this.meterRegistry = meterRegistry;

        this.investigationTimer = Timer.builder("investigation.duration")
                .description("Time from detector fan-out to synthesized verdict")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(30))
                .register(meterRegistry);

        for (StrategyId strategyId : StrategyId.values()) {
            Gauge.builder("learning.weight", adaptiveWeightTracker, tracker -> tracker.weightFor(strategyId))
                    .description("Adaptive weight used by synthesis")
                    .tag("strategy", strategyId.getKey())
                    .register(meterRegistry);
            Gauge.builder(
                            "learning.total.runs",
                            adaptiveWeightTracker,
                            tracker -> tracker.getRecord(strategyId).getTotalRuns())
                    .description("Findings recorded for the strategy")
                    .tag("strategy", strategyId.getKey())
                    .register(meterRegistry);
        }
    }

    @EventListener
    @Order(20)
    public void onDetection(DetectionEvent event) {
        Counter.builder("investigations.completed")
                .description("Completed investigations by recommendation tier")
                .tag("recommendation", event.getVerdict().getRecommendation().name())
                .register(meterRegistry)
                .increment();
        investigationTimer.record(event.getElapsed());
    }

    @EventListener
    @Order(20)
    public void onDetectorFailure(DetectorFailureEvent event) {
        Counter.builder("detector.failures")
                .description("Detectors that threw or timed out")
                .tag("strategy", event.getStrategyId().getKey())
                .register(meterRegistry)
                .increment();
    }
}
