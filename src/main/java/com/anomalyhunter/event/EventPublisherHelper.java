package com.anomalyhunter.event;

import com.anomalyhunter.domain.enums.StrategyId;
import com.anomalyhunter.domain.model.Verdict;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher}.
 *
 * <p>Listeners are synchronous {@code @EventListener}s, so a listener exception would
 * surface at the publish call. Publishing here never throws: a broken monitoring listener
 * must not turn a completed investigation into a failed one.
 */
@Component
public class EventPublisherHelper {

    private static final Logger log = LoggerFactory.getLogger(EventPublisherHelper.class);

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishDetection(Object source, Verdict verdict, Duration elapsed) {
        try {
            applicationEventPublisher.publishEvent(new DetectionEvent(source, verdict, elapsed));
        } catch (RuntimeException e) {
            log.error("Detection event listener failed for verdict {}: {}", verdict.getId(), e.getMessage(), e);
        }
    }

    public void publishDetectorFailure(Object source, StrategyId strategyId, String reason) {
        try {
            applicationEventPublisher.publishEvent(new DetectorFailureEvent(source, strategyId, reason));
        } catch (RuntimeException e) {
            log.error("Detector failure event listener failed for {}: {}", strategyId.getKey(), e.getMessage(), e);
        }
    }
}
