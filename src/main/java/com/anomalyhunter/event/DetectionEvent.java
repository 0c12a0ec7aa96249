package com.anomalyhunter.event;

import com.anomalyhunter.domain.model.Verdict;
import java.time.Duration;
import org.springframework.context.ApplicationEvent;

/**
 * Published once per completed investigation, after the learning state has been updated.
 *
 * <p>Carries the full {@link Verdict}: severity, confidence, anomaly indices, recommendation,
 * the per-strategy findings and the completion timestamp. Monitoring, alerting and streaming
 * collaborators subscribe with {@code @EventListener}. Cancelled or failed runs publish nothing.
 */
public class DetectionEvent extends ApplicationEvent {

    private final Verdict verdict;
    private final Duration elapsed;

    public DetectionEvent(Object source, Verdict verdict, Duration elapsed) {
        super(source);
        this.verdict = verdict;
        this.elapsed = elapsed;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    /** Wall-clock time from fan-out to synthesized verdict. */
    public Duration getElapsed() {
        return elapsed;
    }
}
