package com.anomalyhunter.observability;

import com.anomalyhunter.domain.model.Verdict;
import com.anomalyhunter.event.DetectionEvent;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Keeps the most recent verdicts in memory and writes one structured log line per detection.
 *
 * <p>The ring buffer holds at most {@value #RING_BUFFER_SIZE} verdicts, newest first; the
 * oldest are evicted as new ones arrive.
 */
@Service
public class DetectionLog {

    private static final Logger log = LoggerFactory.getLogger(DetectionLog.class);

    static final int RING_BUFFER_SIZE = 1000;

    private final ConcurrentLinkedDeque<Verdict> ringBuffer = new ConcurrentLinkedDeque<>();

    @EventListener
    @Order(10)
    public void onDetection(DetectionEvent event) {
        Verdict verdict = event.getVerdict();
        ringBuffer.addFirst(verdict);
        while (ringBuffer.size() > RING_BUFFER_SIZE) {
            ringBuffer.removeLast();
        }

        log.info(
                "detection id={} severity={} confidence={} recommendation={} anomalies={} findings={} failed={} at={}",
                verdict.getId(),
                verdict.getSeverity(),
                verdict.getConfidence(),
                verdict.getRecommendation(),
                verdict.getAnomalyIndices(),
                verdict.getFindings().size(),
                verdict.getFailedStrategies(),
                verdict.getCompletedAt());
    }

    /** The newest {@code count} verdicts, newest first. */
    public List<Verdict> getRecent(int count) {
        return ringBuffer.stream().limit(Math.max(0, count)).toList();
    }

    public int getBufferSize() {
        return ringBuffer.size();
    }
}
