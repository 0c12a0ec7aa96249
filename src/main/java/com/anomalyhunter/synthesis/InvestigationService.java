package com.anomalyhunter.synthesis;

import com.anomalyhunter.config.DetectionProperties;
import com.anomalyhunter.detector.AnomalyDetector;
import com.anomalyhunter.domain.enums.StrategyId;
import com.anomalyhunter.domain.model.Finding;
import com.anomalyhunter.domain.model.Series;
import com.anomalyhunter.domain.model.Verdict;
import com.anomalyhunter.event.EventPublisherHelper;
import com.anomalyhunter.exception.AllStrategiesFailedException;
import com.anomalyhunter.exception.DetectorFailureException;
import com.anomalyhunter.exception.InvestigationCancelledException;
import com.anomalyhunter.learning.AdaptiveWeightTracker;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs one investigation: fan-out of every detector, fan-in, synthesis, learning update and
 * the detection event.
 *
 * <p>Detectors run concurrently on {@code detectorExecutor}, each bounded by
 * {@code anomaly.detection.detector-timeout}. A detector that throws, times out or is rejected
 * by a saturated pool is dropped from the run and reported as a {@link DetectorFailureException};
 * a detector still running is interrupted. The verdict is then built from the survivors and
 * lists the skipped strategies. When no detector survives an
 * {@link AllStrategiesFailedException} is thrown and the learning state is not touched.
 *
 * <p>Run lifecycle: {@code RUNNING -> COMMITTING} when the detectors are joined, or
 * {@code RUNNING -> CANCELLED} when the caller cancels. The two transitions race on one CAS,
 * so a cancelled run never reaches {@link AdaptiveWeightTracker#recordOutcome(Verdict)} and a
 * committing run is never half-recorded.
 */
@Service
public class InvestigationService {

    private static final Logger log = LoggerFactory.getLogger(InvestigationService.class);

    private final List<AnomalyDetector> detectors;
    private final VerdictSynthesizer verdictSynthesizer;
    private final AdaptiveWeightTracker adaptiveWeightTracker;
    private final EventPublisherHelper eventPublisherHelper;
    private final Executor detectorExecutor;
    private final Duration detectorTimeout;

    public InvestigationService(
            List<AnomalyDetector> detectors,
            VerdictSynthesizer verdictSynthesizer,
            AdaptiveWeightTracker adaptiveWeightTracker,
            EventPublisherHelper eventPublisherHelper,
            @Qualifier("detectorExecutor") Executor detectorExecutor,
            DetectionProperties detectionProperties) {
        this.detectors = detectors.stream()
                .sorted(Comparator.comparing(AnomalyDetector::getStrategyId))
                .toList();
        this.verdictSynthesizer = verdictSynthesizer;
        this.adaptiveWeightTracker = adaptiveWeightTracker;
        this.eventPublisherHelper = eventPublisherHelper;
        this.detectorExecutor = detectorExecutor;
        this.detectorTimeout = detectionProperties.getDetectorTimeout();
    }

    /**
     * Runs the investigation and blocks until the verdict is ready.
     *
     * @throws AllStrategiesFailedException if every detector failed
     * @throws InvestigationCancelledException if the calling thread is interrupted while waiting
     */
    public Verdict investigate(Series series) {
        Investigation investigation = start(series);
        try {
            investigation.allSettled().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            investigation.cancel();
            throw new InvestigationCancelledException("Investigation interrupted", e);
        } catch (ExecutionException e) {
            // settled futures never fail; reaching this means a bug in the fan-in
            throw new IllegalStateException("Detector fan-in failed", e.getCause());
        }
        return commit(investigation);
    }

    /**
     * Starts the investigation and returns immediately. Cancelling the returned future abandons
     * the running detectors; the run is then never recorded into the learning state.
     * A total failure completes the future exceptionally with {@link AllStrategiesFailedException}.
     */
    public CompletableFuture<Verdict> investigateAsync(Series series) {
        Investigation investigation = start(series);
        CompletableFuture<Verdict> verdict = investigation.allSettled().thenApply(ignored -> commit(investigation));
        verdict.whenComplete((result, error) -> {
            if (verdict.isCancelled()) {
                investigation.cancel();
            }
        });
        return verdict;
    }

    private Investigation start(Series series) {
        log.info("Investigation started: size={} detectors={}", series.size(), detectors.size());
        Investigation investigation = new Investigation(System.nanoTime());
        for (AnomalyDetector detector : detectors) {
            DetectorTask task = new DetectorTask(() -> detector.detect(series));
            try {
                detectorExecutor.execute(task);
            } catch (RejectedExecutionException e) {
                task.result.completeExceptionally(e);
            }
            task.result.orTimeout(detectorTimeout.toMillis(), TimeUnit.MILLISECONDS);
            investigation.add(detector.getStrategyId(), task);
        }
        return investigation;
    }

    private Verdict commit(Investigation investigation) {
        if (!investigation.state.compareAndSet(RunState.RUNNING, RunState.COMMITTING)) {
            throw new InvestigationCancelledException("Investigation was cancelled");
        }

        List<Finding> findings = new ArrayList<>();
        List<DetectorFailureException> failures = new ArrayList<>();
        for (DetectorRun run : investigation.runs) {
            Outcome outcome = run.settled().join();
            if (outcome.finding() != null) {
                findings.add(outcome.finding());
            } else {
                failures.add(outcome.failure());
            }
        }

        for (DetectorFailureException failure : failures) {
            log.warn("Detector {} failed: {}", failure.getStrategyId().getKey(), failure.getMessage());
            eventPublisherHelper.publishDetectorFailure(this, failure.getStrategyId(), failure.getMessage());
        }

        if (findings.isEmpty()) {
            log.error("Investigation failed: all {} detectors failed", failures.size());
            throw new AllStrategiesFailedException(failures);
        }

        Map<StrategyId, Double> weights = adaptiveWeightTracker.weightsSnapshot();
        log.debug("Adaptive weights for this run: {}", weights);

        List<StrategyId> failedStrategies =
                failures.stream().map(DetectorFailureException::getStrategyId).toList();
        Verdict verdict = verdictSynthesizer.synthesize(findings, weights, failedStrategies);

        adaptiveWeightTracker.recordOutcome(verdict);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - investigation.startedAt);
        log.info(
                "Investigation completed: id={} severity={} recommendation={} anomalies={} confidence={} degraded={} elapsed={}ms",
                verdict.getId(),
                verdict.getSeverity(),
                verdict.getRecommendation(),
                verdict.getAnomalyIndices().size(),
                verdict.getConfidence(),
                verdict.isDegraded(),
                elapsed.toMillis());

        eventPublisherHelper.publishDetection(this, verdict, elapsed);
        return verdict;
    }

    private static DetectorFailureException toFailure(StrategyId strategyId, Throwable error, Duration timeout) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        String message;
        if (cause instanceof TimeoutException) {
            message = "Timed out after " + timeout.toMillis() + "ms";
        } else if (cause instanceof CancellationException) {
            message = "Cancelled";
        } else if (cause instanceof RejectedExecutionException) {
            message = "Rejected: detector pool saturated";
        } else {
            message = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        }
        return new DetectorFailureException(strategyId, message, cause);
    }

    private enum RunState {
        RUNNING,
        COMMITTING,
        CANCELLED
    }

    private record Outcome(Finding finding, DetectorFailureException failure) {}

    private record DetectorRun(DetectorTask task, CompletableFuture<Outcome> settled) {}

    /**
     * Detector call submitted to the pool. Unlike {@code supplyAsync}, cancelling the task
     * interrupts the pool thread running it; {@link #result} mirrors the task's outcome.
     */
    private static final class DetectorTask extends FutureTask<Finding> {

        private final CompletableFuture<Finding> result = new CompletableFuture<>();

        private DetectorTask(Callable<Finding> detection) {
            super(detection);
        }

        @Override
        protected void done() {
            if (isCancelled()) {
                result.cancel(false);
                return;
            }
            try {
                result.complete(get());
            } catch (ExecutionException e) {
                result.completeExceptionally(e.getCause());
            } catch (InterruptedException e) {
                // done() runs after completion, get() does not block here
                Thread.currentThread().interrupt();
                result.completeExceptionally(e);
            }
        }
    }

    private final class Investigation {

        private final long startedAt;
        private final AtomicReference<RunState> state = new AtomicReference<>(RunState.RUNNING);
        private final List<DetectorRun> runs = new ArrayList<>();

        private Investigation(long startedAt) {
            this.startedAt = startedAt;
        }

        private void add(StrategyId strategyId, DetectorTask task) {
            CompletableFuture<Outcome> settled = task.result.handle((finding, error) -> {
                if (error != null) {
                    // frees the pool thread of a timed-out or cancelled detector
                    task.cancel(true);
                    return new Outcome(null, toFailure(strategyId, error, detectorTimeout));
                }
                if (finding == null) {
                    IllegalStateException empty = new IllegalStateException("No finding returned");
                    return new Outcome(null, toFailure(strategyId, empty, detectorTimeout));
                }
                return new Outcome(finding, null);
            });
            runs.add(new DetectorRun(task, settled));
        }

        /** Completes once every detector has produced a finding or failed; never fails itself. */
        private CompletableFuture<Void> allSettled() {
            return CompletableFuture.allOf(
                    runs.stream().map(DetectorRun::settled).toArray(CompletableFuture[]::new));
        }

        private void cancel() {
            if (state.compareAndSet(RunState.RUNNING, RunState.CANCELLED)) {
                runs.forEach(run -> {
                    run.task().cancel(true);
                    run.task().result.cancel(false);
                });
                log.info("Investigation cancelled, {} detectors abandoned", runs.size());
            }
        }
    }
}
