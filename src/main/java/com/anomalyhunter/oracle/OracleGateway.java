package com.anomalyhunter.oracle;

import com.anomalyhunter.domain.enums.StrategyId;
import com.anomalyhunter.domain.model.SeriesSummary;
import com.anomalyhunter.exception.OracleUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.timelimiter.TimeLimiter;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point through which detectors consult the optional oracle.
 *
 * <p>Each call is bounded by a Resilience4j {@link TimeLimiter} and guarded by a
 * {@link CircuitBreaker}. Every failure mode (no oracle configured, oracle unavailable,
 * timeout, open circuit, malformed answer) collapses to {@link Optional#empty()}, which tells
 * the detector to use its deterministic fallback. Nothing thrown by the oracle escapes.
 *
 * <p>Severity is clamped to [1,10], confidence to [0,1].
 */
public class OracleGateway {

    private static final Logger log = LoggerFactory.getLogger(OracleGateway.class);

    private final TextAndSeverityOracle oracle;
    private final HistoricalContextProvider historicalContextProvider;
    private final CircuitBreaker circuitBreaker;
    private final TimeLimiter timeLimiter;
    private final Executor executor;

    /**
     * @param oracle                    may be null: every assessment falls back
     * @param historicalContextProvider may be null: no context is forwarded
     */
    public OracleGateway(
            TextAndSeverityOracle oracle,
            HistoricalContextProvider historicalContextProvider,
            CircuitBreaker circuitBreaker,
            TimeLimiter timeLimiter,
            Executor executor) {
        this.oracle = oracle;
        this.historicalContextProvider = historicalContextProvider;
        this.circuitBreaker = circuitBreaker;
        this.timeLimiter = timeLimiter;
        this.executor = executor;
    }

    public boolean isConfigured() {
        return oracle != null;
    }

    /**
     * Asks the oracle to assess a detector's evidence.
     *
     * @return the clamped assessment, or empty if the detector must fall back
     */
    public Optional<OracleAssessment> assess(
            StrategyId strategyId, SeriesSummary seriesSummary, Map<String, Object> evidence) {
        if (oracle == null) {
            return Optional.empty();
        }

        OracleRequest request = OracleRequest.builder()
                .strategyId(strategyId)
                .evidence(evidence)
                .historicalContext(historicalContext(seriesSummary))
                .build();

        try {
            OracleAssessment assessment = circuitBreaker.executeCallable(() -> timeLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(() -> oracle.assess(request), executor)));
            if (assessment == null) {
                log.warn("Oracle returned no assessment for {}, using fallback", strategyId.getKey());
                return Optional.empty();
            }
            return Optional.of(clamp(assessment));
        } catch (CallNotPermittedException e) {
            log.debug("Oracle circuit open, using fallback for {}", strategyId.getKey());
            return Optional.empty();
        } catch (TimeoutException e) {
            log.warn("Oracle timed out for {}, using fallback", strategyId.getKey());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the oracle, using fallback for {}", strategyId.getKey());
            return Optional.empty();
        } catch (OracleUnavailableException e) {
            log.warn("Oracle unavailable for {}, using fallback: {}", strategyId.getKey(), e.getMessage());
            return Optional.empty();
        } catch (Exception e) {
            log.warn("Oracle call failed for {}, using fallback: {}", strategyId.getKey(), e.getMessage());
            return Optional.empty();
        }
    }

    private List<String> historicalContext(SeriesSummary seriesSummary) {
        if (historicalContextProvider == null) {
            return List.of();
        }
        try {
            List<String> context = historicalContextProvider.query(seriesSummary);
            return context != null ? List.copyOf(context) : List.of();
        } catch (RuntimeException e) {
            log.warn("Historical context lookup failed, continuing without it: {}", e.getMessage());
            return List.of();
        }
    }

    private static OracleAssessment clamp(OracleAssessment assessment) {
        Double confidence = assessment.getConfidence();
        if (confidence != null) {
            confidence = Double.isFinite(confidence) ? Math.min(1.0, Math.max(0.0, confidence)) : null;
        }
        return assessment.toBuilder()
                .severity(Math.min(10, Math.max(1, assessment.getSeverity())))
                .confidence(confidence)
                .hypotheses(assessment.getHypotheses() != null ? assessment.getHypotheses() : List.of())
                .build();
    }
}
