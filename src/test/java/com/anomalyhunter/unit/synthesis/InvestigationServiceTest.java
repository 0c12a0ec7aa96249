package com.anomalyhunter.unit.synthesis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.anomalyhunter.config.DetectionProperties;
import com.anomalyhunter.config.LearningProperties;
import com.anomalyhunter.detector.AnomalyDetector;
import com.anomalyhunter.detector.ClusterCorrelationAnalyzer;
import com.anomalyhunter.detector.DriftChangePointDetector;
import com.anomalyhunter.detector.StatisticalPatternDetector;
import com.anomalyhunter.domain.enums.Recommendation;
import com.anomalyhunter.domain.enums.StrategyId;
import com.anomalyhunter.domain.model.Finding;
import com.anomalyhunter.domain.model.Series;
import com.anomalyhunter.domain.model.Verdict;
import com.anomalyhunter.event.EventPublisherHelper;
import com.anomalyhunter.exception.AllStrategiesFailedException;
import com.anomalyhunter.learning.AdaptiveWeightTracker;
import com.anomalyhunter.learning.LearningStatePersister;
import com.anomalyhunter.learning.PatternLibrary;
import com.anomalyhunter.oracle.OracleAssessment;
import com.anomalyhunter.oracle.OracleGateway;
import com.anomalyhunter.oracle.TextAndSeverityOracle;
import com.anomalyhunter.repository.redis.LearningStateRedisRepository;
import com.anomalyhunter.synthesis.InvestigationService;
import com.anomalyhunter.synthesis.VerdictSynthesizer;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.timelimiter.TimeLimiter;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class InvestigationServiceTest {

    @Mock
    private AdaptiveWeightTracker adaptiveWeightTracker;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private ExecutorService detectorExecutor;
    private DetectionProperties detectionProperties;

    @BeforeEach
    void setUp() {
        detectorExecutor = Executors.newFixedThreadPool(4);
        detectionProperties = new DetectionProperties();
    }

    @AfterEach
    void tearDown() {
        detectorExecutor.shutdownNow();
    }

    private InvestigationService service(List<AnomalyDetector> detectors, AdaptiveWeightTracker tracker) {
        return new InvestigationService(
                detectors, new VerdictSynthesizer(), tracker, eventPublisherHelper, detectorExecutor, detectionProperties);
    }

    private static Series spikeAt25() {
        double[] values = new double[50];
        Arrays.fill(values, 100.0);
        values[25] = 500.0;
        return Series.of(values);
    }

    private static AnomalyDetector fixed(StrategyId strategyId, int severity, double confidence, Integer... indices) {
        return new StubDetector(strategyId, series -> Finding.builder()
                .strategyId(strategyId)
                .anomalyIndices(new TreeSet<>(List.of(indices)))
                .severity(severity)
                .confidence(confidence)
                .evidence(Map.of())
                .summary("fixed")
                .detectedAt(Instant.now())
                .build());
    }

    private static AnomalyDetector failing(StrategyId strategyId) {
        return new StubDetector(strategyId, series -> {
            throw new IllegalStateException(strategyId.getKey() + " crashed");
        });
    }

    private static AnomalyDetector blocking(StrategyId strategyId, CountDownLatch release) {
        AnomalyDetector delegate = fixed(strategyId, 5, 0.5, 1);
        return new StubDetector(strategyId, series -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return delegate.detect(series);
        });
    }

    private static final class StubDetector implements AnomalyDetector {

        private final StrategyId strategyId;
        private final Function<Series, Finding> behaviour;

        private StubDetector(StrategyId strategyId, Function<Series, Finding> behaviour) {
            this.strategyId = strategyId;
            this.behaviour = behaviour;
        }

        @Override
        public StrategyId getStrategyId() {
            return strategyId;
        }

        @Override
        public Finding detect(Series series) {
            return behaviour.apply(series);
        }
    }

    @Nested
    @DisplayName("End to end with real detectors")
    class EndToEnd {

        private AdaptiveWeightTracker tracker;

        @BeforeEach
        void setUpTracker() {
            tracker = new AdaptiveWeightTracker(
                    mock(LearningStateRedisRepository.class),
                    mock(LearningStatePersister.class),
                    new PatternLibrary(new LearningProperties()),
                    new LearningProperties());
        }

        private List<AnomalyDetector> detectors(OracleGateway gateway) {
            return List.of(
                    new StatisticalPatternDetector(gateway),
                    new DriftChangePointDetector(gateway),
                    new ClusterCorrelationAnalyzer(gateway));
        }

        private OracleGateway gateway(TextAndSeverityOracle oracle) {
            return new OracleGateway(
                    oracle, null, CircuitBreaker.ofDefaults("oracle"), TimeLimiter.ofDefaults("oracle"), Runnable::run);
        }

        @Test
        @DisplayName("Spike at index 25 with an agreeing oracle yields a HIGH verdict and updates learning")
        void spikeWithOracle() {
            TextAndSeverityOracle oracle = request -> OracleAssessment.builder()
                    .severity(7)
                    .summary("Deviation at index 25")
                    .confidence(request.getStrategyId() == StrategyId.CLUSTER ? 0.6 : null)
                    .build();
            InvestigationService service = service(detectors(gateway(oracle)), tracker);

            Verdict verdict = service.investigate(spikeAt25());

            assertThat(verdict.getAnomalyIndices()).contains(25);
            assertThat(verdict.getSeverity()).isGreaterThanOrEqualTo(7);
            assertThat(verdict.getRecommendation()).isEqualTo(Recommendation.HIGH);
            assertThat(verdict.getFindings()).hasSize(3);
            assertThat(verdict.getFailedStrategies()).isEmpty();

            Finding cluster = verdict.getFindings().stream()
                    .filter(f -> f.getStrategyId() == StrategyId.CLUSTER)
                    .findFirst()
                    .orElseThrow();
            assertThat(cluster.getEvidence()).containsEntry(ClusterCorrelationAnalyzer.EVIDENCE_CLUSTER_COUNT, 1);

            assertThat(tracker.getTotalDetections()).isEqualTo(1);
            assertThat(tracker.weightFor(StrategyId.STATISTICAL)).isEqualTo(1.0);
            verify(eventPublisherHelper).publishDetection(eq(service), eq(verdict), any(Duration.class));
        }

        @Test
        @DisplayName("Without an oracle a cold start gives severity 6 (MEDIUM), short of the expected 7; learned weights reach 7")
        void spikeWithFallbacks() {
            InvestigationService service = service(detectors(gateway(null)), tracker);

            Verdict first = service.investigate(spikeAt25());
            Verdict second = service.investigate(spikeAt25());

            assertThat(first.getAnomalyIndices()).containsExactly(25);
            assertThat(first.getSeverity()).isEqualTo(6);
            assertThat(first.getRecommendation()).isEqualTo(Recommendation.MEDIUM);
            assertThat(second.getSeverity()).isEqualTo(7);
            assertThat(second.getConfidence()).isEqualTo(first.getConfidence());
            assertThat(tracker.getTotalDetections()).isEqualTo(2);
        }

        @Test
        @DisplayName("Constant series completes with no anomalies")
        void constantSeries() {
            InvestigationService service = service(detectors(gateway(null)), tracker);

            Verdict verdict = service.investigate(Series.of(4, 4, 4, 4, 4, 4, 4, 4, 4, 4));

            assertThat(verdict.getAnomalyIndices()).isEmpty();
            assertThat(verdict.getFindings()).hasSize(3);
        }
    }

    @Nested
    @DisplayName("Degradation")
    class Degradation {

        @Test
        @DisplayName("One failing detector leaves a verdict built from the two survivors")
        void oneDetectorFails() {
            when(adaptiveWeightTracker.weightsSnapshot()).thenReturn(Map.of());
            InvestigationService service = service(
                    List.of(
                            fixed(StrategyId.STATISTICAL, 8, 0.9, 25),
                            failing(StrategyId.DRIFT),
                            fixed(StrategyId.CLUSTER, 4, 0.5, 3, 25)),
                    adaptiveWeightTracker);

            Verdict verdict = service.investigate(spikeAt25());

            assertThat(verdict.getFindings()).hasSize(2);
            assertThat(verdict.getAnomalyIndices()).containsExactly(3, 25);
            assertThat(verdict.getFailedStrategies()).containsExactly(StrategyId.DRIFT);
            assertThat(verdict.isDegraded()).isTrue();
            verify(adaptiveWeightTracker).recordOutcome(verdict);
            verify(eventPublisherHelper).publishDetectorFailure(eq(service), eq(StrategyId.DRIFT), contains("crashed"));
        }

        @Test
        @DisplayName("Detector exceeding its timeout is treated as failed")
        void detectorTimesOut() {
            detectionProperties.setDetectorTimeout(Duration.ofMillis(100));
            when(adaptiveWeightTracker.weightsSnapshot()).thenReturn(Map.of());
            AnomalyDetector slow = new StubDetector(StrategyId.DRIFT, series -> {
                try {
                    Thread.sleep(2_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            });
            InvestigationService service = service(
                    List.of(fixed(StrategyId.STATISTICAL, 8, 0.9, 25), slow, fixed(StrategyId.CLUSTER, 4, 0.5, 25)),
                    adaptiveWeightTracker);

            Verdict verdict = service.investigate(spikeAt25());

            assertThat(verdict.getFailedStrategies()).containsExactly(StrategyId.DRIFT);
            verify(eventPublisherHelper).publishDetectorFailure(eq(service), eq(StrategyId.DRIFT), contains("Timed out"));
        }

        @Test
        @DisplayName("Saturated pool rejects detectors as failures and interrupts the one that overruns")
        void saturatedPool() throws Exception {
            detectorExecutor.shutdownNow();
            detectorExecutor = new ThreadPoolExecutor(
                    1, 1, 0, TimeUnit.SECONDS, new SynchronousQueue<>(), new ThreadPoolExecutor.AbortPolicy());
            detectionProperties.setDetectorTimeout(Duration.ofMillis(200));
            CountDownLatch interrupted = new CountDownLatch(1);
            AnomalyDetector hung = new StubDetector(StrategyId.STATISTICAL, series -> {
                try {
                    new CountDownLatch(1).await();
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                }
                return null;
            });
            InvestigationService service = service(
                    List.of(hung, fixed(StrategyId.DRIFT, 6, 0.7, 25), fixed(StrategyId.CLUSTER, 4, 0.5, 25)),
                    adaptiveWeightTracker);

            long started = System.nanoTime();
            assertThatThrownBy(() -> service.investigate(spikeAt25()))
                    .isInstanceOf(AllStrategiesFailedException.class)
                    .satisfies(e -> assertThat(((AllStrategiesFailedException) e).getFailures())
                            .extracting(Throwable::getMessage)
                            .containsExactly(
                                    "Timed out after 200ms",
                                    "Rejected: detector pool saturated",
                                    "Rejected: detector pool saturated"));

            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
            assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
            verify(adaptiveWeightTracker, never()).recordOutcome(any());
        }

        @Test
        @DisplayName("All detectors failing raises AllStrategiesFailedException and records nothing")
        void allDetectorsFail() {
            InvestigationService service = service(
                    List.of(failing(StrategyId.STATISTICAL), failing(StrategyId.DRIFT), failing(StrategyId.CLUSTER)),
                    adaptiveWeightTracker);

            assertThatThrownBy(() -> service.investigate(spikeAt25()))
                    .isInstanceOf(AllStrategiesFailedException.class)
                    .satisfies(e -> assertThat(((AllStrategiesFailedException) e).getFailures())
                            .hasSize(3));

            verify(adaptiveWeightTracker, never()).recordOutcome(any());
            verify(eventPublisherHelper, never()).publishDetection(any(), any(), any());
            verify(eventPublisherHelper).publishDetectorFailure(eq(service), eq(StrategyId.CLUSTER), anyString());
        }
    }

    @Nested
    @DisplayName("Asynchronous runs")
    class AsynchronousRuns {

        @Test
        @DisplayName("investigateAsync completes with the verdict")
        void completesWithVerdict() throws Exception {
            when(adaptiveWeightTracker.weightsSnapshot()).thenReturn(Map.of());
            InvestigationService service = service(
                    List.of(
                            fixed(StrategyId.STATISTICAL, 8, 0.9, 25),
                            fixed(StrategyId.DRIFT, 6, 0.7, 25),
                            fixed(StrategyId.CLUSTER, 4, 0.5, 25)),
                    adaptiveWeightTracker);

            Verdict verdict = service.investigateAsync(spikeAt25()).get(5, TimeUnit.SECONDS);

            assertThat(verdict.getFindings()).hasSize(3);
            verify(adaptiveWeightTracker).recordOutcome(verdict);
        }

        @Test
        @DisplayName("Total failure completes the future exceptionally")
        void totalFailureCompletesExceptionally() {
            InvestigationService service = service(
                    List.of(failing(StrategyId.STATISTICAL), failing(StrategyId.DRIFT), failing(StrategyId.CLUSTER)),
                    adaptiveWeightTracker);

            CompletableFuture<Verdict> future = service.investigateAsync(spikeAt25());

            assertThatThrownBy(future::join)
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(AllStrategiesFailedException.class);
            verify(adaptiveWeightTracker, never()).recordOutcome(any());
        }

        @Test
        @DisplayName("Cancelled run is never recorded, even after its detectors finish")
        void cancelledRunNotRecorded() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            InvestigationService service = service(
                    List.of(
                            blocking(StrategyId.STATISTICAL, release),
                            blocking(StrategyId.DRIFT, release),
                            blocking(StrategyId.CLUSTER, release)),
                    adaptiveWeightTracker);

            CompletableFuture<Verdict> future = service.investigateAsync(spikeAt25());
            assertThat(future.cancel(true)).isTrue();

            release.countDown();
            detectorExecutor.shutdown();
            assertThat(detectorExecutor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

            assertThat(future.isCancelled()).isTrue();
            verify(adaptiveWeightTracker, never()).weightsSnapshot();
            verify(adaptiveWeightTracker, never()).recordOutcome(any());
            verify(eventPublisherHelper, never()).publishDetection(any(), any(), any());
        }
    }

    @Test
    @DisplayName("Same series and same learning state give the same verdict")
    void deterministic() {
        when(adaptiveWeightTracker.weightsSnapshot())
                .thenReturn(Map.of(StrategyId.STATISTICAL, 0.8, StrategyId.DRIFT, 0.6, StrategyId.CLUSTER, 0.4));
        OracleGateway gateway = new OracleGateway(
                null, null, CircuitBreaker.ofDefaults("oracle"), TimeLimiter.ofDefaults("oracle"), Runnable::run);
        InvestigationService service = service(
                List.of(
                        new StatisticalPatternDetector(gateway),
                        new DriftChangePointDetector(gateway),
                        new ClusterCorrelationAnalyzer(gateway)),
                adaptiveWeightTracker);

        Verdict first = service.investigate(spikeAt25());
        Verdict second = service.investigate(spikeAt25());

        assertThat(second.getSeverity()).isEqualTo(first.getSeverity());
        assertThat(second.getConfidence()).isEqualTo(first.getConfidence());
        assertThat(second.getAnomalyIndices()).isEqualTo(first.getAnomalyIndices());
        assertThat(second.getSummary()).isEqualTo(first.getSummary());
    }
}
