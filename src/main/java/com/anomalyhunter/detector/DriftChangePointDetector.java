package com.anomalyhunter.detector;

import com.anomalyhunter.domain.enums.StrategyId;
import com.anomalyhunter.domain.enums.Trend;
import com.anomalyhunter.domain.model.Finding;
import com.anomalyhunter.domain.model.Series;
import com.anomalyhunter.oracle.OracleAssessment;
import com.anomalyhunter.oracle.OracleGateway;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Detects abrupt regime changes and sustained drift.
 *
 * <p><b>Change points.</b> The series is smoothed with a moving average over
 * {@code window = max(3, n / 20)} samples (full windows only). Successive differences of the
 * smoothed series form the derivative. An entry is a change point when
 * {@code |derivative| > 2 * std(derivative)}; entry {@code j} is attributed to series index
 * {@code j + window}, the sample that entered the window, unless sample {@code j} (the one
 * leaving) was itself flagged on entry, in which case it is attributed to {@code j}. A spike
 * is therefore reported once, at its own index. A derivative whose spread is negligible
 * next to its magnitude (flat or linear series, fractional steps included) has no change
 * points.
 *
 * <p><b>Drift.</b> {@code (meanSecondHalf - meanFirstHalf) / meanFirstHalf * 100}. When the
 * first half averages exactly zero the percentage is undefined; the absolute difference is
 * used in its place and flagged as {@code driftUndefined} in the evidence.
 *
 * <p>Severity comes from the oracle, otherwise {@code min(10, 3 + floor(|drift| / 20))}.
 * Confidence starts at 0.5: +0.2 when drift exceeds 5%, +0.2 for more than five change points
 * (+0.1 for more than two), +0.2 when drift exceeds 50% (+0.1 above 30%).
 */
@Component
public class DriftChangePointDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(DriftChangePointDetector.class);

    static final int MIN_WINDOW = 3;
    static final int WINDOW_DIVISOR = 20;
    static final double CHANGE_THRESHOLD_SIGMAS = 2.0;
    static final double DRIFT_THRESHOLD_PERCENT = 5.0;

    public static final String EVIDENCE_WINDOW = "window";
    public static final String EVIDENCE_CHANGE_POINT_COUNT = "changePointCount";
    public static final String EVIDENCE_DRIFT_PERCENTAGE = "driftPercentage";
    public static final String EVIDENCE_DRIFT_UNDEFINED = "driftUndefined";
    public static final String EVIDENCE_DRIFT_DETECTED = "driftDetected";
    public static final String EVIDENCE_MEAN_FIRST_HALF = "meanFirstHalf";
    public static final String EVIDENCE_MEAN_SECOND_HALF = "meanSecondHalf";
    public static final String EVIDENCE_TREND = "trend";

    private final OracleGateway oracleGateway;

    public DriftChangePointDetector(OracleGateway oracleGateway) {
        this.oracleGateway = oracleGateway;
    }

    @Override
    public StrategyId getStrategyId() {
        return StrategyId.DRIFT;
    }

    @Override
    public Finding detect(Series series) {
        double[] values = series.toArray();
        Map<String, Object> evidence = new LinkedHashMap<>();

        if (values.length < 2) {
            evidence.put(EVIDENCE_CHANGE_POINT_COUNT, 0);
            return Finding.builder()
                    .strategyId(StrategyId.DRIFT)
                    .anomalyIndices(FindingSupport.noIndices())
                    .severity(FindingSupport.DEGENERATE_SEVERITY)
                    .confidence(FindingSupport.DEGENERATE_CONFIDENCE)
                    .evidence(evidence)
                    .summary("Single sample, no change to measure.")
                    .detectedAt(Instant.now())
                    .build();
        }

        int window = windowFor(values.length);
        List<Integer> changePoints = changePoints(values, window);

        int half = values.length / 2;
        double meanFirst = SeriesStatistics.mean(values, 0, half);
        double meanSecond = SeriesStatistics.mean(values, half, values.length);
        boolean driftUndefined = meanFirst == 0.0;
        double drift = driftUndefined ? meanSecond - meanFirst : (meanSecond - meanFirst) / meanFirst * 100.0;
        boolean driftDetected = Math.abs(drift) > DRIFT_THRESHOLD_PERCENT;
        Trend trend = trendOf(drift);

        evidence.put(EVIDENCE_WINDOW, window);
        evidence.put(EVIDENCE_CHANGE_POINT_COUNT, changePoints.size());
        evidence.put(EVIDENCE_DRIFT_PERCENTAGE, drift);
        evidence.put(EVIDENCE_DRIFT_UNDEFINED, driftUndefined);
        evidence.put(EVIDENCE_DRIFT_DETECTED, driftDetected);
        evidence.put(EVIDENCE_MEAN_FIRST_HALF, meanFirst);
        evidence.put(EVIDENCE_MEAN_SECOND_HALF, meanSecond);
        evidence.put(EVIDENCE_TREND, trend.name());

        Optional<OracleAssessment> assessment =
                oracleGateway.assess(StrategyId.DRIFT, SeriesStatistics.summarize(series), evidence);

        int severity = assessment.map(OracleAssessment::getSeverity).orElseGet(() -> fallbackSeverity(drift));
        double confidence = confidence(drift, changePoints.size());
        String summary = assessment
                .map(OracleAssessment::getSummary)
                .filter(text -> !text.isBlank())
                .orElseGet(() -> String.format(
                        Locale.ROOT,
                        "%d change points detected, %s trend. Drift magnitude: %.1f%s.",
                        changePoints.size(),
                        trend.name().toLowerCase(Locale.ROOT),
                        drift,
                        driftUndefined ? " (absolute, zero baseline)" : "%"));

        log.debug(
                "Drift finding: window={} changePoints={} drift={} undefined={} severity={} confidence={}",
                window,
                changePoints.size(),
                drift,
                driftUndefined,
                severity,
                confidence);

        return Finding.builder()
                .strategyId(StrategyId.DRIFT)
                .anomalyIndices(FindingSupport.indices(changePoints))
                .severity(severity)
                .confidence(confidence)
                .evidence(evidence)
                .summary(summary)
                .detectedAt(Instant.now())
                .build();
    }

    static int windowFor(int size) {
        return Math.max(MIN_WINDOW, size / WINDOW_DIVISOR);
    }

    static List<Integer> changePoints(double[] values, int window) {
        double[] derivative = SeriesStatistics.differences(SeriesStatistics.movingAverage(values, window));
        double spread = SeriesStatistics.stdDev(derivative);
        if (SeriesStatistics.isNegligibleSpread(spread, derivative)) {
            return new ArrayList<>();
        }
        double threshold = CHANGE_THRESHOLD_SIGMAS * spread;
        Set<Integer> changePoints = new TreeSet<>();
        for (int j = 0; j < derivative.length; j++) {
            if (Math.abs(derivative[j]) > threshold) {
                // A sample already flagged on entry is leaving the window: same event.
                changePoints.add(changePoints.contains(j) ? j : j + window);
            }
        }
        return new ArrayList<>(changePoints);
    }

    static Trend trendOf(double drift) {
        if (drift > DRIFT_THRESHOLD_PERCENT) {
            return Trend.UPWARD;
        }
        if (drift < -DRIFT_THRESHOLD_PERCENT) {
            return Trend.DOWNWARD;
        }
        return Trend.STABLE;
    }

    static int fallbackSeverity(double drift) {
        return FindingSupport.clampSeverity(3 + Math.floor(Math.abs(drift) / 20.0));
    }

    static double confidence(double drift, int changePointCount) {
        double magnitude = Math.abs(drift);
        double confidence = 0.5;
        if (magnitude > DRIFT_THRESHOLD_PERCENT) {
            confidence += 0.2;
        }
        if (changePointCount > 5) {
            confidence += 0.2;
        } else if (changePointCount > 2) {
            confidence += 0.1;
        }
        if (magnitude > 50.0) {
            confidence += 0.2;
        } else if (magnitude > 30.0) {
            confidence += 0.1;
        }
        return FindingSupport.clampConfidence(confidence);
    }
}
