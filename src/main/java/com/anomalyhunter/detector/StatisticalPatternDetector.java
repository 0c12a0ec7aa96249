package com.anomalyhunter.detector;

import com.anomalyhunter.domain.enums.StrategyId;
import com.anomalyhunter.domain.model.Finding;
import com.anomalyhunter.domain.model.Series;
import com.anomalyhunter.oracle.OracleAssessment;
import com.anomalyhunter.oracle.OracleGateway;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Flags samples whose z-score against the whole-series baseline exceeds a fixed threshold.
 *
 * <p>Baseline statistics are computed over the full series (population standard deviation).
 * A sample is anomalous when {@code |z| > 3.0}. The five largest {@code |z|} values are
 * reported as evidence whether or not they cross the threshold.
 *
 * <p>Severity comes from the oracle when one answers, otherwise
 * {@code min(10, 3 + floor(maxAbsZ))}. Confidence starts at 0.5 and adds 0.3 when
 * {@code maxAbsZ > 5}, 0.2 when {@code maxAbsZ > 3} and 0.1 when more than three samples are
 * flagged, capped at 1.0. A constant series, or one whose spread is only rounding noise next
 * to its magnitude, yields severity 1 and confidence 0.1 without consulting the oracle.
 */
@Component
public class StatisticalPatternDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(StatisticalPatternDetector.class);

    static final double Z_SCORE_THRESHOLD = 3.0;
    static final double STRONG_Z_SCORE = 5.0;
    static final int TOP_DEVIATION_COUNT = 5;
    static final int MANY_ANOMALIES = 3;

    public static final String EVIDENCE_MEAN = "mean";
    public static final String EVIDENCE_STD_DEV = "stdDev";
    public static final String EVIDENCE_MEDIAN = "median";
    public static final String EVIDENCE_MIN = "min";
    public static final String EVIDENCE_MAX = "max";
    public static final String EVIDENCE_MAX_ABS_Z = "maxAbsZ";
    public static final String EVIDENCE_ANOMALY_COUNT = "anomalyCount";
    public static final String EVIDENCE_TOP_DEVIATIONS = "topDeviations";

    private final OracleGateway oracleGateway;

    public StatisticalPatternDetector(OracleGateway oracleGateway) {
        this.oracleGateway = oracleGateway;
    }

    @Override
    public StrategyId getStrategyId() {
        return StrategyId.STATISTICAL;
    }

    @Override
    public Finding detect(Series series) {
        double[] values = series.toArray();
        double mean = SeriesStatistics.mean(values);
        double stdDev = SeriesStatistics.stdDev(values);

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put(EVIDENCE_MEAN, mean);
        evidence.put(EVIDENCE_STD_DEV, stdDev);
        evidence.put(EVIDENCE_MEDIAN, SeriesStatistics.median(values));
        evidence.put(EVIDENCE_MIN, SeriesStatistics.min(values));
        evidence.put(EVIDENCE_MAX, SeriesStatistics.max(values));

        if (SeriesStatistics.isNegligibleSpread(stdDev, values)) {
            evidence.put(EVIDENCE_MAX_ABS_Z, 0.0);
            evidence.put(EVIDENCE_ANOMALY_COUNT, 0);
            evidence.put(EVIDENCE_TOP_DEVIATIONS, List.of());
            return Finding.builder()
                    .strategyId(StrategyId.STATISTICAL)
                    .anomalyIndices(FindingSupport.noIndices())
                    .severity(FindingSupport.DEGENERATE_SEVERITY)
                    .confidence(FindingSupport.DEGENERATE_CONFIDENCE)
                    .evidence(evidence)
                    .summary(String.format(Locale.ROOT, "No spread around baseline %.2f, nothing to score.", mean))
                    .detectedAt(Instant.now())
                    .build();
        }

        double[] absZ = new double[values.length];
        List<Integer> flagged = new ArrayList<>();
        double peakZ = 0.0;
        for (int i = 0; i < values.length; i++) {
            absZ[i] = Math.abs((values[i] - mean) / stdDev);
            peakZ = Math.max(peakZ, absZ[i]);
            if (absZ[i] > Z_SCORE_THRESHOLD) {
                flagged.add(i);
            }
        }

        double maxAbsZ = peakZ;
        evidence.put(EVIDENCE_MAX_ABS_Z, maxAbsZ);
        evidence.put(EVIDENCE_ANOMALY_COUNT, flagged.size());
        evidence.put(EVIDENCE_TOP_DEVIATIONS, topDeviations(absZ));

        Optional<OracleAssessment> assessment =
                oracleGateway.assess(StrategyId.STATISTICAL, SeriesStatistics.summarize(series), evidence);

        int severity = assessment.map(OracleAssessment::getSeverity).orElseGet(() -> fallbackSeverity(maxAbsZ));
        double confidence = confidence(maxAbsZ, flagged.size());
        String summary = assessment
                .map(OracleAssessment::getSummary)
                .filter(text -> !text.isBlank())
                .orElseGet(() -> String.format(
                        Locale.ROOT,
                        "%d anomalies detected. Top deviation: %.2f sigma from baseline %.2f.",
                        flagged.size(),
                        maxAbsZ,
                        mean));

        log.debug(
                "Statistical finding: flagged={} maxAbsZ={} severity={} confidence={}",
                flagged.size(),
                maxAbsZ,
                severity,
                confidence);

        return Finding.builder()
                .strategyId(StrategyId.STATISTICAL)
                .anomalyIndices(FindingSupport.indices(flagged))
                .severity(severity)
                .confidence(confidence)
                .evidence(evidence)
                .summary(summary)
                .detectedAt(Instant.now())
                .build();
    }

    static int fallbackSeverity(double maxAbsZ) {
        return FindingSupport.clampSeverity(3 + Math.floor(maxAbsZ));
    }

    static double confidence(double maxAbsZ, int anomalyCount) {
        double confidence = 0.5;
        if (maxAbsZ > STRONG_Z_SCORE) {
            confidence += 0.3;
        }
        if (maxAbsZ > Z_SCORE_THRESHOLD) {
            confidence += 0.2;
        }
        if (anomalyCount > MANY_ANOMALIES) {
            confidence += 0.1;
        }
        return FindingSupport.clampConfidence(confidence);
    }

    /** Largest |z| first; ties resolved by position so the result is deterministic. */
    private static List<Map<String, Object>> topDeviations(double[] absZ) {
        return IntStream.range(0, absZ.length)
                .boxed()
                .sorted(Comparator.<Integer>comparingDouble(i -> absZ[i]).reversed().thenComparing(i -> i))
                .limit(TOP_DEVIATION_COUNT)
                .map(i -> {
                    Map<String, Object> deviation = new LinkedHashMap<>();
                    deviation.put("index", i);
                    deviation.put("absZ", absZ[i]);
                    return deviation;
                })
                .toList();
    }
}
