package com.anomalyhunter.detector;

import com.anomalyhunter.domain.enums.StrategyId;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Root-cause strategy: groups IQR outliers into temporal clusters and uses lag-1
 * autocorrelation to judge whether they reflect a persistent shift or isolated noise.
 *
 * <p>Outliers fall outside {@code [Q1 - 1.5 * IQR, Q3 + 1.5 * IQR]}. Outliers at most five
 * positions apart share a cluster; each cluster is represented by its first index. Up to
 * three rule-based hypotheses are derived from the cluster shape, the coefficient of variation
 * and the {@code source} metadata; an oracle that returns its own hypotheses replaces them.
 *
 * <p>Severity comes from the oracle, otherwise {@code min(10, 2 + clusterCount)}. Confidence
 * starts from the oracle's confidence (0.5 without one), +0.1 when
 * {@code |autocorrelation| > 0.7}, -0.1 when it is below 0.3, and -0.1 when more than four
 * hypotheses compete, clamped to [0,1].
 */
@Component
public class ClusterCorrelationAnalyzer implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(ClusterCorrelationAnalyzer.class);

    static final double IQR_MULTIPLIER = 1.5;
    static final int CLUSTER_GAP = 5;
    static final int MAX_REPORTED_CLUSTERS = 10;
    static final int RECURRING_CLUSTER_COUNT = 5;
    static final double HIGH_VARIATION = 0.5;
    static final double STRONG_CORRELATION = 0.7;
    static final double WEAK_CORRELATION = 0.3;
    static final int MAX_CONFIDENT_HYPOTHESES = 4;
    static final double BASE_CONFIDENCE = 0.5;

    public static final String EVIDENCE_LOWER_BOUND = "lowerBound";
    public static final String EVIDENCE_UPPER_BOUND = "upperBound";
    public static final String EVIDENCE_OUTLIER_COUNT = "outlierCount";
    public static final String EVIDENCE_CLUSTER_COUNT = "clusterCount";
    public static final String EVIDENCE_CLUSTER_REPRESENTATIVES = "clusterRepresentatives";
    public static final String EVIDENCE_CORRELATION_STRENGTH = "correlationStrength";
    public static final String EVIDENCE_HYPOTHESES = "hypotheses";

    private final OracleGateway oracleGateway;

    public ClusterCorrelationAnalyzer(OracleGateway oracleGateway) {
        this.oracleGateway = oracleGateway;
    }

    @Override
    public StrategyId getStrategyId() {
        return StrategyId.CLUSTER;
    }

    @Override
    public Finding detect(Series series) {
        double[] values = series.toArray();
        double[] sorted = SeriesStatistics.sortedCopy(values);
        double q1 = SeriesStatistics.percentile(sorted, 25.0);
        double q3 = SeriesStatistics.percentile(sorted, 75.0);
        double iqr = q3 - q1;
        double lower = q1 - IQR_MULTIPLIER * iqr;
        double upper = q3 + IQR_MULTIPLIER * iqr;

        List<Integer> outliers = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (values[i] < lower || values[i] > upper) {
                outliers.add(i);
            }
        }

        List<List<Integer>> clusters = cluster(outliers);
        double correlationStrength = Math.abs(SeriesStatistics.lag1Autocorrelation(values));
        List<String> ruleHypotheses = hypotheses(values, clusters.size(), series.getMetadata());

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put(EVIDENCE_LOWER_BOUND, lower);
        evidence.put(EVIDENCE_UPPER_BOUND, upper);
        evidence.put(EVIDENCE_OUTLIER_COUNT, outliers.size());
        evidence.put(EVIDENCE_CLUSTER_COUNT, clusters.size());
        evidence.put(
                EVIDENCE_CLUSTER_REPRESENTATIVES,
                clusters.stream().limit(MAX_REPORTED_CLUSTERS).map(c -> c.get(0)).toList());
        evidence.put(EVIDENCE_CORRELATION_STRENGTH, correlationStrength);
        evidence.put(EVIDENCE_HYPOTHESES, ruleHypotheses);

        Optional<OracleAssessment> assessment =
                oracleGateway.assess(StrategyId.CLUSTER, SeriesStatistics.summarize(series), evidence);

        List<String> hypotheses = assessment
                .map(OracleAssessment::getHypotheses)
                .filter(list -> !list.isEmpty())
                .orElse(ruleHypotheses);
        evidence.put(EVIDENCE_HYPOTHESES, hypotheses);

        int severity = assessment.map(OracleAssessment::getSeverity).orElseGet(() -> fallbackSeverity(clusters.size()));
        double baseConfidence =
                assessment.map(OracleAssessment::getConfidence).orElse(BASE_CONFIDENCE);
        double confidence = confidence(baseConfidence, correlationStrength, hypotheses.size());
        String summary = assessment
                .map(OracleAssessment::getSummary)
                .filter(text -> !text.isBlank())
                .orElseGet(() -> String.format(
                        Locale.ROOT,
                        "Root cause hypothesis: %s. Evidence: %d anomaly clusters, correlation strength %.2f.",
                        hypotheses.get(0),
                        clusters.size(),
                        correlationStrength));

        log.debug(
                "Cluster finding: outliers={} clusters={} correlation={} hypotheses={} severity={} confidence={}",
                outliers.size(),
                clusters.size(),
                correlationStrength,
                hypotheses.size(),
                severity,
                confidence);

        return Finding.builder()
                .strategyId(StrategyId.CLUSTER)
                .anomalyIndices(FindingSupport.indices(outliers))
                .severity(severity)
                .confidence(confidence)
                .evidence(evidence)
                .summary(summary)
                .detectedAt(Instant.now())
                .build();
    }

    /** Groups ascending indices; a gap larger than {@link #CLUSTER_GAP} starts a new cluster. */
    static List<List<Integer>> cluster(List<Integer> ascendingIndices) {
        List<List<Integer>> clusters = new ArrayList<>();
        List<Integer> current = new ArrayList<>();
        for (Integer index : ascendingIndices) {
            if (!current.isEmpty() && index - current.get(current.size() - 1) > CLUSTER_GAP) {
                clusters.add(current);
                current = new ArrayList<>();
            }
            current.add(index);
        }
        if (!current.isEmpty()) {
            clusters.add(current);
        }
        return clusters;
    }

    static List<String> hypotheses(double[] values, int clusterCount, Map<String, String> metadata) {
        List<String> hypotheses = new ArrayList<>();

        if (clusterCount == 0) {
            hypotheses.add("No outlier clusters - deviations stay inside the interquartile fence");
        } else if (clusterCount == 1) {
            hypotheses.add("Isolated incident - likely single event trigger");
        } else if (clusterCount > RECURRING_CLUSTER_COUNT) {
            hypotheses.add("Recurring pattern - systematic issue or cyclic load");
        } else {
            hypotheses.add("Multiple incidents - correlated events or cascading failure");
        }

        if (coefficientOfVariation(values) > HIGH_VARIATION) {
            hypotheses.add("High variance - resource contention or unstable system");
        } else {
            hypotheses.add("Low variance - external trigger or input spike");
        }

        String source = metadata.get(Series.METADATA_SOURCE);
        if (source != null && !source.isBlank()) {
            hypotheses.add("Source: " + source + " - check upstream dependencies");
        }
        return hypotheses;
    }

    /** Infinite for a spread around a zero mean, zero for a constant series. */
    static double coefficientOfVariation(double[] values) {
        double mean = SeriesStatistics.mean(values);
        double stdDev = SeriesStatistics.stdDev(values);
        if (SeriesStatistics.isNegligibleSpread(stdDev, values)) {
            return 0.0;
        }
        if (mean == 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        return stdDev / Math.abs(mean);
    }

    static int fallbackSeverity(int clusterCount) {
        return FindingSupport.clampSeverity(2 + clusterCount);
    }

    static double confidence(double baseConfidence, double correlationStrength, int hypothesisCount) {
        double confidence = baseConfidence;
        if (correlationStrength > STRONG_CORRELATION) {
            confidence += 0.1;
        } else if (correlationStrength < WEAK_CORRELATION) {
            confidence -= 0.1;
        }
        if (hypothesisCount > MAX_CONFIDENT_HYPOTHESES) {
            confidence -= 0.1;
        }
        return FindingSupport.clampConfidence(confidence);
    }
}
