package com.anomalyhunter.synthesis;

import com.anomalyhunter.domain.enums.Recommendation;
import com.anomalyhunter.domain.enums.StrategyId;
import com.anomalyhunter.domain.model.Finding;
import com.anomalyhunter.domain.model.Verdict;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Merges the findings of one run into a {@link Verdict}. Pure: the adaptive weights are
 * passed in, nothing is read or written elsewhere.
 *
 * <p>Severity is confidence-weighted with learned trust:
 * <pre>
 *   weight_f   = confidence_f * (0.5 + 0.5 * adaptiveWeight_f)
 *   severity   = round_half_up(sum(severity_f * weight_f) / sum(weight_f)), clamped to [1,10]
 * </pre>
 * When every weight is zero the highest raw severity is used instead.
 *
 * <p>Confidence is the plain mean of the finding confidences; adaptive weights only bias
 * severity, so the reported confidence shows the raw agreement level.
 */
@Component
public class VerdictSynthesizer {

    static final int MIN_SEVERITY = 1;
    static final int MAX_SEVERITY = 10;
    static final String SUMMARY_SEPARATOR = " | ";

    /**
     * @param findings at least one finding
     * @param weights adaptive weight per strategy; a missing strategy counts as cold start (0.5)
     * @param failedStrategies strategies skipped in this run
     */
    public Verdict synthesize(
            List<Finding> findings, Map<StrategyId, Double> weights, List<StrategyId> failedStrategies) {
        if (findings.isEmpty()) {
            throw new IllegalArgumentException("Cannot synthesize a verdict without findings");
        }

        int severity = weightedSeverity(findings, weights);
        double confidence =
                findings.stream().mapToDouble(Finding::getConfidence).average().orElse(0.0);

        SortedSet<Integer> anomalyIndices = new TreeSet<>();
        findings.forEach(f -> anomalyIndices.addAll(f.getAnomalyIndices()));

        String summary = findings.stream()
                .map(f -> f.getStrategyId().getKey() + ": " + f.getSummary())
                .collect(Collectors.joining(SUMMARY_SEPARATOR));

        return Verdict.builder()
                .id(UUID.randomUUID().toString())
                .severity(severity)
                .confidence(confidence)
                .anomalyIndices(Collections.unmodifiableSortedSet(anomalyIndices))
                .recommendation(Recommendation.forSeverity(severity))
                .summary(summary)
                .findings(List.copyOf(findings))
                .failedStrategies(List.copyOf(failedStrategies))
                .completedAt(Instant.now())
                .build();
    }

    static int weightedSeverity(List<Finding> findings, Map<StrategyId, Double> weights) {
        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (Finding finding : findings) {
            double adaptive = weights.getOrDefault(finding.getStrategyId(), 0.5);
            double weight = finding.getConfidence() * (0.5 + 0.5 * adaptive);
            weightedSum += finding.getSeverity() * weight;
            totalWeight += weight;
        }

        if (totalWeight == 0.0) {
            int maxSeverity = findings.stream().mapToInt(Finding::getSeverity).max().orElse(MIN_SEVERITY);
            return clamp(maxSeverity);
        }
        return clamp((int) Math.floor(weightedSum / totalWeight + 0.5));
    }

    private static int clamp(int severity) {
        return Math.min(MAX_SEVERITY, Math.max(MIN_SEVERITY, severity));
    }
}
