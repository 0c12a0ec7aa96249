package com.anomalyhunter.oracle;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Oracle answer for one detector. Severity and confidence are clamped by the
 * {@link OracleGateway} before a detector sees them.
 */
@Value
@Builder(toBuilder = true)
public class OracleAssessment {

    int severity;

    String summary;

    /** Optional; only the cluster analyzer uses it, as the base of its confidence. */
    Double confidence;

    /** Optional; replaces the cluster analyzer's rule-based hypotheses when non-empty. */
    @Builder.Default
    List<String> hypotheses = List.of();
}
