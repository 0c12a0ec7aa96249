package com.anomalyhunter.api.dto.response;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class VerdictResponse {

    private String id;
    private int severity;
    private double confidence;
    private List<Integer> anomalyIndices;

    /** Tier name: CRITICAL, HIGH, MEDIUM, LOW or MINIMAL. */
    private String recommendation;

    private String recommendedAction;
    private String summary;
    private boolean degraded;
    private List<String> failedStrategies;
    private List<FindingResponse> findings;
    private Instant completedAt;
}
