package com.anomalyhunter.api.dto.response;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/** One strategy's finding inside a {@link VerdictResponse}. */
@Data
@Builder
public class FindingResponse {

    /** Strategy key, e.g. "pattern_analyst". */
    private String strategy;

    private List<Integer> anomalyIndices;
    private int severity;
    private double confidence;
    private Map<String, Object> evidence;
    private String summary;
    private Instant detectedAt;
}
