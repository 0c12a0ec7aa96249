package com.anomalyhunter.api.dto.request;

import jakarta.validation.constraints.NotEmpty;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a detection run over one numeric series.
 * Null samples are dropped before detection, together with their timestamps.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvestigationRequest {

    @NotEmpty
    private List<Double> values;

    /** Optional; when present must have the same length as {@code values}. */
    private List<Instant> timestamps;

    /** Opaque context; {@code source} feeds the root-cause hypotheses. */
    private Map<String, String> metadata;
}
