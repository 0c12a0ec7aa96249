package com.anomalyhunter.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.anomalyhunter.api.controller.InvestigationController;
import com.anomalyhunter.config.ApiResponseAdvice;
import com.anomalyhunter.domain.enums.StrategyId;
import com.anomalyhunter.domain.model.Series;
import com.anomalyhunter.exception.AllStrategiesFailedException;
import com.anomalyhunter.exception.DetectorFailureException;
import com.anomalyhunter.exception.GlobalExceptionHandler;
import com.anomalyhunter.observability.DetectionLog;
import com.anomalyhunter.synthesis.InvestigationService;
import com.anomalyhunter.unit.TestVerdicts;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the InvestigationController.
 */
@ExtendWith(MockitoExtension.class)
class InvestigationControllerTest {

    private MockMvc mockMvc;

    @Mock
    private InvestigationService investigationService;

    @Mock
    private DetectionLog detectionLog;

    @BeforeEach
    void setUp() {
        InvestigationController controller = new InvestigationController(investigationService, detectionLog);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("POST /api/investigations returns the verdict in the envelope")
    void investigateReturnsVerdict() throws Exception {
        when(investigationService.investigate(any(Series.class))).thenReturn(TestVerdicts.verdict("v-1", 8));

        mockMvc.perform(post("/api/investigations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"values\":[100,100,500,100],\"metadata\":{\"source\":\"checkout-api\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.id").value("v-1"))
                .andExpect(jsonPath("$.data.severity").value(8))
                .andExpect(jsonPath("$.data.recommendation").value("HIGH"))
                .andExpect(jsonPath("$.data.recommendedAction").exists())
                .andExpect(jsonPath("$.data.anomalyIndices[0]").value(25))
                .andExpect(jsonPath("$.data.degraded").value(true))
                .andExpect(jsonPath("$.data.failedStrategies[0]").value("change_detective"))
                .andExpect(jsonPath("$.data.findings[0].strategy").value("pattern_analyst"))
                .andExpect(jsonPath("$.data.findings[0].evidence.maxZScore").value(7.0));
    }

    @Test
    @DisplayName("Request values, timestamps and metadata reach the service as a Series")
    void requestMappedToSeries() throws Exception {
        when(investigationService.investigate(any(Series.class))).thenReturn(TestVerdicts.verdict("v-1", 8));

        mockMvc.perform(post("/api/investigations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"values\":[1.5,null,3.5],"
                                + "\"timestamps\":[\"2025-03-01T10:00:00Z\",\"2025-03-01T10:01:00Z\","
                                + "\"2025-03-01T10:02:00Z\"],"
                                + "\"metadata\":{\"source\":\"checkout-api\"}}"))
                .andExpect(status().isOk());

        ArgumentCaptor<Series> captor = ArgumentCaptor.forClass(Series.class);
        verify(investigationService).investigate(captor.capture());
        assertThat(captor.getValue().toArray()).containsExactly(1.5, 3.5);
        assertThat(captor.getValue().getTimestamps()).hasSize(2);
        assertThat(captor.getValue().getMetadata())
                .containsEntry("source", "checkout-api");
    }

    @Test
    @DisplayName("Empty values are rejected with 400")
    void emptyValuesRejected() throws Exception {
        mockMvc.perform(post("/api/investigations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"values\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

        verify(investigationService, never()).investigate(any());
    }

    @Test
    @DisplayName("Mismatched timestamps are rejected with 400")
    void timestampMismatchRejected() throws Exception {
        mockMvc.perform(post("/api/investigations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"values\":[1,2,3],\"timestamps\":[\"2025-03-01T10:00:00Z\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.samples").value(3))
                .andExpect(jsonPath("$.error.details.timestamps").value(1));

        verify(investigationService, never()).investigate(any());
    }

    @Test
    @DisplayName("Total detector failure maps to 503 with per-strategy details")
    void allStrategiesFailed() throws Exception {
        List<DetectorFailureException> failures = List.of(
                new DetectorFailureException(StrategyId.STATISTICAL, "boom", null),
                new DetectorFailureException(StrategyId.DRIFT, "Timed out after 10000ms", null),
                new DetectorFailureException(StrategyId.CLUSTER, "boom", null));
        when(investigationService.investigate(any(Series.class)))
                .thenThrow(new AllStrategiesFailedException(failures));

        mockMvc.perform(post("/api/investigations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"values\":[1,2,3]}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.code").value("ALL_STRATEGIES_FAILED"))
                .andExpect(jsonPath("$.error.details.change_detective").value("Timed out after 10000ms"));
    }

    @Test
    @DisplayName("GET /api/investigations/recent returns logged verdicts")
    void recentVerdicts() throws Exception {
        when(detectionLog.getRecent(2))
                .thenReturn(List.of(TestVerdicts.verdict("v-2", 6), TestVerdicts.verdict("v-1", 8)));

        mockMvc.perform(get("/api/investigations/recent").param("count", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[0].id").value("v-2"))
                .andExpect(jsonPath("$.data[0].recommendation").value("MEDIUM"));
    }
}
