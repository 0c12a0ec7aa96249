package com.anomalyhunter.api.controller;

import com.anomalyhunter.api.dto.request.InvestigationRequest;
import com.anomalyhunter.api.dto.response.VerdictResponse;
import com.anomalyhunter.domain.model.Series;
import com.anomalyhunter.domain.model.Verdict;
import com.anomalyhunter.mapper.VerdictMapper;
import com.anomalyhunter.observability.DetectionLog;
import com.anomalyhunter.synthesis.InvestigationService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for detection runs.
 *
 * <ul>
 *   <li>POST /api/investigations -- run all strategies over a series and return the verdict</li>
 *   <li>GET /api/investigations/recent -- most recent verdicts, newest first</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/investigations")
@Validated
public class InvestigationController {

    private final InvestigationService investigationService;
    private final DetectionLog detectionLog;
    private final VerdictMapper verdictMapper = Mappers.getMapper(VerdictMapper.class);

    public InvestigationController(InvestigationService investigationService, DetectionLog detectionLog) {
        this.investigationService = investigationService;
        this.detectionLog = detectionLog;
    }

    @PostMapping
    public ResponseEntity<VerdictResponse> investigate(@Valid @RequestBody InvestigationRequest request) {
        Series series = Series.of(request.getValues(), request.getTimestamps(), request.getMetadata());
        Verdict verdict = investigationService.investigate(series);
        return ResponseEntity.ok(verdictMapper.toResponse(verdict));
    }

    @GetMapping("/recent")
    public ResponseEntity<List<VerdictResponse>> getRecent(
            @RequestParam(defaultValue = "20") @Min(1) @Max(1000) int count) {
        return ResponseEntity.ok(verdictMapper.toResponseList(detectionLog.getRecent(count)));
    }
}
