package com.anomalyhunter.api.controller;

import com.anomalyhunter.domain.model.LearningSnapshot;
import com.anomalyhunter.domain.model.SuccessfulPattern;
import com.anomalyhunter.learning.AdaptiveWeightTracker;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the adaptive learning state, for dashboards and exporters.
 *
 * <ul>
 *   <li>GET /api/learning/snapshot -- per-strategy total runs and average confidence</li>
 *   <li>GET /api/learning/suggestions -- improvement suggestions</li>
 *   <li>GET /api/learning/patterns -- stored high-confidence patterns, oldest first</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/learning")
public class LearningController {

    private final AdaptiveWeightTracker adaptiveWeightTracker;

    public LearningController(AdaptiveWeightTracker adaptiveWeightTracker) {
        this.adaptiveWeightTracker = adaptiveWeightTracker;
    }

    @GetMapping("/snapshot")
    public ResponseEntity<LearningSnapshot> getSnapshot() {
        return ResponseEntity.ok(adaptiveWeightTracker.getLearningSnapshot());
    }

    @GetMapping("/suggestions")
    public ResponseEntity<List<String>> getSuggestions() {
        return ResponseEntity.ok(adaptiveWeightTracker.suggestImprovements());
    }

    @GetMapping("/patterns")
    public ResponseEntity<List<SuccessfulPattern>> getPatterns() {
        return ResponseEntity.ok(adaptiveWeightTracker.getPatterns());
    }
}
