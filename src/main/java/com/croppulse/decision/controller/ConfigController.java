package com.croppulse.decision.controller;

import com.croppulse.decision.config.DecisionConfig;
import com.croppulse.decision.model.WeightSpec;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of the validated configuration. Weights are fixed at startup.
 */
@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View the validated weights and thresholds (read-only)")
public class ConfigController {

    private final DecisionConfig config;

    public ConfigController(DecisionConfig config) {
        this.config = config;
    }

    @Operation(summary = "Get validated weight sets")
    @GetMapping("/weights")
    public ResponseEntity<Map<String, Map<String, Double>>> getWeights() {
        Map<String, Map<String, Double>> weights = new LinkedHashMap<>();
        for (WeightSpec spec : new WeightSpec[]{
                config.traditionalWeights(), config.compositeWeights(), config.claimWeights()}) {
            weights.put(spec.getName(), spec.getWeights());
        }
        return ResponseEntity.ok(weights);
    }

    @Operation(summary = "Get thresholds and windows")
    @GetMapping("/thresholds")
    public ResponseEntity<Map<String, Object>> getThresholds() {
        return ResponseEntity.ok(Map.of(
                "claim", config.getClaim(),
                "credit", config.getCredit(),
                "logistics", config.getLogistics(),
                "evidence", config.getEvidence()
        ));
    }
}
