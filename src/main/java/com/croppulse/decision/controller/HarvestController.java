package com.croppulse.decision.controller;

import com.croppulse.decision.model.HarvestAssessment;
import com.croppulse.decision.model.LossProjection;
import com.croppulse.decision.service.HarvestAssessmentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/harvest")
@Tag(name = "Harvest", description = "Harvest timing, road risk and post-harvest loss from the weather forecast")
public class HarvestController {

    private final HarvestAssessmentService harvestAssessmentService;

    public HarvestController(HarvestAssessmentService harvestAssessmentService) {
        this.harvestAssessmentService = harvestAssessmentService;
    }

    @Operation(summary = "Assess harvest timing",
            description = "Optimal harvest window, road risk (LOW/MEDIUM/HIGH with days until closure), projected " +
                    "post-harvest loss and urgency. Returns 422 when fewer than 7 forecast days are available.")
    @GetMapping("/{farmId}/assessment")
    public ResponseEntity<HarvestAssessment> assess(
            @Parameter(description = "Farm ID", example = "FARM-001")
            @PathVariable String farmId) {
        return ResponseEntity.ok(harvestAssessmentService.assess(farmId));
    }

    @Operation(summary = "Estimate post-harvest loss for a delay",
            description = "loss% = min(50, 2%/day x delayDays x weather multiplier) using the forecast's mean " +
                    "humidity and total rainfall.")
    @GetMapping("/{farmId}/loss")
    public ResponseEntity<LossProjection> estimateLoss(
            @Parameter(description = "Farm ID", example = "FARM-001")
            @PathVariable String farmId,
            @Parameter(description = "Days the harvest is delayed", example = "3")
            @RequestParam int delayDays) {
        return ResponseEntity.ok(harvestAssessmentService.estimateLoss(farmId, delayDays));
    }
}
