package com.croppulse.decision.controller;

import com.croppulse.decision.model.ClaimRequest;
import com.croppulse.decision.model.ClaimVerdict;
import com.croppulse.decision.service.ClaimVerificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/claims")
@Tag(name = "Claims", description = "Verify insurance claims against satellite, neighbor and self-report evidence")
public class ClaimController {

    private final ClaimVerificationService claimVerificationService;

    public ClaimController(ClaimVerificationService claimVerificationService) {
        this.claimVerificationService = claimVerificationService;
    }

    @Operation(summary = "Verify an insurance claim",
            description = "Fetches satellite (30%), neighbor (40%) and self-report (30%) evidence concurrently. " +
                    "Unavailable sources are dropped and the remaining weights renormalized. Returns confidence 0-100, " +
                    "recommendation APPROVE_STRONG / APPROVE / INVESTIGATE / REJECT and per-source evidence. " +
                    "Re-verifying a claim adds a verdict that supersedes the previous one.")
    @PostMapping("/verify")
    public ResponseEntity<ClaimVerdict> verifyClaim(@RequestBody ClaimRequest request) {
        return ResponseEntity.ok(claimVerificationService.verify(request));
    }

    @Operation(summary = "List verdicts of a claim",
            description = "All verdicts issued for the claim, newest first. None are erased by re-verification.")
    @GetMapping("/{claimId}/verdicts")
    public ResponseEntity<List<ClaimVerdict>> getVerdicts(
            @Parameter(description = "Claim ID", example = "CLM-2026-0042")
            @PathVariable String claimId) {
        return ResponseEntity.ok(claimVerificationService.getVerdicts(claimId));
    }
}
