package com.croppulse.decision.controller;

import com.croppulse.decision.model.CompositeScore;
import com.croppulse.decision.model.PagedResponse;
import com.croppulse.decision.service.CreditScoringService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/credit-scores")
@Tag(name = "Credit Scores", description = "Compute composite credit scores and query the frozen score history")
public class CreditScoreController {

    private final CreditScoringService creditScoringService;

    public CreditScoreController(CreditScoringService creditScoringService) {
        this.creditScoringService = creditScoringService;
    }

    @Operation(summary = "Compute a credit score",
            description = "Combines traditional factors (40%), verified actions (30%) and ground-truth reporting (30%) " +
                    "into a 0-1000 score and grade A-F. Each call issues a new immutable record. " +
                    "Returns 422 naming the missing evidence when the subject has no usable history.")
    @PostMapping("/{subjectId}")
    public ResponseEntity<CompositeScore> computeScore(
            @Parameter(description = "Farmer ID", example = "FARMER-001")
            @PathVariable String subjectId) {
        return ResponseEntity.ok(creditScoringService.computeScore(subjectId));
    }

    @Operation(summary = "List issued scores of a subject",
            description = "Frozen score records, newest first. Supports cursor-based pagination.")
    @GetMapping("/{subjectId}/history")
    public ResponseEntity<PagedResponse<CompositeScore>> getHistory(
            @Parameter(description = "Farmer ID", example = "FARMER-001")
            @PathVariable String subjectId,
            @Parameter(description = "Max number of records to return", example = "20")
            @RequestParam(defaultValue = "20") int limit,
            @Parameter(description = "Cursor: return records with computedAt before this value")
            @RequestParam(required = false) Long before) {
        return ResponseEntity.ok(creditScoringService.getHistory(subjectId, limit, before));
    }

    @Operation(summary = "Get an issued score record by ID")
    @GetMapping("/records/{scoreId}")
    public ResponseEntity<CompositeScore> getScore(
            @Parameter(description = "Score record ID")
            @PathVariable String scoreId) {
        CompositeScore score = creditScoringService.getScore(scoreId);
        if (score == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(score);
    }
}
