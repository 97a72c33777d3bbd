package com.croppulse.decision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * A frozen credit score. Each request creates a new record; existing records are never updated.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Immutable composite credit score record")
public class CompositeScore {

    @Schema(description = "Unique record identifier", example = "3f1c2a5e-7a0b-4c55-9a2e-52b1d9a0c7e1")
    String scoreId;

    @Schema(description = "Scored farmer", example = "FARMER-001")
    String subjectId;

    @Schema(description = "Final score in [0, 1000]", example = "650")
    int value;

    @Schema(description = "Letter grade", example = "C")
    CreditGrade grade;

    @Schema(description = "Indicative interest rate for the grade; null when ineligible", example = "12.0")
    Double interestRatePct;

    @Schema(description = "Whether the grade is eligible for credit", example = "true")
    boolean eligible;

    @Schema(description = "Composite weights applied per sub-score after redistribution",
            example = "{\"traditional\": 0.4, \"action\": 0.3, \"groundTruth\": 0.3}")
    Map<String, Double> effectiveWeights;

    @Schema(description = "Sub-scores the final value combines")
    List<SubScore> subScores;

    @Schema(description = "Computation timestamp in epoch milliseconds", example = "1792224000000")
    long computedAt;

    @Schema(description = "Timestamp after which the score should be recomputed, epoch milliseconds", example = "1794816000000")
    long validUntil;
}
