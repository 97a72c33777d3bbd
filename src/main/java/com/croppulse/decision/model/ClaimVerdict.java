package com.croppulse.decision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one verification run. A re-verification produces a new verdict that
 * references the one it supersedes.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Immutable claim verification verdict")
public class ClaimVerdict {

    @Schema(description = "Unique verdict identifier", example = "9b7d0f0e-0a51-4d0b-8f3c-0d3c5e8a2b11")
    String verdictId;

    @Schema(description = "Verified claim", example = "CLM-2026-0042")
    String claimId;

    @Schema(description = "Claimant farmer", example = "FARMER-001")
    String subjectId;

    @Schema(description = "Claimed farm", example = "FARM-001")
    String farmId;

    @Schema(description = "Claimed loss date", example = "2026-10-10")
    LocalDate claimDate;

    @Schema(description = "Claimed loss type", example = "FLOOD")
    ClaimType claimType;

    @Schema(description = "Weighted confidence in [0, 100]", example = "70.0")
    double confidence;

    @Schema(description = "Banded recommendation", example = "APPROVE")
    ClaimRecommendation recommendation;

    @Schema(description = "True when confidence >= 60", example = "true")
    boolean verified;

    @Schema(description = "Weights applied per source after redistribution",
            example = "{\"satellite\": 0.3, \"neighbors\": 0.4, \"selfReports\": 0.3}")
    Map<String, Double> effectiveWeights;

    @Schema(description = "Evidence per source, each with supportsClaim and raw detail")
    List<EvidenceItem> evidence;

    @Schema(description = "Verdict this one supersedes, if the claim was verified before")
    String supersedesVerdictId;

    @Schema(description = "Verification timestamp in epoch milliseconds", example = "1792224000000")
    long verifiedAt;
}
