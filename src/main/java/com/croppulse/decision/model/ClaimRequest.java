package com.croppulse.decision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Insurance claim to verify")
public class ClaimRequest {

    @Schema(description = "Claim identifier; derived from the other fields when omitted", example = "CLM-2026-0042")
    private String claimId;

    @Schema(description = "Claimant farmer", example = "FARMER-001")
    private String subjectId;

    @Schema(description = "Farm the loss occurred on", example = "FARM-001")
    private String farmId;

    @Schema(description = "Date of the loss event", example = "2026-10-10")
    private LocalDate claimDate;

    @Schema(description = "Loss event type", example = "FLOOD", allowableValues = {"DROUGHT", "FLOOD", "STORM", "FROST"})
    private String claimType;
}
