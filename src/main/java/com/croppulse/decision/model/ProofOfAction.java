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
@Schema(description = "Submitted proof that a farmer carried out a recommended practice")
public class ProofOfAction {

    @Schema(description = "Action identifier", example = "POA-000042")
    private String actionId;

    @Schema(description = "Submitting farmer", example = "FARMER-001")
    private String farmerId;

    @Schema(description = "Farm the action was performed on", example = "FARM-001")
    private String farmId;

    @Schema(description = "Kind of practice", example = "IRRIGATION")
    private ActionType actionType;

    @Schema(description = "Date the action was performed", example = "2026-08-14")
    private LocalDate actionDate;

    @Schema(description = "Proof accepted by a verifier", example = "true")
    private boolean verified;
}
