package com.croppulse.decision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

/**
 * Harvest timing and logistics risk. Derived fresh from the current forecast and not persisted.
 */
@Value
@Builder
@Jacksonized
@Schema(description = "Harvest window, road risk, loss projection and urgency for a farm")
public class HarvestAssessment {

    @Schema(description = "Assessed farm", example = "FARM-001")
    String farmId;

    @Schema(description = "First forecast day the assessment is relative to", example = "2026-10-17")
    LocalDate assessedOn;

    @Schema(description = "Number of forecast days considered", example = "7")
    int horizonDays;

    @Schema(description = "Earliest day with optimal harvest conditions; null when none in the horizon", example = "2026-10-19")
    LocalDate optimalDate;

    @Schema(description = "Optimal date followed by the contiguous qualifying days")
    List<LocalDate> windowDates;

    @Schema(description = "Road accessibility risk")
    RoadRisk roadRisk;

    @Schema(description = "Loss projection for waiting until the optimal date")
    LossProjection lossProjection;

    @Schema(description = "Projected post-harvest loss in % (0-50)", example = "4.0")
    double projectedLossPct;

    @Schema(description = "Combined urgency", example = "HIGH")
    Urgency urgency;

    @Schema(description = "Recommendations rendered from the structured result")
    List<String> recommendations;
}
