package com.croppulse.decision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Road accessibility risk over the forecast horizon")
public class RoadRisk {

    @Schema(description = "Risk level", example = "HIGH")
    RoadRiskLevel level;

    @Schema(description = "Expected days until roads close; null when roads stay accessible", example = "2")
    Integer daysUntilClosure;

    @Schema(description = "Cumulative forecast rainfall over the horizon in mm", example = "120.0")
    double cumulativeRainfallMm;

    @Schema(description = "Mean rainfall accumulation rate in mm/day", example = "17.1")
    double rainfallRateMmPerDay;

    @Schema(description = "Accessibility summary", example = "Roads may close within 2 days")
    String accessibility;
}
