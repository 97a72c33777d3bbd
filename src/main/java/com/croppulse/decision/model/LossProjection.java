package com.croppulse.decision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Projected post-harvest loss for a harvest delay")
public class LossProjection {

    @Schema(description = "Days of delay the projection covers", example = "3")
    int delayDays;

    @Schema(description = "Mean forecast humidity used for the humidity indicator", example = "85.0")
    double avgHumidityPct;

    @Schema(description = "Cumulative forecast rainfall used for the rainfall indicator", example = "60.0")
    double cumulativeRainfallMm;

    @Schema(description = "1 + 0.5 x [humidity > 80%] + 0.3 x [rainfall > 50mm]", example = "1.8")
    double weatherMultiplier;

    @Schema(description = "Loss rate slope in %/day (base rate x multiplier)", example = "3.6")
    double dailyLossRatePct;

    @Schema(description = "Projected loss in %, capped at 50", example = "10.8")
    double projectedLossPct;
}
