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
@Schema(description = "One day of a weather forecast for a farm location")
public class ForecastDay {

    @Schema(description = "Forecast date", example = "2026-10-18")
    private LocalDate date;

    @Schema(description = "Expected rainfall in mm", example = "2.5")
    private double rainfallMm;

    @Schema(description = "Mean temperature in degrees Celsius", example = "24.0")
    private double temperatureC;

    @Schema(description = "Mean relative humidity in %", example = "65.0")
    private double humidityPct;

    @Schema(description = "Mean wind speed in km/h", example = "10.0")
    private double windSpeedKph;
}
