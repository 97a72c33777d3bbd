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
@Schema(description = "Field-observed weather report submitted by a farmer")
public class GroundTruthReport {

    @Schema(description = "Report identifier", example = "GTR-000123")
    private String reportId;

    @Schema(description = "Reporting farmer", example = "FARMER-004")
    private String farmerId;

    @Schema(description = "Farm the observation was made on", example = "FARM-004")
    private String farmId;

    @Schema(description = "Observed weather", example = "HEAVY_RAIN")
    private WeatherCondition weatherCondition;

    @Schema(description = "Perceived temperature", example = "NORMAL")
    private TemperatureFeel temperatureFeel;

    @Schema(description = "Date the weather occurred", example = "2026-10-11")
    private LocalDate observedOn;

    @Schema(description = "Confirmed by an extension officer", example = "true")
    private boolean verified;

    @Schema(description = "Confirmed by a satellite cross-check", example = "false")
    private boolean satelliteCorroborated;

    public boolean isCorroborated() {
        return verified || satelliteCorroborated;
    }
}
