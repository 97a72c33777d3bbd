package com.croppulse.decision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Pre-computed indices for one satellite pass over a farm.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Vegetation and radar indices of a satellite scan")
public class SatelliteScan {

    public static final String STATUS_COMPLETED = "COMPLETED";

    @Schema(description = "Scan identifier", example = "SCAN-FARM-001-20261012")
    private String scanId;

    @Schema(description = "Scanned farm", example = "FARM-001")
    private String farmId;

    @Schema(description = "Acquisition date", example = "2026-10-12")
    private LocalDate scanDate;

    @Schema(description = "Processing status", example = "COMPLETED", allowableValues = {"PENDING", "COMPLETED", "FAILED"})
    private String status;

    @Schema(description = "Mean NDVI over the farm boundary (-1..1)", example = "0.24")
    private Double ndviMean;

    @Schema(description = "Mean Sentinel-1 VV backscatter in dB", example = "-16.4")
    private Double sarVvMeanDb;

    public boolean isCompleted() {
        return STATUS_COMPLETED.equalsIgnoreCase(status);
    }
}
