package com.croppulse.decision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Registry view of a farmer's traditional credit factors. Any indicator may be
 * null when the registry has never observed it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Traditional risk factors held by the farm/record registry")
public class FarmerRecord {

    @Schema(description = "Farmer identifier", example = "FARMER-001")
    private String farmerId;

    @Schema(description = "Primary farm of the farmer", example = "FARM-001")
    private String primaryFarmId;

    @Schema(description = "Registered farm size in acres", example = "3.2")
    private Double farmSizeAcres;

    @Schema(description = "Mean NDVI of the latest completed scan", example = "0.68")
    private Double latestNdvi;

    @Schema(description = "Acquisition date of the latest NDVI value", example = "2026-09-28")
    private LocalDate ndviObservedOn;

    @Schema(description = "Climate risk for the farm location (0-100, 100 = highest risk)", example = "35.0")
    private Double climateRiskScore;

    @Schema(description = "Total loan repayments due so far", example = "12")
    private int totalPayments;

    @Schema(description = "Repayments made on time", example = "10")
    private int onTimePayments;

    @Schema(description = "Repayments made late but paid", example = "1")
    private int latePaidPayments;

    @Schema(description = "Whether the latest deforestation check detected clearing", example = "false")
    private Boolean deforestationDetected;

    @Schema(description = "Date of the latest deforestation check", example = "2026-06-01")
    private LocalDate deforestationCheckedOn;
}
