package com.croppulse.decision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
@Schema(description = "A 0-100 partial result with the evidence and weights that produced it")
public class SubScore {

    @Schema(description = "Sub-score name", example = "traditional")
    String name;

    @Schema(description = "Value in [0, 100]", example = "72.5")
    double value;

    @Schema(description = "Weights actually applied per sub-factor after redistribution",
            example = "{\"farmSize\": 0.1875, \"cropHealth\": 0.3125, \"climateRisk\": 0.25, \"deforestation\": 0.1875, \"paymentHistory\": 0.0}")
    Map<String, Double> effectiveWeights;

    @Schema(description = "Evidence the value was computed from, including unavailable sources")
    List<EvidenceItem> contributingEvidence;
}
