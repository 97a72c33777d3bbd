package com.croppulse.decision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * One piece of evidence produced by an adapter. Immutable; aggregators only read it.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "A single piece of evidence with its provenance")
public class EvidenceItem {

    @Schema(description = "Which source produced the evidence", example = "NEIGHBOR")
    SourceKind sourceKind;

    @Schema(description = "Sub-factor name the evidence feeds", example = "neighbors")
    String factor;

    @Schema(description = "Normalized value (0-100) fed to the aggregator; null when unavailable", example = "100.0")
    Double value;

    @Schema(description = "Date of the underlying observation", example = "2026-10-11")
    LocalDate observedAt;

    @Schema(description = "Freshness-based trust hint (0-1). Informational, not used in scoring", example = "0.8")
    double confidenceHint;

    @Schema(description = "Whether the source produced usable evidence", example = "true")
    boolean available;

    @Schema(description = "Whether this evidence supports the claim (claim verification only)", example = "true")
    Boolean supportsClaim;

    @Schema(description = "Human-readable explanation",
            example = "7 of 10 verified neighbor reports (7 reporters) match FLOOD: agreement 70.0% >= 50.0%")
    String reason;

    @Schema(description = "Source-specific raw values for audit")
    EvidenceDetail detail;

    public static EvidenceItem unavailable(SourceKind sourceKind, String factor, String reason) {
        return EvidenceItem.builder()
                .sourceKind(sourceKind)
                .factor(factor)
                .available(false)
                .confidenceHint(0.0)
                .reason(reason)
                .build();
    }

    /**
     * Trust hint derived from how old an observation is relative to the decision date.
     */
    public static double freshnessHint(LocalDate observedAt, LocalDate asOf) {
        if (observedAt == null || asOf == null) return 0.5;
        long ageDays = Math.abs(ChronoUnit.DAYS.between(observedAt, asOf));
        if (ageDays <= 7) return 1.0;
        if (ageDays <= 14) return 0.8;
        if (ageDays <= 30) return 0.6;
        return 0.4;
    }
}
