package com.croppulse.decision.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.LocalDate;

/**
 * Raw, source-specific detail attached to an {@link EvidenceItem} so a reviewer can
 * re-derive the item's value without the engine. One fixed schema per source.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = EvidenceDetail.Satellite.class, name = "SATELLITE"),
        @JsonSubTypes.Type(value = EvidenceDetail.Neighbor.class, name = "NEIGHBOR"),
        @JsonSubTypes.Type(value = EvidenceDetail.SelfReport.class, name = "SELF_REPORT"),
        @JsonSubTypes.Type(value = EvidenceDetail.ActionHistory.class, name = "ACTION"),
        @JsonSubTypes.Type(value = EvidenceDetail.GroundTruthHistory.class, name = "GROUND_TRUTH"),
        @JsonSubTypes.Type(value = EvidenceDetail.TraditionalFactor.class, name = "TRADITIONAL_FACTOR")
})
public interface EvidenceDetail {

    /**
     * @param indicator  "NDVI" for drought claims, "SAR_VV" for flood claims
     * @param threshold  the index value below which the claim is supported
     */
    record Satellite(String scanId, LocalDate scanDate, Double ndviMean, Double sarVvMeanDb,
                     String indicator, double threshold) implements EvidenceDetail {}

    record Neighbor(int farmsQueried, int distinctReporters, int totalReports, int matchingReports,
                    double agreementRate, int minReporters) implements EvidenceDetail {}

    record SelfReport(LocalDate windowStart, LocalDate windowEnd, int totalReports,
                      int matchingReports) implements EvidenceDetail {}

    record ActionHistory(int submitted, int verified, int distinctVerifiedTypes, int activeMonths,
                         double verificationRatePct, double diversityBonus,
                         double consistencyBonus) implements EvidenceDetail {}

    record GroundTruthHistory(int reportsSubmitted, int reportsCorroborated, double frequencyScore,
                              double accuracyRatePct) implements EvidenceDetail {}

    record TraditionalFactor(String factor, Double rawValue, String unit) implements EvidenceDetail {}
}
