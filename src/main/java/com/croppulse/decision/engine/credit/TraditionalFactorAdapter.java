package com.croppulse.decision.engine.credit;

import com.croppulse.decision.engine.evidence.FarmRegistry;
import com.croppulse.decision.model.EvidenceDetail;
import com.croppulse.decision.model.EvidenceItem;
import com.croppulse.decision.model.FactorNames;
import com.croppulse.decision.model.FarmerRecord;
import com.croppulse.decision.model.SourceKind;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Normalizes the registry's traditional credit indicators to 0-100 evidence items.
 *
 * Farm size and crop health use fixed bands, climate risk is inverted, payment history
 * gives late-but-paid installments 70% credit, and deforestation is binary. An indicator
 * the registry has never observed is reported unavailable.
 */
@Component
public class TraditionalFactorAdapter {

    static final double LATE_PAYMENT_CREDIT = 0.7;

    private static final double[][] FARM_SIZE_BANDS = {
            {10.0, 100}, {5.0, 90}, {2.5, 80}, {1.5, 70}, {1.0, 60}, {0.5, 50}
    };
    private static final double FARM_SIZE_FLOOR = 40;

    private static final double[][] NDVI_BANDS = {
            {0.80, 100}, {0.75, 95}, {0.70, 90}, {0.65, 85}, {0.60, 80},
            {0.55, 75}, {0.50, 70}, {0.45, 65}, {0.40, 60}, {0.35, 55}
    };
    private static final double NDVI_FLOOR = 50;

    private final FarmRegistry farmRegistry;

    public TraditionalFactorAdapter(FarmRegistry farmRegistry) {
        this.farmRegistry = farmRegistry;
    }

    public List<EvidenceItem> collect(String subjectId, LocalDate asOf) {
        Optional<FarmerRecord> found = farmRegistry.findFarmer(subjectId);
        if (found.isEmpty()) {
            String reason = "No registry record for farmer " + subjectId;
            return List.of(
                    unavailable(FactorNames.FARM_SIZE, reason),
                    unavailable(FactorNames.CROP_HEALTH, reason),
                    unavailable(FactorNames.CLIMATE_RISK, reason),
                    unavailable(FactorNames.PAYMENT_HISTORY, reason),
                    unavailable(FactorNames.DEFORESTATION, reason));
        }
        FarmerRecord farmer = found.get();
        return List.of(
                farmSize(farmer),
                cropHealth(farmer, asOf),
                climateRisk(farmer),
                paymentHistory(farmer),
                deforestation(farmer, asOf));
    }

    static double farmSizeScore(double acres) {
        return band(acres, FARM_SIZE_BANDS, FARM_SIZE_FLOOR);
    }

    static double cropHealthScore(double ndvi) {
        return band(ndvi, NDVI_BANDS, NDVI_FLOOR);
    }

    static double paymentScore(int total, int onTime, int latePaid) {
        double credit = onTime + LATE_PAYMENT_CREDIT * latePaid;
        return Math.min(100.0, credit / total * 100.0);
    }

    private EvidenceItem farmSize(FarmerRecord farmer) {
        Double acres = farmer.getFarmSizeAcres();
        if (acres == null || acres < 0) {
            return unavailable(FactorNames.FARM_SIZE, "Farm size not recorded");
        }
        double score = farmSizeScore(acres);
        return available(FactorNames.FARM_SIZE, score, null, 1.0,
                String.format("%.2f acres -> %.0f", acres, score),
                new EvidenceDetail.TraditionalFactor(FactorNames.FARM_SIZE, acres, "acres"));
    }

    private EvidenceItem cropHealth(FarmerRecord farmer, LocalDate asOf) {
        Double ndvi = farmer.getLatestNdvi();
        if (ndvi == null) {
            return unavailable(FactorNames.CROP_HEALTH, "No NDVI observation");
        }
        double score = cropHealthScore(ndvi);
        return available(FactorNames.CROP_HEALTH, score, farmer.getNdviObservedOn(),
                EvidenceItem.freshnessHint(farmer.getNdviObservedOn(), asOf),
                String.format("Mean NDVI %.3f -> %.0f", ndvi, score),
                new EvidenceDetail.TraditionalFactor(FactorNames.CROP_HEALTH, ndvi, "ndvi"));
    }

    private EvidenceItem climateRisk(FarmerRecord farmer) {
        Double risk = farmer.getClimateRiskScore();
        if (risk == null) {
            return unavailable(FactorNames.CLIMATE_RISK, "No climate risk assessment");
        }
        double score = 100.0 - Math.max(0.0, Math.min(100.0, risk));
        return available(FactorNames.CLIMATE_RISK, score, null, 1.0,
                String.format("Climate risk %.1f -> %.1f", risk, score),
                new EvidenceDetail.TraditionalFactor(FactorNames.CLIMATE_RISK, risk, "risk"));
    }

    private EvidenceItem paymentHistory(FarmerRecord farmer) {
        int total = farmer.getTotalPayments();
        if (total <= 0) {
            return unavailable(FactorNames.PAYMENT_HISTORY, "No recorded loan payments");
        }
        double score = paymentScore(total, farmer.getOnTimePayments(), farmer.getLatePaidPayments());
        return available(FactorNames.PAYMENT_HISTORY, score, null, 1.0,
                String.format("%d on time, %d late of %d payments -> %.1f",
                        farmer.getOnTimePayments(), farmer.getLatePaidPayments(), total, score),
                new EvidenceDetail.TraditionalFactor(FactorNames.PAYMENT_HISTORY, (double) total, "payments"));
    }

    private EvidenceItem deforestation(FarmerRecord farmer, LocalDate asOf) {
        Boolean detected = farmer.getDeforestationDetected();
        if (detected == null) {
            return unavailable(FactorNames.DEFORESTATION, "No deforestation check on record");
        }
        double score = detected ? 0.0 : 100.0;
        return available(FactorNames.DEFORESTATION, score, farmer.getDeforestationCheckedOn(),
                EvidenceItem.freshnessHint(farmer.getDeforestationCheckedOn(), asOf),
                detected ? "Deforestation detected" : "No deforestation detected",
                new EvidenceDetail.TraditionalFactor(FactorNames.DEFORESTATION, detected ? 1.0 : 0.0, "flag"));
    }

    private static double band(double value, double[][] bands, double floor) {
        for (double[] b : bands) {
            if (value >= b[0]) {
                return b[1];
            }
        }
        return floor;
    }

    private static EvidenceItem available(String factor, double value, LocalDate observedAt, double hint,
                                          String reason, EvidenceDetail detail) {
        return EvidenceItem.builder()
                .sourceKind(SourceKind.TRADITIONAL_FACTOR)
                .factor(factor)
                .value(value)
                .observedAt(observedAt)
                .confidenceHint(hint)
                .available(true)
                .reason(reason)
                .detail(detail)
                .build();
    }

    private static EvidenceItem unavailable(String factor, String reason) {
        return EvidenceItem.unavailable(SourceKind.TRADITIONAL_FACTOR, factor, reason);
    }
}
