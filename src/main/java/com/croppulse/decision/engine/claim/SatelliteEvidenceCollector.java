package com.croppulse.decision.engine.claim;

import com.croppulse.decision.config.DecisionConfig;
import com.croppulse.decision.engine.evidence.SatelliteIndexStore;
import com.croppulse.decision.model.ClaimType;
import com.croppulse.decision.model.EvidenceDetail;
import com.croppulse.decision.model.EvidenceItem;
import com.croppulse.decision.model.FactorNames;
import com.croppulse.decision.model.SatelliteScan;
import com.croppulse.decision.model.SourceKind;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Checks the most recent completed scan around the claim date.
 *
 * Drought is supported when NDVI is below the drought threshold, flood when SAR VV
 * backscatter is below the flood threshold (open water scatters little radar energy).
 * Storm and frost have no remote-sensing signal, so the source is unavailable for them.
 * No scan in the window is also "unavailable", never "no support".
 */
@Component
public class SatelliteEvidenceCollector implements ClaimEvidenceCollector {

    private final SatelliteIndexStore satelliteIndexStore;
    private final DecisionConfig config;

    public SatelliteEvidenceCollector(SatelliteIndexStore satelliteIndexStore, DecisionConfig config) {
        this.satelliteIndexStore = satelliteIndexStore;
        this.config = config;
    }

    @Override
    public SourceKind getSourceKind() {
        return SourceKind.SATELLITE;
    }

    @Override
    public String getFactor() {
        return FactorNames.SATELLITE;
    }

    @Override
    public EvidenceItem collect(ClaimContext context) {
        ClaimType type = context.getClaimType();
        if (type != ClaimType.DROUGHT && type != ClaimType.FLOOD) {
            return EvidenceItem.unavailable(getSourceKind(), getFactor(),
                    "No remote-sensing signal for " + type + " claims");
        }

        int windowDays = config.getClaim().getSatelliteWindowDays();
        LocalDate from = context.getClaimDate().minusDays(windowDays);
        LocalDate to = context.getClaimDate().plusDays(windowDays);
        Optional<SatelliteScan> found =
                satelliteIndexStore.findLatestCompletedScan(context.getFarm().getFarmId(), from, to);
        if (found.isEmpty()) {
            return EvidenceItem.unavailable(getSourceKind(), getFactor(),
                    String.format("No completed scan within ±%d days of %s", windowDays, context.getClaimDate()));
        }
        SatelliteScan scan = found.get();

        String indicator;
        Double observed;
        double threshold;
        if (type == ClaimType.DROUGHT) {
            indicator = "NDVI";
            observed = scan.getNdviMean();
            threshold = config.getClaim().getDroughtNdviThreshold();
        } else {
            indicator = "SAR_VV";
            observed = scan.getSarVvMeanDb();
            threshold = config.getClaim().getFloodBackscatterDb();
        }

        EvidenceDetail detail = new EvidenceDetail.Satellite(scan.getScanId(), scan.getScanDate(),
                scan.getNdviMean(), scan.getSarVvMeanDb(), indicator, threshold);

        if (observed == null) {
            return EvidenceItem.unavailable(getSourceKind(), getFactor(),
                            "Scan " + scan.getScanId() + " has no " + indicator + " value")
                    .toBuilder()
                    .observedAt(scan.getScanDate())
                    .detail(detail)
                    .build();
        }

        boolean supports = observed < threshold;
        String reason = String.format("%s %.3f on %s is %s threshold %.2f: %s",
                indicator, observed, scan.getScanDate(), supports ? "below" : "not below", threshold,
                supports ? "consistent with " + type : "no " + type + " signal");

        return EvidenceItem.builder()
                .sourceKind(getSourceKind())
                .factor(getFactor())
                .value(supports ? 100.0 : 0.0)
                .observedAt(scan.getScanDate())
                .confidenceHint(EvidenceItem.freshnessHint(scan.getScanDate(), context.getClaimDate()))
                .available(true)
                .supportsClaim(supports)
                .reason(reason)
                .detail(detail)
                .build();
    }
}
