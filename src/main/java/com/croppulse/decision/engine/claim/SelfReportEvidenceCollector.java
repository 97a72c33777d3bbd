package com.croppulse.decision.engine.claim;

import com.croppulse.decision.config.DecisionConfig;
import com.croppulse.decision.engine.evidence.GroundTruthReportStore;
import com.croppulse.decision.model.EvidenceDetail;
import com.croppulse.decision.model.EvidenceItem;
import com.croppulse.decision.model.FactorNames;
import com.croppulse.decision.model.GroundTruthReport;
import com.croppulse.decision.model.SourceKind;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Checks whether the claimant reported the claimed condition around the claim date.
 * A claimant with no reports in the window is available evidence that does not support
 * the claim.
 */
@Component
public class SelfReportEvidenceCollector implements ClaimEvidenceCollector {

    private final GroundTruthReportStore reportStore;
    private final DecisionConfig config;

    public SelfReportEvidenceCollector(GroundTruthReportStore reportStore, DecisionConfig config) {
        this.reportStore = reportStore;
        this.config = config;
    }

    @Override
    public SourceKind getSourceKind() {
        return SourceKind.SELF_REPORT;
    }

    @Override
    public String getFactor() {
        return FactorNames.SELF_REPORTS;
    }

    @Override
    public EvidenceItem collect(ClaimContext context) {
        int windowDays = config.getClaim().getSelfReportWindowDays();
        LocalDate from = context.getClaimDate().minusDays(windowDays);
        LocalDate to = context.getClaimDate().plusDays(windowDays);

        List<GroundTruthReport> reports = reportStore.findByFarmer(context.getSubjectId(), from, to);
        int matching = (int) reports.stream().filter(context.getClaimType()::isCorroboratedBy).count();
        boolean supports = matching > 0;

        LocalDate latest = reports.stream()
                .map(GroundTruthReport::getObservedOn)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);

        String reason = reports.isEmpty()
                ? String.format("No claimant reports between %s and %s", from, to)
                : String.format("%d of %d claimant reports between %s and %s match %s",
                        matching, reports.size(), from, to, context.getClaimType());

        return EvidenceItem.builder()
                .sourceKind(getSourceKind())
                .factor(getFactor())
                .value(supports ? 100.0 : 0.0)
                .observedAt(latest)
                .confidenceHint(EvidenceItem.freshnessHint(latest, context.getClaimDate()))
                .available(true)
                .supportsClaim(supports)
                .reason(reason)
                .detail(new EvidenceDetail.SelfReport(from, to, reports.size(), matching))
                .build();
    }
}
