package com.croppulse.decision.engine.claim;

import com.croppulse.decision.config.DecisionConfig;
import com.croppulse.decision.engine.evidence.FarmRegistry;
import com.croppulse.decision.engine.evidence.GroundTruthReportStore;
import com.croppulse.decision.model.EvidenceDetail;
import com.croppulse.decision.model.EvidenceItem;
import com.croppulse.decision.model.FactorNames;
import com.croppulse.decision.model.Farm;
import com.croppulse.decision.model.GroundTruthReport;
import com.croppulse.decision.model.SourceKind;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Cross-checks the claim against weather reports filed by the nearest registered farms.
 *
 * Supported when at least the agreement threshold of the neighbor reports describe the
 * claimed condition. Fewer distinct reporting farms than the configured minimum makes
 * the source unavailable, so one or two colluding neighbors cannot carry a claim.
 */
@Component
public class NeighborEvidenceCollector implements ClaimEvidenceCollector {

    private final FarmRegistry farmRegistry;
    private final GroundTruthReportStore reportStore;
    private final DecisionConfig config;

    public NeighborEvidenceCollector(FarmRegistry farmRegistry, GroundTruthReportStore reportStore,
                                     DecisionConfig config) {
        this.farmRegistry = farmRegistry;
        this.reportStore = reportStore;
        this.config = config;
    }

    @Override
    public SourceKind getSourceKind() {
        return SourceKind.NEIGHBOR;
    }

    @Override
    public String getFactor() {
        return FactorNames.NEIGHBORS;
    }

    @Override
    public EvidenceItem collect(ClaimContext context) {
        DecisionConfig.Claim claimConfig = config.getClaim();

        List<Farm> neighbors = farmRegistry.findNearestFarms(context.getFarm(), claimConfig.getNearestNeighborFarms())
                .stream()
                .filter(f -> !Objects.equals(f.getFarmerId(), context.getSubjectId()))
                .collect(Collectors.toList());
        if (neighbors.isEmpty()) {
            return EvidenceItem.unavailable(getSourceKind(), getFactor(), "No registered neighbor farms");
        }

        LocalDate from = context.getClaimDate().minusDays(claimConfig.getNeighborWindowDays());
        LocalDate to = context.getClaimDate().plusDays(claimConfig.getNeighborWindowDays());
        List<String> neighborIds = neighbors.stream().map(Farm::getFarmId).collect(Collectors.toList());

        List<GroundTruthReport> reports = reportStore.findByFarms(neighborIds, from, to).stream()
                .filter(r -> !Objects.equals(r.getFarmerId(), context.getSubjectId()))
                .filter(r -> !claimConfig.isRequireVerifiedNeighborReports() || r.isVerified())
                .collect(Collectors.toList());

        int distinctReporters = (int) reports.stream().map(GroundTruthReport::getFarmId).distinct().count();
        int matching = (int) reports.stream().filter(context.getClaimType()::isCorroboratedBy).count();
        double agreementRate = reports.isEmpty() ? 0.0 : (double) matching / reports.size();
        int minReporters = claimConfig.getMinNeighborReporters();

        EvidenceDetail detail = new EvidenceDetail.Neighbor(neighbors.size(), distinctReporters,
                reports.size(), matching, agreementRate, minReporters);
        LocalDate latest = reports.stream()
                .map(GroundTruthReport::getObservedOn)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);

        if (distinctReporters < minReporters) {
            return EvidenceItem.unavailable(getSourceKind(), getFactor(),
                            String.format("Only %d distinct neighbor farm(s) reported within ±%d days (minimum %d)",
                                    distinctReporters, claimConfig.getNeighborWindowDays(), minReporters))
                    .toBuilder()
                    .observedAt(latest)
                    .detail(detail)
                    .build();
        }

        double threshold = claimConfig.getNeighborAgreementThreshold();
        boolean supports = agreementRate >= threshold;
        String reason = String.format("%d of %d%s neighbor reports (%d reporters) match %s: agreement %.1f%% %s %.1f%%",
                matching, reports.size(), claimConfig.isRequireVerifiedNeighborReports() ? " verified" : "",
                distinctReporters, context.getClaimType(), agreementRate * 100.0,
                supports ? ">=" : "<", threshold * 100.0);

        return EvidenceItem.builder()
                .sourceKind(getSourceKind())
                .factor(getFactor())
                .value(supports ? 100.0 : 0.0)
                .observedAt(latest)
                .confidenceHint(EvidenceItem.freshnessHint(latest, context.getClaimDate()))
                .available(true)
                .supportsClaim(supports)
                .reason(reason)
                .detail(detail)
                .build();
    }
}
