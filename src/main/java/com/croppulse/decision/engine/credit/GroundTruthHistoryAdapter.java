package com.croppulse.decision.engine.credit;

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
 * Scores a farmer's ground-truth reporting: 40% frequency, 60% accuracy.
 * Frequency earns full credit at the configured report count per lookback window;
 * accuracy is the share of reports later corroborated by verification or satellite.
 * A farmer with no reports in the window scores 0.
 */
@Component
public class GroundTruthHistoryAdapter {

    static final double FREQUENCY_WEIGHT = 0.40;
    static final double ACCURACY_WEIGHT = 0.60;

    private final GroundTruthReportStore reportStore;
    private final DecisionConfig config;

    public GroundTruthHistoryAdapter(GroundTruthReportStore reportStore, DecisionConfig config) {
        this.reportStore = reportStore;
        this.config = config;
    }

    public EvidenceItem collect(String subjectId, LocalDate asOf) {
        LocalDate from = asOf.minusDays(config.getCredit().getLookbackDays());
        List<GroundTruthReport> reports = reportStore.findByFarmer(subjectId, from, asOf);
        if (reports.isEmpty()) {
            return EvidenceItem.builder()
                    .sourceKind(SourceKind.GROUND_TRUTH)
                    .factor(FactorNames.GROUND_TRUTH)
                    .value(0.0)
                    .confidenceHint(1.0)
                    .available(true)
                    .reason("No ground-truth reports since " + from)
                    .detail(new EvidenceDetail.GroundTruthHistory(0, 0, 0.0, 0.0))
                    .build();
        }

        int corroborated = (int) reports.stream().filter(GroundTruthReport::isCorroborated).count();
        double frequencyScore = Math.min(100.0,
                100.0 * reports.size() / config.getCredit().getFullFrequencyReports());
        double accuracyRatePct = 100.0 * corroborated / reports.size();
        double score = FREQUENCY_WEIGHT * frequencyScore + ACCURACY_WEIGHT * accuracyRatePct;

        LocalDate latest = reports.stream()
                .map(GroundTruthReport::getObservedOn)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);

        return EvidenceItem.builder()
                .sourceKind(SourceKind.GROUND_TRUTH)
                .factor(FactorNames.GROUND_TRUTH)
                .value(score)
                .observedAt(latest)
                .confidenceHint(EvidenceItem.freshnessHint(latest, asOf))
                .available(true)
                .reason(String.format("%d reports (frequency %.1f), %d corroborated (accuracy %.1f%%)",
                        reports.size(), frequencyScore, corroborated, accuracyRatePct))
                .detail(new EvidenceDetail.GroundTruthHistory(reports.size(), corroborated,
                        frequencyScore, accuracyRatePct))
                .build();
    }
}
