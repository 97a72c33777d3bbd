package com.croppulse.decision.engine.credit;

import com.croppulse.decision.config.DecisionConfig;
import com.croppulse.decision.engine.evidence.ActionStore;
import com.croppulse.decision.model.EvidenceDetail;
import com.croppulse.decision.model.EvidenceItem;
import com.croppulse.decision.model.FactorNames;
import com.croppulse.decision.model.ProofOfAction;
import com.croppulse.decision.model.SourceKind;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Scores verified farming practice over the lookback window.
 *
 * score = 0.65 × verificationRate% + min(20, 5 × distinct verified action types)
 *         + min(15, 3 × months with a verified action), capped at 100.
 * No submitted actions scores 0; only a store failure makes the source unavailable.
 */
@Component
public class ActionHistoryAdapter {

    static final double VERIFICATION_WEIGHT = 0.65;
    static final double DIVERSITY_PER_TYPE = 5.0;
    static final double DIVERSITY_CAP = 20.0;
    static final double CONSISTENCY_PER_MONTH = 3.0;
    static final double CONSISTENCY_CAP = 15.0;

    private final ActionStore actionStore;
    private final DecisionConfig config;

    public ActionHistoryAdapter(ActionStore actionStore, DecisionConfig config) {
        this.actionStore = actionStore;
        this.config = config;
    }

    public EvidenceItem collect(String subjectId, LocalDate asOf) {
        LocalDate from = asOf.minusDays(config.getCredit().getLookbackDays());
        List<ProofOfAction> actions = actionStore.findByFarmer(subjectId, from, asOf);
        if (actions.isEmpty()) {
            return EvidenceItem.builder()
                    .sourceKind(SourceKind.ACTION)
                    .factor(FactorNames.ACTION)
                    .value(0.0)
                    .confidenceHint(1.0)
                    .available(true)
                    .reason("No actions submitted since " + from)
                    .detail(new EvidenceDetail.ActionHistory(0, 0, 0, 0, 0.0, 0.0, 0.0))
                    .build();
        }

        List<ProofOfAction> verified = actions.stream().filter(ProofOfAction::isVerified).collect(Collectors.toList());
        int distinctTypes = (int) verified.stream()
                .map(ProofOfAction::getActionType)
                .filter(Objects::nonNull)
                .distinct()
                .count();
        int activeMonths = (int) verified.stream()
                .map(ProofOfAction::getActionDate)
                .filter(Objects::nonNull)
                .map(YearMonth::from)
                .distinct()
                .count();

        double verificationRatePct = 100.0 * verified.size() / actions.size();
        double diversityBonus = Math.min(DIVERSITY_CAP, DIVERSITY_PER_TYPE * distinctTypes);
        double consistencyBonus = Math.min(CONSISTENCY_CAP, CONSISTENCY_PER_MONTH * activeMonths);
        double score = Math.min(100.0, VERIFICATION_WEIGHT * verificationRatePct + diversityBonus + consistencyBonus);

        LocalDate latest = verified.stream()
                .map(ProofOfAction::getActionDate)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);

        return EvidenceItem.builder()
                .sourceKind(SourceKind.ACTION)
                .factor(FactorNames.ACTION)
                .value(score)
                .observedAt(latest)
                .confidenceHint(EvidenceItem.freshnessHint(latest, asOf))
                .available(true)
                .reason(String.format("%d of %d actions verified (%.1f%%), %d types, %d active months",
                        verified.size(), actions.size(), verificationRatePct, distinctTypes, activeMonths))
                .detail(new EvidenceDetail.ActionHistory(actions.size(), verified.size(), distinctTypes,
                        activeMonths, verificationRatePct, diversityBonus, consistencyBonus))
                .build();
    }
}
