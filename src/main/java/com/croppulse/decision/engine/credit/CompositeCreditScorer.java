package com.croppulse.decision.engine.credit;

import com.croppulse.decision.config.DecisionConfig;
import com.croppulse.decision.engine.WeightedAggregator;
import com.croppulse.decision.engine.evidence.EvidenceFetcher;
import com.croppulse.decision.engine.evidence.EvidenceTask;
import com.croppulse.decision.exception.InsufficientEvidenceException;
import com.croppulse.decision.model.CompositeScore;
import com.croppulse.decision.model.CreditGrade;
import com.croppulse.decision.model.EvidenceDetail;
import com.croppulse.decision.model.EvidenceItem;
import com.croppulse.decision.model.FactorNames;
import com.croppulse.decision.model.SourceKind;
import com.croppulse.decision.model.SubScore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Computes the 0-1000 composite credit score.
 *
 * finalScore = round(1000 × (0.40 × traditional + 0.30 × action + 0.30 × groundTruth) / 100)
 *
 * Traditional is itself a weighted blend of five registry factors. An empty action or
 * report history scores 0; a sub-score is unavailable, and its weight redistributed, only
 * when its registry record is absent or its store fails. A subject with no registry record
 * and no action or report history fails with {@link InsufficientEvidenceException}.
 */
@Component
public class CompositeCreditScorer {

    private static final Logger log = LoggerFactory.getLogger(CompositeCreditScorer.class);

    private final TraditionalFactorAdapter traditionalAdapter;
    private final ActionHistoryAdapter actionAdapter;
    private final GroundTruthHistoryAdapter groundTruthAdapter;
    private final EvidenceFetcher evidenceFetcher;
    private final WeightedAggregator aggregator;
    private final DecisionConfig config;
    private final Clock clock;

    public CompositeCreditScorer(TraditionalFactorAdapter traditionalAdapter, ActionHistoryAdapter actionAdapter,
                                 GroundTruthHistoryAdapter groundTruthAdapter, EvidenceFetcher evidenceFetcher,
                                 WeightedAggregator aggregator, DecisionConfig config, Clock clock) {
        this.traditionalAdapter = traditionalAdapter;
        this.actionAdapter = actionAdapter;
        this.groundTruthAdapter = groundTruthAdapter;
        this.evidenceFetcher = evidenceFetcher;
        this.aggregator = aggregator;
        this.config = config;
        this.clock = clock;
    }

    @Observed(name = "credit.score", contextualName = "compute-credit-score")
    public CompositeScore score(String subjectId) {
        LocalDate asOf = LocalDate.now(clock);

        List<EvidenceItem> evidence = evidenceFetcher.fetchAll(List.of(
                new EvidenceTask(SourceKind.TRADITIONAL_FACTOR, config.traditionalWeights().factorNames(),
                        () -> traditionalAdapter.collect(subjectId, asOf)),
                EvidenceTask.single(SourceKind.ACTION, FactorNames.ACTION,
                        () -> actionAdapter.collect(subjectId, asOf)),
                EvidenceTask.single(SourceKind.GROUND_TRUTH, FactorNames.GROUND_TRUTH,
                        () -> groundTruthAdapter.collect(subjectId, asOf))));

        List<EvidenceItem> traditionalItems = evidence.stream()
                .filter(item -> item.getSourceKind() == SourceKind.TRADITIONAL_FACTOR)
                .collect(Collectors.toList());

        List<SubScore> subScores = new ArrayList<>();
        List<EvidenceItem> subScoreItems = new ArrayList<>();

        SubScore traditional = traditionalSubScore(traditionalItems);
        if (traditional != null) {
            subScores.add(traditional);
            subScoreItems.add(subScoreItem(SourceKind.TRADITIONAL_FACTOR, FactorNames.TRADITIONAL,
                    traditional.getValue(), "Weighted blend of registry factors"));
        } else {
            subScoreItems.add(EvidenceItem.unavailable(SourceKind.TRADITIONAL_FACTOR, FactorNames.TRADITIONAL,
                    "No traditional factor available"));
        }

        for (EvidenceItem item : evidence) {
            if (item.getSourceKind() == SourceKind.TRADITIONAL_FACTOR) {
                continue;
            }
            subScoreItems.add(item);
            if (item.isAvailable()) {
                subScores.add(SubScore.builder()
                        .name(item.getFactor())
                        .value(item.getValue())
                        .effectiveWeights(Map.of(item.getFactor(), 1.0))
                        .contributingEvidence(List.of(item))
                        .build());
            }
        }

        boolean anyHistory = evidence.stream()
                .filter(item -> item.getSourceKind() != SourceKind.TRADITIONAL_FACTOR)
                .anyMatch(CompositeCreditScorer::hasHistory);
        if (traditional == null && !anyHistory) {
            throw new InsufficientEvidenceException("Subject " + subjectId
                    + " has no traditional record, action history or ground-truth reports",
                    List.of(FactorNames.TRADITIONAL, FactorNames.ACTION, FactorNames.GROUND_TRUTH));
        }

        SubScore composite;
        try {
            composite = aggregator.aggregate("composite", config.compositeWeights(), subScoreItems);
        } catch (InsufficientEvidenceException e) {
            throw new InsufficientEvidenceException("Subject " + subjectId
                    + " has no traditional record, action history or ground-truth reports", e.getMissing());
        }

        int value = (int) Math.max(0, Math.min(CreditGrade.MAX_SCORE,
                Math.round(CreditGrade.MAX_SCORE * composite.getValue() / 100.0)));
        CreditGrade grade = CreditGrade.fromScore(value);
        long computedAt = clock.millis();

        log.debug("Credit score for {}: composite={} weights={}", subjectId, composite.getValue(),
                composite.getEffectiveWeights());

        return CompositeScore.builder()
                .scoreId(UUID.randomUUID().toString())
                .subjectId(subjectId)
                .value(value)
                .grade(grade)
                .interestRatePct(grade.getInterestRatePct())
                .eligible(grade.isEligible())
                .effectiveWeights(composite.getEffectiveWeights())
                .subScores(List.copyOf(subScores))
                .computedAt(computedAt)
                .validUntil(computedAt + TimeUnit.DAYS.toMillis(config.getCredit().getScoreValidityDays()))
                .build();
    }

    private SubScore traditionalSubScore(List<EvidenceItem> items) {
        try {
            return aggregator.aggregate(FactorNames.TRADITIONAL, config.traditionalWeights(), items);
        } catch (InsufficientEvidenceException e) {
            log.debug("Traditional sub-score unavailable: {}", e.getMessage());
            return null;
        }
    }

    private static boolean hasHistory(EvidenceItem item) {
        if (!item.isAvailable()) {
            return false;
        }
        EvidenceDetail detail = item.getDetail();
        if (detail instanceof EvidenceDetail.ActionHistory) {
            return ((EvidenceDetail.ActionHistory) detail).submitted() > 0;
        }
        if (detail instanceof EvidenceDetail.GroundTruthHistory) {
            return ((EvidenceDetail.GroundTruthHistory) detail).reportsSubmitted() > 0;
        }
        return true;
    }

    private static EvidenceItem subScoreItem(SourceKind source, String factor, double value, String reason) {
        return EvidenceItem.builder()
                .sourceKind(source)
                .factor(factor)
                .value(value)
                .confidenceHint(1.0)
                .available(true)
                .reason(reason)
                .build();
    }
}
