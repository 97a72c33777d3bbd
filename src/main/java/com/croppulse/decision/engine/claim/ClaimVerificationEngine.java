package com.croppulse.decision.engine.claim;

import com.croppulse.decision.config.DecisionConfig;
import com.croppulse.decision.engine.WeightedAggregator;
import com.croppulse.decision.engine.evidence.EvidenceFetcher;
import com.croppulse.decision.engine.evidence.EvidenceTask;
import com.croppulse.decision.exception.InsufficientEvidenceException;
import com.croppulse.decision.model.ClaimRecommendation;
import com.croppulse.decision.model.ClaimVerdict;
import com.croppulse.decision.model.EvidenceItem;
import com.croppulse.decision.model.SourceKind;
import com.croppulse.decision.model.SubScore;
import com.croppulse.decision.model.WeightSpec;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Verifies an insurance claim against satellite, neighbor and self-report evidence.
 * Uses the Strategy pattern: each SourceKind is handled by a registered ClaimEvidenceCollector.
 *
 * The three sources are fetched concurrently, then combined by the weighted aggregator
 * (satellite 30%, neighbors 40%, self reports 30% by default). An unavailable source has
 * its weight redistributed; a claim with no available source fails with
 * {@link InsufficientEvidenceException}.
 */
@Component
public class ClaimVerificationEngine {

    private static final Logger log = LoggerFactory.getLogger(ClaimVerificationEngine.class);

    private final Map<SourceKind, ClaimEvidenceCollector> collectorMap;
    private final EvidenceFetcher evidenceFetcher;
    private final WeightedAggregator aggregator;
    private final DecisionConfig config;
    private final Clock clock;

    public ClaimVerificationEngine(List<ClaimEvidenceCollector> collectors, EvidenceFetcher evidenceFetcher,
                                   WeightedAggregator aggregator, DecisionConfig config, Clock clock) {
        this.collectorMap = new EnumMap<>(SourceKind.class);
        this.evidenceFetcher = evidenceFetcher;
        this.aggregator = aggregator;
        this.config = config;
        this.clock = clock;

        // Auto-register all collector implementations
        for (ClaimEvidenceCollector collector : collectors) {
            collectorMap.put(collector.getSourceKind(), collector);
            log.info("Registered claim evidence collector: {} -> {}",
                    collector.getSourceKind(), collector.getClass().getSimpleName());
        }
    }

    /**
     * Verify a claim. The returned verdict has no verdict id or superseded verdict yet;
     * those are assigned when it is recorded.
     */
    @Observed(name = "claims.verify", contextualName = "verify-claim")
    public ClaimVerdict verify(ClaimContext context) {
        WeightSpec weights = config.claimWeights();

        List<EvidenceTask> tasks = new ArrayList<>();
        for (ClaimEvidenceCollector collector : collectorMap.values()) {
            tasks.add(EvidenceTask.single(collector.getSourceKind(), collector.getFactor(),
                    () -> collector.collect(context)));
        }
        List<EvidenceItem> evidence = evidenceFetcher.fetchAll(tasks);

        SubScore combined;
        try {
            combined = aggregator.aggregate("claim", weights, evidence);
        } catch (InsufficientEvidenceException e) {
            String reasons = evidence.stream()
                    .map(item -> item.getFactor() + " (" + item.getReason() + ")")
                    .collect(Collectors.joining("; "));
            throw new InsufficientEvidenceException(
                    "No evidence source available for claim " + context.getClaimId() + ": " + reasons,
                    e.getMissing());
        }

        double confidence = Math.round(combined.getValue() * 100.0) / 100.0;
        ClaimRecommendation recommendation = ClaimRecommendation.fromConfidence(confidence);

        return ClaimVerdict.builder()
                .claimId(context.getClaimId())
                .subjectId(context.getSubjectId())
                .farmId(context.getFarm().getFarmId())
                .claimDate(context.getClaimDate())
                .claimType(context.getClaimType())
                .confidence(confidence)
                .recommendation(recommendation)
                .verified(recommendation.isApproval())
                .effectiveWeights(combined.getEffectiveWeights())
                .evidence(evidence)
                .verifiedAt(clock.millis())
                .build();
    }
}
