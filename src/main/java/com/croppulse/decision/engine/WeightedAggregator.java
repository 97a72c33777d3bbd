package com.croppulse.decision.engine;

import com.croppulse.decision.exception.InsufficientEvidenceException;
import com.croppulse.decision.model.EvidenceItem;
import com.croppulse.decision.model.SubScore;
import com.croppulse.decision.model.WeightSpec;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines weighted 0-100 evidence values into a single 0-100 sub-score.
 *
 * Score = Σ(effectiveWeight × value) over available factors, where the weight of an
 * unavailable factor is spread proportionally over the available ones:
 * effectiveWeight_j = weight_j / Σ(available weights). A missing source is never
 * scored as zero. When no factor is available the aggregation fails with
 * {@link InsufficientEvidenceException} naming every factor of the set.
 *
 * Stateless and side-effect free; safe to share across requests.
 */
@Component
public class WeightedAggregator {

    /**
     * @param name     sub-score name carried into the result
     * @param spec     validated weight set
     * @param evidence evidence items; the first available item per factor is used,
     *                 items for factors outside the set are kept for audit only
     */
    public SubScore aggregate(String name, WeightSpec spec, List<EvidenceItem> evidence) {
        Map<String, EvidenceItem> byFactor = new LinkedHashMap<>();
        for (EvidenceItem item : evidence) {
            if (item.isAvailable() && item.getValue() != null
                    && spec.getWeights().containsKey(item.getFactor())) {
                checkRange(item);
                byFactor.putIfAbsent(item.getFactor(), item);
            }
        }

        Map<String, Double> redistributed = spec.redistribute(byFactor.keySet());
        if (redistributed.isEmpty()) {
            Set<String> missing = new LinkedHashSet<>(spec.factorNames());
            throw new InsufficientEvidenceException(
                    "No usable evidence for '" + name + "': all of " + missing + " are unavailable",
                    new ArrayList<>(missing));
        }

        double score = 0.0;
        for (Map.Entry<String, Double> e : redistributed.entrySet()) {
            score += e.getValue() * byFactor.get(e.getKey()).getValue();
        }

        // Unavailable factors are listed at weight 0 so the result shows what was dropped
        Map<String, Double> effectiveWeights = new LinkedHashMap<>();
        for (String factor : spec.factorNames()) {
            effectiveWeights.put(factor, redistributed.getOrDefault(factor, 0.0));
        }

        return SubScore.builder()
                .name(name)
                .value(Math.max(0.0, Math.min(100.0, score)))
                .effectiveWeights(effectiveWeights)
                .contributingEvidence(List.copyOf(evidence))
                .build();
    }

    private static void checkRange(EvidenceItem item) {
        double v = item.getValue();
        if (Double.isNaN(v) || v < 0.0 || v > 100.0) {
            throw new IllegalArgumentException("Evidence value for '" + item.getFactor()
                    + "' must be within [0, 100], got " + v);
        }
    }
}
