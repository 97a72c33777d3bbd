package com.croppulse.decision.model;

import com.croppulse.decision.exception.InvalidWeightConfigurationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered sub-factor weights. Construction fails unless every weight is non-negative
 * and the set sums to 1.0, so an instance is always a valid configuration.
 */
public final class WeightSpec {

    static final double SUM_TOLERANCE = 1e-9;

    private final String name;
    private final Map<String, Double> weights;

    private WeightSpec(String name, Map<String, Double> weights) {
        this.name = name;
        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    public static WeightSpec of(String name, Map<String, Double> weights) {
        if (weights == null || weights.isEmpty()) {
            throw new InvalidWeightConfigurationException(name, "Weight set '" + name + "' is empty");
        }
        double sum = 0.0;
        for (Map.Entry<String, Double> e : weights.entrySet()) {
            Double w = e.getValue();
            if (w == null || w.isNaN() || w < 0.0) {
                throw new InvalidWeightConfigurationException(name,
                        "Weight set '" + name + "' has an invalid weight for '" + e.getKey() + "': " + w);
            }
            sum += w;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new InvalidWeightConfigurationException(name,
                    String.format("Weight set '%s' sums to %.6f, expected 1.0", name, sum));
        }
        return new WeightSpec(name, weights);
    }

    public String getName() {
        return name;
    }

    public Map<String, Double> getWeights() {
        return weights;
    }

    public List<String> factorNames() {
        return List.copyOf(weights.keySet());
    }

    public double weightOf(String factor) {
        Double w = weights.get(factor);
        if (w == null) {
            throw new IllegalArgumentException("Unknown factor '" + factor + "' in weight set '" + name + "'");
        }
        return w;
    }

    /**
     * Spread the weight of unavailable factors proportionally over the available ones.
     * The returned weights keep declaration order and sum to 1.0. Returns an empty map
     * when no factor is available or every available factor has zero weight.
     */
    public Map<String, Double> redistribute(Collection<String> availableFactors) {
        double availableSum = 0.0;
        for (String factor : weights.keySet()) {
            if (availableFactors.contains(factor)) {
                availableSum += weights.get(factor);
            }
        }
        Map<String, Double> effective = new LinkedHashMap<>();
        if (availableSum <= 0.0) {
            return effective;
        }
        for (Map.Entry<String, Double> e : weights.entrySet()) {
            if (availableFactors.contains(e.getKey())) {
                effective.put(e.getKey(), e.getValue() / availableSum);
            }
        }
        return effective;
    }

    @Override
    public String toString() {
        return name + weights;
    }
}
