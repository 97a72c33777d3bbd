package com.croppulse.decision.config;

import com.croppulse.decision.exception.InvalidWeightConfigurationException;
import com.croppulse.decision.model.FactorNames;
import com.croppulse.decision.model.WeightSpec;
import jakarta.annotation.PostConstruct;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weights, thresholds and windows for all three decision engines.
 * Weight sets are validated once when the configuration is loaded; engines only
 * ever see validated {@link WeightSpec} instances.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "decision")
public class DecisionConfig {

    private static final Logger log = LoggerFactory.getLogger(DecisionConfig.class);

    public static final String WEIGHTS_TRADITIONAL = "traditional";
    public static final String WEIGHTS_COMPOSITE = "composite";
    public static final String WEIGHTS_CLAIM = "claim";

    private Weights weights = new Weights();
    private Claim claim = new Claim();
    private Credit credit = new Credit();
    private Logistics logistics = new Logistics();
    private Evidence evidence = new Evidence();

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private volatile Map<String, WeightSpec> validatedWeights;

    @PostConstruct
    public void validate() {
        Map<String, WeightSpec> specs = new LinkedHashMap<>();
        specs.put(WEIGHTS_TRADITIONAL, WeightSpec.of(WEIGHTS_TRADITIONAL, weights.getTraditional()));
        specs.put(WEIGHTS_COMPOSITE, WeightSpec.of(WEIGHTS_COMPOSITE, weights.getComposite()));
        specs.put(WEIGHTS_CLAIM, WeightSpec.of(WEIGHTS_CLAIM, weights.getClaim()));

        requireFactors(specs.get(WEIGHTS_TRADITIONAL), FactorNames.FARM_SIZE, FactorNames.CROP_HEALTH,
                FactorNames.CLIMATE_RISK, FactorNames.PAYMENT_HISTORY, FactorNames.DEFORESTATION);
        requireFactors(specs.get(WEIGHTS_COMPOSITE), FactorNames.TRADITIONAL, FactorNames.ACTION,
                FactorNames.GROUND_TRUTH);
        requireFactors(specs.get(WEIGHTS_CLAIM), FactorNames.SATELLITE, FactorNames.NEIGHBORS,
                FactorNames.SELF_REPORTS);

        if (claim.getMinNeighborReporters() < 2) {
            throw new InvalidWeightConfigurationException("claim.minNeighborReporters",
                    "claim.minNeighborReporters must be >= 2, a single neighbor cannot corroborate a claim");
        }
        if (evidence.getTimeoutMs() <= 0) {
            throw new InvalidWeightConfigurationException("evidence.timeoutMs", "evidence.timeoutMs must be > 0");
        }

        this.validatedWeights = specs;
        specs.values().forEach(spec -> log.info("Loaded weight set {}", spec));
    }

    public WeightSpec traditionalWeights() {
        return spec(WEIGHTS_TRADITIONAL);
    }

    public WeightSpec compositeWeights() {
        return spec(WEIGHTS_COMPOSITE);
    }

    public WeightSpec claimWeights() {
        return spec(WEIGHTS_CLAIM);
    }

    private WeightSpec spec(String name) {
        if (validatedWeights == null) {
            validate();
        }
        return validatedWeights.get(name);
    }

    private static void requireFactors(WeightSpec spec, String... factors) {
        for (String factor : factors) {
            if (!spec.getWeights().containsKey(factor)) {
                throw new InvalidWeightConfigurationException(spec.getName(),
                        "Weight set '" + spec.getName() + "' is missing factor '" + factor + "'");
            }
        }
        if (spec.getWeights().size() != factors.length) {
            throw new InvalidWeightConfigurationException(spec.getName(),
                    "Weight set '" + spec.getName() + "' has unknown factors: " + spec.getWeights().keySet());
        }
    }

    @Data
    public static class Weights {
        private Map<String, Double> traditional = orderedWeights(
                FactorNames.FARM_SIZE, 0.15,
                FactorNames.CROP_HEALTH, 0.25,
                FactorNames.CLIMATE_RISK, 0.20,
                FactorNames.PAYMENT_HISTORY, 0.25,
                FactorNames.DEFORESTATION, 0.15);

        private Map<String, Double> composite = orderedWeights(
                FactorNames.TRADITIONAL, 0.40,
                FactorNames.ACTION, 0.30,
                FactorNames.GROUND_TRUTH, 0.30);

        private Map<String, Double> claim = orderedWeights(
                FactorNames.SATELLITE, 0.30,
                FactorNames.NEIGHBORS, 0.40,
                FactorNames.SELF_REPORTS, 0.30);
    }

    @Data
    public static class Claim {
        // Fewer distinct reporting neighbors than this and the neighbor source is unavailable
        private int minNeighborReporters = 3;
        private int nearestNeighborFarms = 10;
        private int satelliteWindowDays = 7;
        private int neighborWindowDays = 3;
        private int selfReportWindowDays = 7;
        private double neighborAgreementThreshold = 0.5;
        private double droughtNdviThreshold = 0.30;
        private double floodBackscatterDb = -15.0;
        // Claims older than this are rejected as malformed
        private int maxClaimAgeDays = 365;
        private boolean requireVerifiedNeighborReports = true;
    }

    @Data
    public static class Credit {
        // Rolling window for action and ground-truth history
        private int lookbackDays = 365;
        // Reports in the window that earn full frequency credit
        private int fullFrequencyReports = 12;
        private int scoreValidityDays = 30;
    }

    @Data
    public static class Logistics {
        private int minForecastDays = 7;
        private double maxOptimalRainfallMm = 5.0;
        private double minOptimalTemperatureC = 20.0;
        private double maxOptimalTemperatureC = 30.0;
        private double maxOptimalHumidityPct = 80.0;
        private double highRoadRiskRainfallMm = 100.0;
        private double mediumRoadRiskRainfallMm = 50.0;
        // Rainfall that saturates unpaved access roads
        private double roadSaturationMm = 30.0;
        private int highRiskClosureHorizonDays = 2;
        private double baseLossRatePctPerDay = 2.0;
        private double maxLossPct = 50.0;
        private double humidLossThresholdPct = 80.0;
        private double wetLossThresholdMm = 50.0;
        // Loss slope (%/day) above which a near road closure becomes CRITICAL
        private double criticalLossSlopePctPerDay = 2.5;
    }

    @Data
    public static class Evidence {
        private long timeoutMs = 2000;
        private int poolSize = 16;
    }

    private static Map<String, Double> orderedWeights(Object... pairs) {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], (Double) pairs[i + 1]);
        }
        return map;
    }
}
