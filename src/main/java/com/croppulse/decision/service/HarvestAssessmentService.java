package com.croppulse.decision.service;

import com.croppulse.decision.config.MetricsConfig;
import com.croppulse.decision.engine.evidence.ForecastStore;
import com.croppulse.decision.engine.logistics.LogisticsRiskEngine;
import com.croppulse.decision.exception.MalformedInputException;
import com.croppulse.decision.model.ForecastDay;
import com.croppulse.decision.model.HarvestAssessment;
import com.croppulse.decision.model.LossProjection;
import com.croppulse.decision.model.Urgency;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Assesses harvest timing from the current forecast. Assessments are derived fresh on
 * every call and not persisted.
 */
@Service
public class HarvestAssessmentService {

    private static final Logger log = LoggerFactory.getLogger(HarvestAssessmentService.class);

    private final LogisticsRiskEngine engine;
    private final ForecastStore forecastStore;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public HarvestAssessmentService(LogisticsRiskEngine engine, ForecastStore forecastStore,
                                    MetricsConfig metricsConfig, Clock clock) {
        this.engine = engine;
        this.forecastStore = forecastStore;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Observed(name = "harvest.assess_request", contextualName = "assess-harvest-request")
    public HarvestAssessment assess(String farmId) {
        List<ForecastDay> forecast = loadForecast(farmId);
        HarvestAssessment assessment = engine.assess(farmId, forecast);

        metricsConfig.recordHarvestAssessment(assessment.getUrgency().name());
        if (assessment.getUrgency() == Urgency.CRITICAL) {
            log.warn("Harvest for farm {} is CRITICAL: road risk {} (closure in {} days), loss {}%/day",
                    farmId, assessment.getRoadRisk().getLevel(), assessment.getRoadRisk().getDaysUntilClosure(),
                    assessment.getLossProjection().getDailyLossRatePct());
        } else {
            log.debug("Harvest for farm {}: optimal {} urgency {}", farmId,
                    assessment.getOptimalDate(), assessment.getUrgency());
        }
        return assessment;
    }

    public LossProjection estimateLoss(String farmId, int delayDays) {
        if (delayDays < 0) {
            throw new MalformedInputException("delayDays", "delayDays must be >= 0, got " + delayDays);
        }
        return engine.estimateLoss(farmId, loadForecast(farmId), delayDays);
    }

    private List<ForecastDay> loadForecast(String farmId) {
        if (farmId == null || farmId.isBlank()) {
            throw new MalformedInputException("farmId", "farmId is required");
        }
        return forecastStore.findForecast(farmId, LocalDate.now(clock));
    }
}
