package com.croppulse.decision.engine.logistics;

import com.croppulse.decision.config.DecisionConfig;
import com.croppulse.decision.exception.MalformedInputException;
import com.croppulse.decision.exception.MissingForecastException;
import com.croppulse.decision.model.ForecastDay;
import com.croppulse.decision.model.HarvestAssessment;
import com.croppulse.decision.model.LossProjection;
import com.croppulse.decision.model.RoadRisk;
import com.croppulse.decision.model.RoadRiskLevel;
import com.croppulse.decision.model.Urgency;
import io.micrometer.observation.annotation.Observed;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Derives harvest timing, road accessibility and post-harvest loss from a daily forecast.
 *
 * The harvest window, road risk and loss projection are computed independently from the
 * same forecast; urgency and the recommendation strings are derived from those three
 * results only.
 */
@Component
public class LogisticsRiskEngine {

    private final DecisionConfig config;

    public LogisticsRiskEngine(DecisionConfig config) {
        this.config = config;
    }

    @Observed(name = "harvest.assess", contextualName = "assess-harvest")
    public HarvestAssessment assess(String farmId, List<ForecastDay> forecast) {
        List<ForecastDay> days = requireForecast(farmId, forecast);
        LocalDate firstDay = days.get(0).getDate();

        RoadRisk roadRisk = assessRoadRisk(days);

        List<LocalDate> qualifying = harvestWindow(days);
        LocalDate optimalDate = qualifying.isEmpty() ? null : qualifying.get(0);

        // closure truncates the reported window, not the optimal date
        List<LocalDate> window = qualifying;
        if (roadRisk.getLevel() == RoadRiskLevel.HIGH && roadRisk.getDaysUntilClosure() != null) {
            LocalDate closure = firstDay.plusDays(roadRisk.getDaysUntilClosure());
            window = qualifying.stream().filter(d -> d.isBefore(closure)).collect(Collectors.toList());
        }

        int delayDays = optimalDate == null
                ? days.size()
                : (int) ChronoUnit.DAYS.between(firstDay, optimalDate);
        LossProjection loss = projectLoss(delayDays, meanHumidity(days), cumulativeRainfall(days));

        Urgency urgency = urgency(roadRisk, loss);

        return HarvestAssessment.builder()
                .farmId(farmId)
                .assessedOn(firstDay)
                .horizonDays(days.size())
                .optimalDate(optimalDate)
                .windowDates(List.copyOf(window))
                .roadRisk(roadRisk)
                .lossProjection(loss)
                .projectedLossPct(loss.getProjectedLossPct())
                .urgency(urgency)
                .recommendations(recommendations(days.size(), optimalDate, window, roadRisk, loss, urgency, firstDay))
                .build();
    }

    /**
     * Loss estimate for an explicit delay, using the horizon's mean humidity and total rainfall.
     */
    public LossProjection estimateLoss(String farmId, List<ForecastDay> forecast, int delayDays) {
        if (delayDays < 0) {
            throw new MalformedInputException("delayDays", "delayDays must be >= 0, got " + delayDays);
        }
        List<ForecastDay> days = requireForecast(farmId, forecast);
        return projectLoss(delayDays, meanHumidity(days), cumulativeRainfall(days));
    }

    /**
     * Earliest qualifying day and the contiguous qualifying days after it.
     */
    public List<LocalDate> harvestWindow(List<ForecastDay> days) {
        List<LocalDate> window = new ArrayList<>();
        for (ForecastDay day : days) {
            if (isOptimal(day)) {
                window.add(day.getDate());
            } else if (!window.isEmpty()) {
                break;
            }
        }
        return window;
    }

    boolean isOptimal(ForecastDay day) {
        DecisionConfig.Logistics l = config.getLogistics();
        return day.getRainfallMm() < l.getMaxOptimalRainfallMm()
                && day.getTemperatureC() >= l.getMinOptimalTemperatureC()
                && day.getTemperatureC() <= l.getMaxOptimalTemperatureC()
                && day.getHumidityPct() < l.getMaxOptimalHumidityPct();
    }

    /**
     * Classify by cumulative rainfall; the closure horizon is the time the forecast
     * accumulation rate needs to saturate unpaved roads.
     */
    public RoadRisk assessRoadRisk(List<ForecastDay> days) {
        DecisionConfig.Logistics l = config.getLogistics();
        int horizon = days.size();
        double cumulative = cumulativeRainfall(days);
        double rate = horizon == 0 ? 0.0 : cumulative / horizon;

        RoadRiskLevel level;
        if (cumulative > l.getHighRoadRiskRainfallMm()) {
            level = RoadRiskLevel.HIGH;
        } else if (cumulative >= l.getMediumRoadRiskRainfallMm()) {
            level = RoadRiskLevel.MEDIUM;
        } else {
            level = RoadRiskLevel.LOW;
        }

        Integer daysUntilClosure = null;
        if (level != RoadRiskLevel.LOW && rate > 0) {
            int closureDays = (int) Math.ceil(l.getRoadSaturationMm() / rate);
            closureDays = Math.max(1, Math.min(horizon, closureDays));
            if (level == RoadRiskLevel.HIGH) {
                closureDays = Math.min(closureDays, l.getHighRiskClosureHorizonDays());
            }
            daysUntilClosure = closureDays;
        }

        String accessibility;
        switch (level) {
            case HIGH:
                accessibility = "Roads likely impassable within " + daysUntilClosure + " day(s)";
                break;
            case MEDIUM:
                accessibility = "Roads degrading, closure possible in about " + daysUntilClosure + " day(s)";
                break;
            default:
                accessibility = "Roads accessible";
        }

        return RoadRisk.builder()
                .level(level)
                .daysUntilClosure(daysUntilClosure)
                .cumulativeRainfallMm(round2(cumulative))
                .rainfallRateMmPerDay(round2(rate))
                .accessibility(accessibility)
                .build();
    }

    /**
     * loss% = min(maxLoss, baseRate × delayDays × multiplier), where
     * multiplier = 1 + 0.5 × [humidity > 80%] + 0.3 × [rainfall > 50mm].
     */
    public LossProjection projectLoss(int delayDays, double humidityPct, double rainfallMm) {
        DecisionConfig.Logistics l = config.getLogistics();
        double multiplier = 1.0;
        if (humidityPct > l.getHumidLossThresholdPct()) {
            multiplier += 0.5;
        }
        if (rainfallMm > l.getWetLossThresholdMm()) {
            multiplier += 0.3;
        }
        double dailyRate = l.getBaseLossRatePctPerDay() * multiplier;
        double loss = Math.min(l.getMaxLossPct(), dailyRate * Math.max(0, delayDays));

        return LossProjection.builder()
                .delayDays(delayDays)
                .avgHumidityPct(round2(humidityPct))
                .cumulativeRainfallMm(round2(rainfallMm))
                .weatherMultiplier(round2(multiplier))
                .dailyLossRatePct(round2(dailyRate))
                .projectedLossPct(round2(loss))
                .build();
    }

    /**
     * CRITICAL needs both a closure within the high-risk horizon and a loss slope above the
     * critical threshold; either one alone is HIGH.
     */
    public Urgency urgency(RoadRisk roadRisk, LossProjection loss) {
        DecisionConfig.Logistics l = config.getLogistics();
        Integer closure = roadRisk.getDaysUntilClosure();
        boolean closureExpected = closure != null;
        boolean closureImminent = closureExpected && closure <= l.getHighRiskClosureHorizonDays();
        boolean steepLoss = loss.getDailyLossRatePct() > l.getCriticalLossSlopePctPerDay();

        if (closureImminent && steepLoss) return Urgency.CRITICAL;
        if (closureImminent || (closureExpected && steepLoss)) return Urgency.HIGH;
        if (closureExpected || steepLoss) return Urgency.MEDIUM;
        return Urgency.LOW;
    }

    private List<String> recommendations(int horizon, LocalDate optimalDate, List<LocalDate> window,
                                         RoadRisk roadRisk, LossProjection loss, Urgency urgency,
                                         LocalDate firstDay) {
        List<String> out = new ArrayList<>();
        if (urgency == Urgency.CRITICAL) {
            out.add("Harvest and transport immediately: roads close within "
                    + roadRisk.getDaysUntilClosure() + " day(s) and losses are accelerating");
        }
        if (optimalDate != null && !window.isEmpty()) {
            out.add(String.format("Harvest on %s (window of %d day(s) through %s)",
                    optimalDate, window.size(), window.get(window.size() - 1)));
        } else if (optimalDate != null) {
            out.add(String.format("Best harvest day %s falls after roads are expected to close on %s; "
                    + "arrange transport in advance or store the crop on the farm",
                    optimalDate, firstDay.plusDays(roadRisk.getDaysUntilClosure())));
        } else {
            out.add(String.format("No optimal harvest day in the next %d days; harvest in the first dry spell "
                    + "and dry the crop under cover", horizon));
        }
        if (roadRisk.getLevel() == RoadRiskLevel.HIGH) {
            out.add(String.format("Move produce to the collection point before %s (%.1f mm of rain forecast)",
                    firstDay.plusDays(roadRisk.getDaysUntilClosure()), roadRisk.getCumulativeRainfallMm()));
        } else if (roadRisk.getLevel() == RoadRiskLevel.MEDIUM) {
            out.add(String.format("Book transport early: roads degrading under %.1f mm of forecast rain",
                    roadRisk.getCumulativeRainfallMm()));
        }
        if (loss.getProjectedLossPct() > 0) {
            out.add(String.format("Waiting %d day(s) projects %.1f%% post-harvest loss (%.1f%% per day)",
                    loss.getDelayDays(), loss.getProjectedLossPct(), loss.getDailyLossRatePct()));
        }
        if (loss.getAvgHumidityPct() > config.getLogistics().getHumidLossThresholdPct()) {
            out.add(String.format("High humidity (%.0f%%): use hermetic storage bags", loss.getAvgHumidityPct()));
        }
        return Collections.unmodifiableList(out);
    }

    private List<ForecastDay> requireForecast(String farmId, List<ForecastDay> forecast) {
        int min = config.getLogistics().getMinForecastDays();
        int have = forecast == null ? 0 : forecast.size();
        if (have < min) {
            throw new MissingForecastException(String.format(
                    "Forecast for farm %s covers %d day(s), at least %d required", farmId, have, min),
                    List.of("forecast:" + farmId));
        }
        List<ForecastDay> days = new ArrayList<>(forecast);
        days.sort(Comparator.comparing(ForecastDay::getDate));
        return days;
    }

    private static double cumulativeRainfall(List<ForecastDay> days) {
        return days.stream().mapToDouble(ForecastDay::getRainfallMm).sum();
    }

    private static double meanHumidity(List<ForecastDay> days) {
        return days.stream().mapToDouble(ForecastDay::getHumidityPct).average().orElse(0.0);
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
