package com.croppulse.decision.model;

import com.croppulse.decision.exception.MalformedInputException;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Insurable loss events and the field conditions that corroborate each of them.
 */
public enum ClaimType {
    DROUGHT(EnumSet.of(WeatherCondition.CLEAR, WeatherCondition.CLOUDY), null),
    FLOOD(EnumSet.of(WeatherCondition.HEAVY_RAIN, WeatherCondition.STORM), null),
    STORM(EnumSet.of(WeatherCondition.STORM, WeatherCondition.WINDY), null),
    FROST(EnumSet.noneOf(WeatherCondition.class), TemperatureFeel.VERY_COLD);

    private final Set<WeatherCondition> matchingConditions;
    private final TemperatureFeel matchingFeel;

    ClaimType(Set<WeatherCondition> matchingConditions, TemperatureFeel matchingFeel) {
        this.matchingConditions = matchingConditions;
        this.matchingFeel = matchingFeel;
    }

    /**
     * Whether a ground-truth report describes the condition this claim asserts.
     */
    public boolean isCorroboratedBy(GroundTruthReport report) {
        if (report == null) return false;
        if (matchingFeel != null && matchingFeel == report.getTemperatureFeel()) {
            return true;
        }
        return report.getWeatherCondition() != null
                && matchingConditions.contains(report.getWeatherCondition());
    }

    public static ClaimType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedInputException("claimType", "claimType is required");
        }
        try {
            return ClaimType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MalformedInputException("claimType",
                    "Unknown claim type: " + raw + " (expected one of DROUGHT, FLOOD, STORM, FROST)");
        }
    }
}
