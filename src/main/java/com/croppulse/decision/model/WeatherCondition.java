package com.croppulse.decision.model;

public enum WeatherCondition {
    CLEAR,
    CLOUDY,
    LIGHT_RAIN,
    HEAVY_RAIN,
    DRIZZLE,
    STORM,
    FOG,
    WINDY
}
