package com.croppulse.decision.model;

public enum TemperatureFeel {
    VERY_COLD,
    COLD,
    NORMAL,
    HOT,
    VERY_HOT
}
