package com.croppulse.decision.model;

public enum Urgency {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
