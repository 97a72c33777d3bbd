package com.croppulse.decision.model;

public enum RoadRiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
