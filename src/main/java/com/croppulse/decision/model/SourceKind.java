package com.croppulse.decision.model;

/**
 * The closed set of evidence sources the engines consume.
 */
public enum SourceKind {
    SATELLITE,
    NEIGHBOR,
    SELF_REPORT,
    ACTION,
    GROUND_TRUTH,
    TRADITIONAL_FACTOR
}
