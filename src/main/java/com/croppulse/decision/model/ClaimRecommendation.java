package com.croppulse.decision.model;

/**
 * Confidence banding for claim verdicts. Lower bounds are inclusive.
 */
public enum ClaimRecommendation {
    APPROVE_STRONG(80.0, "Approve - strong evidence"),
    APPROVE(60.0, "Approve - sufficient evidence"),
    INVESTIGATE(40.0, "Investigate - weak evidence"),
    REJECT(0.0, "Reject - insufficient evidence");

    private final double minConfidence;
    private final String description;

    ClaimRecommendation(double minConfidence, String description) {
        this.minConfidence = minConfidence;
        this.description = description;
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public String getDescription() {
        return description;
    }

    public boolean isApproval() {
        return this == APPROVE_STRONG || this == APPROVE;
    }

    public static ClaimRecommendation fromConfidence(double confidence) {
        if (confidence >= APPROVE_STRONG.minConfidence) return APPROVE_STRONG;
        if (confidence >= APPROVE.minConfidence) return APPROVE;
        if (confidence >= INVESTIGATE.minConfidence) return INVESTIGATE;
        return REJECT;
    }
}
