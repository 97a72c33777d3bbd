package com.croppulse.decision.model;

/**
 * Letter grades over the 0-1000 composite score. Each grade owns the half-open
 * interval [minScore, next grade's minScore); together they tile 0..1000 with
 * no gaps or overlaps.
 */
public enum CreditGrade {
    A(800, 8.0),
    B(700, 10.0),
    C(600, 12.0),
    D(500, 15.0),
    F(0, null);

    public static final int MAX_SCORE = 1000;

    private final int minScore;
    private final Double interestRatePct;

    CreditGrade(int minScore, Double interestRatePct) {
        this.minScore = minScore;
        this.interestRatePct = interestRatePct;
    }

    public int getMinScore() {
        return minScore;
    }

    /**
     * Indicative annual interest rate, or null when the grade is not eligible for credit.
     */
    public Double getInterestRatePct() {
        return interestRatePct;
    }

    public boolean isEligible() {
        return interestRatePct != null;
    }

    public static CreditGrade fromScore(int score) {
        if (score < 0 || score > MAX_SCORE) {
            throw new IllegalArgumentException("Score out of range [0, " + MAX_SCORE + "]: " + score);
        }
        for (CreditGrade grade : values()) {
            if (score >= grade.minScore) {
                return grade;
            }
        }
        return F;
    }
}
