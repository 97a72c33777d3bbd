package com.croppulse.decision.model;

/**
 * Sub-factor keys shared by weight configuration, aggregation and evidence items.
 */
public final class FactorNames {

    private FactorNames() {}

    // Traditional sub-score
    public static final String FARM_SIZE = "farmSize";
    public static final String CROP_HEALTH = "cropHealth";
    public static final String CLIMATE_RISK = "climateRisk";
    public static final String PAYMENT_HISTORY = "paymentHistory";
    public static final String DEFORESTATION = "deforestation";

    // Composite credit score
    public static final String TRADITIONAL = "traditional";
    public static final String ACTION = "action";
    public static final String GROUND_TRUTH = "groundTruth";

    // Claim verification
    public static final String SATELLITE = "satellite";
    public static final String NEIGHBORS = "neighbors";
    public static final String SELF_REPORTS = "selfReports";
}
