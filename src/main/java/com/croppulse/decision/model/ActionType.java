package com.croppulse.decision.model;

/**
 * Climate-smart practices a farmer can submit proof of.
 */
public enum ActionType {
    FERTILIZER,
    PESTICIDE,
    IRRIGATION,
    PLANTING,
    WEEDING,
    HARVESTING,
    SOIL_PREP,
    OTHER
}
