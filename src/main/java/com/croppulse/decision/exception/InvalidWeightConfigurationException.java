package com.croppulse.decision.exception;

import java.util.List;

/**
 * A configured weight set is malformed. Raised while the configuration is loaded, never per request.
 */
public class InvalidWeightConfigurationException extends DecisionException {

    public InvalidWeightConfigurationException(String weightSet, String message) {
        super("INVALID_WEIGHT_CONFIGURATION", message, List.of(weightSet));
    }
}
