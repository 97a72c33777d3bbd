package com.croppulse.decision.exception;

import java.util.List;

public class MissingForecastException extends DecisionException {

    public MissingForecastException(String message, List<String> missing) {
        super("MISSING_FORECAST", message, missing);
    }
}
