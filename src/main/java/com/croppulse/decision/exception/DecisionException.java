package com.croppulse.decision.exception;

import java.util.List;

/**
 * Base type for every failure a decision request can surface.
 * Carries a stable error code and the names of the evidence or
 * configuration entries that were missing, so a caller knows what to restore
 * before retrying.
 */
public abstract class DecisionException extends RuntimeException {

    private final String errorCode;
    private final List<String> missing;

    protected DecisionException(String errorCode, String message, List<String> missing) {
        super(message);
        this.errorCode = errorCode;
        this.missing = missing == null ? List.of() : List.copyOf(missing);
    }

    protected DecisionException(String errorCode, String message, List<String> missing, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.missing = missing == null ? List.of() : List.copyOf(missing);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public List<String> getMissing() {
        return missing;
    }
}
