package com.croppulse.decision.exception;

import java.util.List;

/**
 * Request rejected before any evidence was fetched (missing identifier, unknown claim type,
 * claim date out of range).
 */
public class MalformedInputException extends DecisionException {

    public MalformedInputException(String field, String message) {
        super("MALFORMED_INPUT", message, List.of(field));
    }
}
