package com.croppulse.decision.exception;

import java.util.List;

/**
 * No usable evidence source was left for a decision. Never replaced by a default score.
 */
public class InsufficientEvidenceException extends DecisionException {

    public InsufficientEvidenceException(String message, List<String> missing) {
        super("INSUFFICIENT_EVIDENCE", message, missing);
    }
}
