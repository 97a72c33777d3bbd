package com.croppulse.decision.exception;

import com.croppulse.decision.model.SourceKind;

import java.util.List;

/**
 * A single evidence source could not supply a value (no data in the window, timeout, store failure).
 * Absorbed by the evidence fetcher and turned into weight redistribution.
 */
public class SourceUnavailableException extends DecisionException {

    private final SourceKind source;

    public SourceUnavailableException(SourceKind source, String reason) {
        super("SOURCE_UNAVAILABLE", reason, List.of(source.name()));
        this.source = source;
    }

    public SourceUnavailableException(SourceKind source, String reason, Throwable cause) {
        super("SOURCE_UNAVAILABLE", reason, List.of(source.name()), cause);
        this.source = source;
    }

    public SourceKind getSource() {
        return source;
    }
}
