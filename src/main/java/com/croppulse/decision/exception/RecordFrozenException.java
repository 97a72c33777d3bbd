package com.croppulse.decision.exception;

import java.util.List;

/**
 * An attempt to overwrite an issued score or verdict. Issued records are immutable.
 */
public class RecordFrozenException extends DecisionException {

    public RecordFrozenException(String recordType, String recordId, Throwable cause) {
        super("RECORD_FROZEN", recordType + " " + recordId + " already exists and cannot be overwritten",
                List.of(recordId), cause);
    }
}
