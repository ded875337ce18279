package com.phillippitts.acedaw.exception;

/**
 * Thrown when a stored project record exists but cannot be parsed back into a project.
 */
public class CorruptProjectRecordException extends AceDawException {

    private final String recordKey;

    public CorruptProjectRecordException(String recordKey, Throwable cause) {
        super("Stored project record is unreadable: " + recordKey, cause);
        this.recordKey = recordKey;
    }

    public String getRecordKey() {
        return recordKey;
    }
}
