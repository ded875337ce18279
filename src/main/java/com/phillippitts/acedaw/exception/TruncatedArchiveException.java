package com.phillippitts.acedaw.exception;

/**
 * Thrown when the header or a file-table entry refers to bytes past the end of the buffer.
 */
public class TruncatedArchiveException extends ArchiveDecodeException {

    private final long requiredBytes;
    private final long availableBytes;

    public TruncatedArchiveException(String message, long requiredBytes, long availableBytes) {
        super(message + " (needs " + requiredBytes + " bytes, " + availableBytes + " available)");
        this.requiredBytes = requiredBytes;
        this.availableBytes = availableBytes;
    }

    public long getRequiredBytes() {
        return requiredBytes;
    }

    public long getAvailableBytes() {
        return availableBytes;
    }
}
