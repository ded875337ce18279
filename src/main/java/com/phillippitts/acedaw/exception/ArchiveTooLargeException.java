package com.phillippitts.acedaw.exception;

/**
 * Thrown when an archive offered for import exceeds the configured size limit.
 */
public class ArchiveTooLargeException extends AceDawException {

    private final long size;
    private final long limit;

    public ArchiveTooLargeException(long size, long limit) {
        super("Archive too large: " + size + " bytes. Max: " + limit + " bytes");
        this.size = size;
        this.limit = limit;
    }

    public long getSize() {
        return size;
    }

    public long getLimit() {
        return limit;
    }
}
