package com.phillippitts.acedaw.exception;

/**
 * Common parent of every structural failure while decoding an {@code .acedaw} archive.
 *
 * <p>Import surfaces this single type to its caller; the concrete subclass tells which
 * layer of the format was violated.
 */
public abstract class ArchiveDecodeException extends AceDawException {

    protected ArchiveDecodeException(String message) {
        super(message);
    }

    protected ArchiveDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
