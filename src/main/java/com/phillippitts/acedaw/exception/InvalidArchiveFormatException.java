package com.phillippitts.acedaw.exception;

/**
 * Thrown when a buffer is not an archive at all: the magic token does not match or the
 * manifest region is not well-formed UTF-8 JSON.
 */
public class InvalidArchiveFormatException extends ArchiveDecodeException {

    public InvalidArchiveFormatException(String message) {
        super(message);
    }

    public InvalidArchiveFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
