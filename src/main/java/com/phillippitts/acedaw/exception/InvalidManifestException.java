package com.phillippitts.acedaw.exception;

/**
 * Thrown when the manifest parses but its content is unusable: unrecognized version,
 * missing project identity, a track field that is not an array or a malformed file table.
 */
public class InvalidManifestException extends ArchiveDecodeException {

    public InvalidManifestException(String message) {
        super(message);
    }

    public InvalidManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}
