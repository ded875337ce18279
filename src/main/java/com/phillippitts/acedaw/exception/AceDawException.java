package com.phillippitts.acedaw.exception;

/**
 * Base exception for all acedaw application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class AceDawException extends RuntimeException {

    public AceDawException(String message) {
        super(message);
    }

    public AceDawException(String message, Throwable cause) {
        super(message, cause);
    }

    public AceDawException(Throwable cause) {
        super(cause);
    }
}
