package com.phillippitts.acedaw.exception;

/**
 * Thrown when the key-value substrate fails to read, write, enumerate or delete a key.
 */
public class StorageException extends AceDawException {

    private final String key;

    public StorageException(String message, Throwable cause) {
        super(message, cause);
        this.key = null;
    }

    public StorageException(String message, String key, Throwable cause) {
        super(message + " (key: " + key + ")", cause);
        this.key = key;
    }

    /**
     * @return the key involved in the failed operation, or {@code null} for store-wide operations
     */
    public String getKey() {
        return key;
    }
}
