package com.phillippitts.acedaw.exception;

/**
 * Thrown when a workflow requires an audio payload that is not stored, such as the
 * cumulative mix a track isolation starts from.
 */
public class AudioBlobNotFoundException extends AceDawException {

    private final String key;

    public AudioBlobNotFoundException(String key) {
        super("Audio blob not found: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
