package com.phillippitts.acedaw.exception;

/**
 * Thrown when an audio payload cannot be decoded as a supported WAV container
 * (16-bit PCM or 32-bit IEEE float) or a sample buffer cannot be encoded.
 */
public class InvalidAudioException extends AceDawException {

    private final int audioSize;
    private final String reason;

    public InvalidAudioException(String reason) {
        super("Invalid audio data: " + reason);
        this.audioSize = 0;
        this.reason = reason;
    }

    public InvalidAudioException(int audioSize, String reason) {
        super("Invalid audio data (" + audioSize + " bytes): " + reason);
        this.audioSize = audioSize;
        this.reason = reason;
    }

    public int getAudioSize() {
        return audioSize;
    }

    public String getReason() {
        return reason;
    }
}
