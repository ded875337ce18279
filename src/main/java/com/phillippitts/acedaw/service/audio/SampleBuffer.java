package com.phillippitts.acedaw.service.audio;

import java.util.Arrays;
import java.util.Objects;

/**
 * Decoded multi-channel audio: a sample rate and one {@code float[]} per channel, all of equal
 * length. Samples are nominally in [-1, 1] but may exceed it; nothing here clamps.
 *
 * <p>Immutable: arrays are copied on construction and on {@link #channel(int)}.
 */
public final class SampleBuffer {

    private final int sampleRate;
    private final float[][] channels;

    /**
     * @param sampleRate frames per second, positive
     * @param channels   per-channel samples; at least one channel, all the same length
     * @throws IllegalArgumentException on a non-positive rate, no channels, or ragged channels
     */
    public SampleBuffer(int sampleRate, float[][] channels) {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("Sample rate must be positive, got: " + sampleRate);
        }
        Objects.requireNonNull(channels, "channels must not be null");
        if (channels.length == 0) {
            throw new IllegalArgumentException("A sample buffer needs at least one channel");
        }
        int length = Objects.requireNonNull(channels[0], "channel 0 must not be null").length;
        float[][] copy = new float[channels.length][];
        for (int c = 0; c < channels.length; c++) {
            Objects.requireNonNull(channels[c], "channel " + c + " must not be null");
            if (channels[c].length != length) {
                throw new IllegalArgumentException("Channel " + c + " has " + channels[c].length
                        + " samples, expected " + length);
            }
            copy[c] = channels[c].clone();
        }
        this.sampleRate = sampleRate;
        this.channels = copy;
    }

    /**
     * Creates a buffer of the given shape filled with zeros.
     */
    public static SampleBuffer silence(int sampleRate, int channelCount, int length) {
        if (channelCount <= 0 || length < 0) {
            throw new IllegalArgumentException("Invalid shape: " + channelCount + " channels x " + length);
        }
        return new SampleBuffer(sampleRate, new float[channelCount][length]);
    }

    public int sampleRate() {
        return sampleRate;
    }

    public int numberOfChannels() {
        return channels.length;
    }

    /**
     * @return frames per channel
     */
    public int length() {
        return channels[0].length;
    }

    public float sample(int channel, int index) {
        return channels[channel][index];
    }

    /**
     * @return a copy of one channel's samples
     */
    public float[] channel(int channel) {
        return channels[channel].clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SampleBuffer other)) {
            return false;
        }
        return sampleRate == other.sampleRate && Arrays.deepEquals(channels, other.channels);
    }

    @Override
    public int hashCode() {
        return 31 * sampleRate + Arrays.deepHashCode(channels);
    }

    @Override
    public String toString() {
        return "SampleBuffer{sampleRate=" + sampleRate + ", channels=" + channels.length
                + ", length=" + length() + "}";
    }
}
