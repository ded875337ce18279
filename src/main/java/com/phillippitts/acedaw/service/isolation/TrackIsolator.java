package com.phillippitts.acedaw.service.isolation;

import com.phillippitts.acedaw.service.audio.SampleBuffer;

import java.util.Objects;

/**
 * Derives one layer's audio from two cumulative mixes.
 *
 * <p>Given the mix of layers 1..N and the mix of layers 1..N-1, the difference is layer N.
 * Channels or frames that the previous mix lacks count as silence, so a shorter or narrower
 * previous mix is normal input, not an error. No resampling, clipping or normalization happens
 * here; the result may leave [-1, 1].
 */
public final class TrackIsolator {

    private TrackIsolator() {}

    /**
     * @param currentMix  cumulative mix including the layer to isolate
     * @param previousMix cumulative mix of the layers below it, or {@code null} for the first layer
     * @return {@code currentMix} itself when there is no previous mix, otherwise a new buffer with
     *         the current mix's rate, channel count and length
     */
    public static SampleBuffer isolate(SampleBuffer currentMix, SampleBuffer previousMix) {
        Objects.requireNonNull(currentMix, "currentMix must not be null");
        if (previousMix == null) {
            return currentMix;
        }

        int channels = currentMix.numberOfChannels();
        int length = currentMix.length();
        int prevChannels = previousMix.numberOfChannels();
        int prevLength = previousMix.length();

        float[][] out = new float[channels][length];
        for (int c = 0; c < channels; c++) {
            boolean hasPrev = c < prevChannels;
            for (int i = 0; i < length; i++) {
                float subtrahend = hasPrev && i < prevLength ? previousMix.sample(c, i) : 0f;
                out[c][i] = currentMix.sample(c, i) - subtrahend;
            }
        }
        return new SampleBuffer(currentMix.sampleRate(), out);
    }
}
