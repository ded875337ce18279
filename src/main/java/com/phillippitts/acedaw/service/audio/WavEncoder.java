package com.phillippitts.acedaw.service.audio;

import com.phillippitts.acedaw.exception.InvalidAudioException;

import java.io.ByteArrayOutputStream;
import java.util.Objects;

/**
 * Writes {@link SampleBuffer}s as canonical 44-byte-header, 16-bit PCM WAV files.
 *
 * <p>This is where out-of-range samples are clamped: values beyond [-1, 1] saturate at the
 * 16-bit limits.
 */
public final class WavEncoder {

    private static final int BITS_PER_SAMPLE = 16;
    private static final int BYTES_PER_SAMPLE = BITS_PER_SAMPLE / 8;

    private WavEncoder() {}

    /**
     * @param buffer samples to encode
     * @return complete WAV file bytes, channels interleaved
     * @throws InvalidAudioException if the encoded size does not fit a RIFF container
     */
    public static byte[] encodePcm16(SampleBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer must not be null");
        int channels = buffer.numberOfChannels();
        int frames = buffer.length();
        int blockAlign = channels * BYTES_PER_SAMPLE;
        long dataSize = (long) frames * blockAlign;
        if (dataSize > Integer.MAX_VALUE - WavFormat.CANONICAL_HEADER_SIZE) {
            throw new InvalidAudioException("Audio too long to encode: " + frames + " frames x "
                    + channels + " channels");
        }

        ByteArrayOutputStream os = new ByteArrayOutputStream(WavFormat.CANONICAL_HEADER_SIZE + (int) dataSize);
        // RIFF header
        writeAscii(os, "RIFF");
        writeLEInt(os, 36 + (int) dataSize);
        writeAscii(os, "WAVE");

        // fmt chunk
        writeAscii(os, "fmt ");
        writeLEInt(os, WavFormat.FMT_CHUNK_MIN_SIZE);
        writeLEShort(os, WavFormat.AUDIO_FORMAT_PCM);
        writeLEShort(os, channels);
        writeLEInt(os, buffer.sampleRate());
        writeLEInt(os, buffer.sampleRate() * blockAlign);   // byte rate
        writeLEShort(os, blockAlign);
        writeLEShort(os, BITS_PER_SAMPLE);

        // data chunk
        writeAscii(os, "data");
        writeLEInt(os, (int) dataSize);
        for (int i = 0; i < frames; i++) {
            for (int c = 0; c < channels; c++) {
                writeLEShort(os, toPcm16(buffer.sample(c, i)));
            }
        }
        return os.toByteArray();
    }

    static short toPcm16(float sample) {
        float s = Math.max(-1f, Math.min(1f, sample));
        return (short) (s < 0 ? Math.round(s * 0x8000) : Math.round(s * 0x7FFF));
    }

    private static void writeAscii(ByteArrayOutputStream os, String tag) {
        for (int i = 0; i < tag.length(); i++) {
            os.write(tag.charAt(i));
        }
    }

    private static void writeLEShort(ByteArrayOutputStream os, int v) {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(ByteArrayOutputStream os, int v) {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
