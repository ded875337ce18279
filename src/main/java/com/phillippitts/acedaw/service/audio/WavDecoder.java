package com.phillippitts.acedaw.service.audio;

import com.phillippitts.acedaw.exception.InvalidAudioException;

import java.nio.charset.StandardCharsets;

/**
 * Decodes WAV payloads into {@link SampleBuffer}s.
 *
 * <p>Walks the chunk list to locate {@code fmt } and {@code data}, skipping anything else
 * (LIST, fact, ...) and honouring RIFF's even-byte padding. Supported encodings: 16-bit integer
 * PCM and 32-bit IEEE float, plain or in WAVE_FORMAT_EXTENSIBLE form, any channel count.
 */
public final class WavDecoder {

    private WavDecoder() {}

    /**
     * @param wav complete WAV file bytes
     * @return decoded samples, de-interleaved per channel
     * @throws InvalidAudioException if the container is malformed or the encoding unsupported
     */
    public static SampleBuffer decode(byte[] wav) {
        if (wav == null) {
            throw new InvalidAudioException("Audio data is null");
        }
        if (!isWav(wav)) {
            throw new InvalidAudioException(wav.length, "Not a RIFF/WAVE container");
        }

        WavChunks chunks = parseWavChunks(wav);
        requireChunk(wav, chunks.fmtOffset, "fmt");
        requireChunk(wav, chunks.dataOffset, "data");

        if (chunks.fmtSize < WavFormat.FMT_CHUNK_MIN_SIZE) {
            throw new InvalidAudioException(wav.length, "fmt chunk too small: " + chunks.fmtSize
                    + " bytes (expected at least " + WavFormat.FMT_CHUNK_MIN_SIZE + ")");
        }
        int fmt = chunks.fmtOffset;
        int audioFormat = readLEShort(wav, fmt);         // 2 bytes: format tag
        int channels = readLEShort(wav, fmt + 2);        // 2 bytes: number of channels
        int sampleRate = readLEInt(wav, fmt + 4);        // 4 bytes: sample rate
        int blockAlign = readLEShort(wav, fmt + 12);     // 2 bytes: block align
        int bitsPerSample = readLEShort(wav, fmt + 14);  // 2 bytes: bits per sample

        if (audioFormat == WavFormat.AUDIO_FORMAT_EXTENSIBLE
                && chunks.fmtSize >= WavFormat.EXTENSIBLE_SUBFORMAT_OFFSET + 2) {
            audioFormat = readLEShort(wav, fmt + WavFormat.EXTENSIBLE_SUBFORMAT_OFFSET);
        }

        SampleReader reader = readerFor(wav.length, audioFormat, bitsPerSample);
        if (channels <= 0) {
            throw new InvalidAudioException(wav.length, "Invalid channel count: " + channels);
        }
        if (sampleRate <= 0) {
            throw new InvalidAudioException(wav.length, "Invalid sample rate: " + sampleRate);
        }
        int bytesPerSample = bitsPerSample / 8;
        if (blockAlign != channels * bytesPerSample) {
            throw new InvalidAudioException(wav.length, "Invalid block align: " + blockAlign
                    + ". Expected: " + (channels * bytesPerSample));
        }

        int frames = chunks.dataSize / blockAlign;
        float[][] samples = new float[channels][frames];
        int pos = chunks.dataOffset;
        for (int i = 0; i < frames; i++) {
            for (int c = 0; c < channels; c++) {
                samples[c][i] = reader.read(wav, pos);
                pos += bytesPerSample;
            }
        }
        return new SampleBuffer(sampleRate, samples);
    }

    /**
     * @return true if the bytes start with a RIFF/WAVE header
     */
    public static boolean isWav(byte[] a) {
        return a != null && a.length >= WavFormat.RIFF_HEADER_SIZE
            && a[0] == 'R' && a[1] == 'I' && a[2] == 'F' && a[3] == 'F'
            && a[8] == 'W' && a[9] == 'A' && a[10] == 'V' && a[11] == 'E';
    }

    @FunctionalInterface
    private interface SampleReader {
        float read(byte[] wav, int offset);
    }

    private static SampleReader readerFor(int size, int audioFormat, int bitsPerSample) {
        if (audioFormat == WavFormat.AUDIO_FORMAT_PCM && bitsPerSample == 16) {
            return (wav, off) -> ((short) readLEShort(wav, off)) / 32768f;
        }
        if (audioFormat == WavFormat.AUDIO_FORMAT_IEEE_FLOAT && bitsPerSample == 32) {
            return (wav, off) -> Float.intBitsToFloat(readLEInt(wav, off));
        }
        throw new InvalidAudioException(size, "Unsupported encoding: format " + audioFormat
                + ", " + bitsPerSample + "-bit (expected 16-bit PCM or 32-bit float)");
    }

    private static void requireChunk(byte[] wav, int offset, String chunkName) {
        if (offset == -1) {
            throw new InvalidAudioException(wav.length, "Missing " + chunkName + " chunk in WAV file");
        }
    }

    private static WavChunks parseWavChunks(byte[] wav) {
        int offset = WavFormat.RIFF_HEADER_SIZE;
        int fmtOffset = -1;
        int fmtSize = 0;
        int dataOffset = -1;
        int dataSize = 0;

        while (offset + WavFormat.CHUNK_HEADER_SIZE <= wav.length) {
            String chunkId = readChunkId(wav, offset);
            long chunkSize = Integer.toUnsignedLong(readLEInt(wav, offset + 4));

            if (offset + WavFormat.CHUNK_HEADER_SIZE + chunkSize > wav.length) {
                throw new InvalidAudioException(wav.length, "Invalid chunk size: " + chunkSize
                        + " at offset " + offset);
            }

            if ("fmt ".equals(chunkId)) {
                fmtOffset = offset + WavFormat.CHUNK_HEADER_SIZE;
                fmtSize = (int) chunkSize;
            } else if ("data".equals(chunkId)) {
                dataOffset = offset + WavFormat.CHUNK_HEADER_SIZE;
                dataSize = (int) chunkSize;
            }
            if (fmtOffset != -1 && dataOffset != -1) {
                break;
            }

            offset += WavFormat.CHUNK_HEADER_SIZE + (int) chunkSize;
            if (chunkSize % 2 == 1) {
                offset++; // chunks are padded to even byte boundaries
            }
        }
        return new WavChunks(fmtOffset, fmtSize, dataOffset, dataSize);
    }

    private static String readChunkId(byte[] wav, int offset) {
        return new String(new byte[]{wav[offset], wav[offset + 1], wav[offset + 2], wav[offset + 3]},
                StandardCharsets.US_ASCII);
    }

    private static final class WavChunks {
        final int fmtOffset;
        final int fmtSize;
        final int dataOffset;
        final int dataSize;

        WavChunks(int fmtOffset, int fmtSize, int dataOffset, int dataSize) {
            this.fmtOffset = fmtOffset;
            this.fmtSize = fmtSize;
            this.dataOffset = dataOffset;
            this.dataSize = dataSize;
        }
    }

    private static int readLEShort(byte[] a, int off) {
        return (a[off] & 0xFF) | ((a[off + 1] & 0xFF) << 8);
    }

    private static int readLEInt(byte[] a, int off) {
        return (a[off] & 0xFF)
             | ((a[off + 1] & 0xFF) << 8)
             | ((a[off + 2] & 0xFF) << 16)
             | ((a[off + 3] & 0xFF) << 24);
    }
}
