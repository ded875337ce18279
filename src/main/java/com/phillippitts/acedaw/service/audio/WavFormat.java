package com.phillippitts.acedaw.service.audio;

/**
 * Constants for WAV (RIFF/WAVE) container parsing and writing.
 *
 * <p><b>WAV File Structure:</b>
 * <pre>
 * ┌─────────────────────────────────────┐
 * │ RIFF Header (12 bytes)              │  RIFF_HEADER_SIZE
 * ├─────────────────────────────────────┤
 * │ fmt chunk:                          │
 * │   - Chunk ID + Size (8 bytes)       │  CHUNK_HEADER_SIZE
 * │   - Chunk Data (≥16 bytes)          │  FMT_CHUNK_MIN_SIZE
 * ├─────────────────────────────────────┤
 * │ other chunks (LIST, fact, ...)      │  skipped
 * ├─────────────────────────────────────┤
 * │ data chunk:                         │
 * │   - Chunk ID + Size (8 bytes)       │  CHUNK_HEADER_SIZE
 * │   - Interleaved samples (variable)  │
 * └─────────────────────────────────────┘
 * </pre>
 *
 * @see WavDecoder
 * @see WavEncoder
 * @since 1.0
 */
public final class WavFormat {

    /** "RIFF" + file size - 8 + "WAVE". */
    public static final int RIFF_HEADER_SIZE = 12;

    /** 4-character chunk ID + little-endian uint32 chunk size. */
    public static final int CHUNK_HEADER_SIZE = 8;

    /** Size of a plain PCM fmt chunk; extended forms are larger. */
    public static final int FMT_CHUNK_MIN_SIZE = 16;

    /** Size of the canonical header written by {@link WavEncoder}. */
    public static final int CANONICAL_HEADER_SIZE = 44;

    /** fmt format tag: integer PCM. */
    public static final int AUDIO_FORMAT_PCM = 1;

    /** fmt format tag: IEEE 754 float. */
    public static final int AUDIO_FORMAT_IEEE_FLOAT = 3;

    /** fmt format tag: WAVE_FORMAT_EXTENSIBLE; the real tag is the first 2 bytes of the sub-format GUID. */
    public static final int AUDIO_FORMAT_EXTENSIBLE = 0xFFFE;

    /** Offset of the sub-format GUID inside an extensible fmt chunk. */
    public static final int EXTENSIBLE_SUBFORMAT_OFFSET = 24;

    private WavFormat() {
        // Utility class - prevent instantiation
    }
}
