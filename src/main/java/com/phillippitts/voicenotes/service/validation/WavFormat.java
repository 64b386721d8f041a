package com.phillippitts.voicenotes.service.validation;

/**
 * Structural constants of the RIFF/WAVE container, used by {@link WavDurationProbe}.
 *
 * <pre>
 * RIFF header (12 bytes)        RIFF_HEADER_SIZE
 * chunk: id + size (8 bytes)    CHUNK_HEADER_SIZE
 *   fmt data (at least 16)      FMT_CHUNK_MIN_SIZE
 * chunk: "data" + size, then sample data
 * </pre>
 */
final class WavFormat {

    /** "RIFF" + file size + "WAVE". */
    static final int RIFF_HEADER_SIZE = 12;

    /** 4-character chunk id followed by a little-endian uint32 size. */
    static final int CHUNK_HEADER_SIZE = 8;

    /** Minimum fmt chunk: format, channels, sample rate, byte rate, block align, bits per sample. */
    static final int FMT_CHUNK_MIN_SIZE = 16;

    /** Offset of the byte-rate field inside the fmt chunk data. */
    static final int FMT_BYTE_RATE_OFFSET = 8;

    private WavFormat() {
        // Utility class - prevent instantiation
    }
}
