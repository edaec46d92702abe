package com.phillippitts.livescribe.service.audio;

/**
 * Single source of truth for the canonical pipeline audio format.
 * Canonical: 16 kHz, 16-bit signed PCM, mono, little-endian.
 */
public final class AudioFormat {

    /** Canonical sample rate in Hz. */
    public static final int CANONICAL_SAMPLE_RATE = 16_000;
    /** Bits per sample. */
    public static final int BITS_PER_SAMPLE = 16;
    /** Number of channels (mono). */
    public static final int CHANNELS = 1;
    /** Bytes per PCM frame. */
    public static final int BLOCK_ALIGN = (BITS_PER_SAMPLE / 8) * CHANNELS; // 2 bytes
    /** Bytes per second at the canonical rate. */
    public static final int CANONICAL_BYTE_RATE = CANONICAL_SAMPLE_RATE * BLOCK_ALIGN; // 32,000

    /** ffmpeg raw output format matching the canonical format. */
    public static final String FFMPEG_RAW_FORMAT = "s16le";
    /** ffmpeg codec name matching the canonical format. */
    public static final String FFMPEG_PCM_CODEC = "pcm_s16le";

    // WAV header layout (PCM simple header)
    public static final int WAV_HEADER_SIZE = 44;
    public static final int WAV_CHANNELS_OFFSET = 22;            // 2 bytes (LE)
    public static final int WAV_SAMPLE_RATE_OFFSET = 24;         // 4 bytes (LE)
    public static final int WAV_BYTE_RATE_OFFSET = 28;           // 4 bytes (LE)
    public static final int WAV_BLOCK_ALIGN_OFFSET = 32;         // 2 bytes (LE)
    public static final int WAV_BITS_PER_SAMPLE_OFFSET = 34;     // 2 bytes (LE)
    public static final int WAV_DATA_SIZE_OFFSET = 40;           // 4 bytes (LE)

    /** Full-scale magnitude of a 16-bit sample, used to normalize to [-1, 1]. */
    public static final double SAMPLE_FULL_SCALE = 32768.0;

    private AudioFormat() {}

    /**
     * Number of samples covering {@code seconds} at {@code sampleRate}, rounded to nearest.
     */
    public static int samplesFor(double seconds, int sampleRate) {
        return (int) Math.round(seconds * sampleRate);
    }

    /**
     * Playback length of a canonical WAV file of {@code fileBytes} bytes with a simple 44-byte header.
     */
    public static double canonicalWavSeconds(long fileBytes) {
        long data = Math.max(0L, fileBytes - WAV_HEADER_SIZE);
        return (double) data / CANONICAL_BYTE_RATE;
    }
}
