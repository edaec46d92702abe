package com.phillippitts.livescribe.testutil;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Synthetic 16-bit mono audio for pipeline tests.
 */
public final class AudioFixtures {

    public static final int SAMPLE_RATE = 16_000;
    private static final double TONE_HZ = 440.0;
    private static final double AMPLITUDE = 8000.0;

    private AudioFixtures() {}

    /** A 440 Hz tone, loud enough to pass the silence filter. */
    public static short[] tone(double seconds) {
        int n = (int) Math.round(seconds * SAMPLE_RATE);
        short[] samples = new short[n];
        for (int i = 0; i < n; i++) {
            samples[i] = (short) Math.round(AMPLITUDE * Math.sin(2 * Math.PI * TONE_HZ * i / SAMPLE_RATE));
        }
        return samples;
    }

    public static short[] silence(double seconds) {
        return new short[(int) Math.round(seconds * SAMPLE_RATE)];
    }

    /** Little-endian PCM bytes, as ffmpeg writes them for s16le. */
    public static byte[] pcm(short[] samples) {
        ByteBuffer buf = ByteBuffer.allocate(samples.length * 2).order(ByteOrder.LITTLE_ENDIAN);
        for (short s : samples) {
            buf.putShort(s);
        }
        return buf.array();
    }

    public static byte[] tonePcm(double seconds) {
        return pcm(tone(seconds));
    }
}
