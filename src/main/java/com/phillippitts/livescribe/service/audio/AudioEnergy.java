package com.phillippitts.livescribe.service.audio;

/**
 * Energy measures over 16-bit PCM used for near-silence detection.
 *
 * <p>Samples are normalized to [-1, 1] before squaring so thresholds are independent of bit depth;
 * a threshold of {@code 1e-6} mean-square corresponds to roughly -60 dBFS.
 */
public final class AudioEnergy {

    private AudioEnergy() {
        // Utility class
    }

    /**
     * Mean of squared normalized samples. Returns 0 for an empty buffer.
     */
    public static double meanSquare(short[] samples) {
        if (samples == null || samples.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (short s : samples) {
            double x = s / AudioFormat.SAMPLE_FULL_SCALE;
            sum += x * x;
        }
        return sum / samples.length;
    }

    /**
     * Root-mean-square amplitude in normalized units (0..1).
     */
    public static double rms(short[] samples) {
        return Math.sqrt(meanSquare(samples));
    }

    /**
     * True when the buffer's mean-square energy is strictly below {@code threshold}.
     */
    public static boolean isNearSilent(short[] samples, double threshold) {
        return meanSquare(samples) < threshold;
    }
}
