package com.phillippitts.livescribe.util;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /** Number of nanoseconds in one millisecond. */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    /** Number of nanoseconds in one second. */
    public static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    public static double nanosToSeconds(long nanos) {
        return nanos / NANOS_PER_SECOND;
    }

    /**
     * Calculates elapsed milliseconds since a {@link System#nanoTime()} timestamp.
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Converts non-negative fractional seconds to whole milliseconds, truncating.
     * A tiny epsilon absorbs binary representation error (2.3s must give 2300ms, not 2299ms).
     */
    public static long secondsToMillis(double seconds) {
        return (long) Math.floor(seconds * 1000.0 + 1e-6);
    }
}
