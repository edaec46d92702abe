package com.phillippitts.livescribe.service.worker;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks real-time factor (audio seconds per wall-clock second) for the worker.
 *
 * <p>Written by the worker thread only; readable from any thread. A degraded streak begins when the
 * running average drops below 1.0 and is reported once after {@code window} consecutive chunks.
 */
final class RealTimeFactorTracker {

    private final int window;
    private final AtomicLong audioMicros = new AtomicLong();
    private final AtomicLong wallMicros = new AtomicLong();
    private int slowStreak;
    private boolean streakReported;

    RealTimeFactorTracker(int window) {
        this.window = Math.max(1, window);
    }

    /**
     * Records one recognition.
     *
     * @return per-chunk RTF ({@link Double#POSITIVE_INFINITY} when wall time rounds to zero)
     */
    double record(double audioSeconds, long wallNanos) {
        long audio = Math.round(audioSeconds * 1_000_000.0);
        long wall = Math.max(0, wallNanos / 1_000);
        audioMicros.addAndGet(audio);
        wallMicros.addAndGet(wall);
        if (average() < 1.0) {
            slowStreak++;
        } else {
            slowStreak = 0;
            streakReported = false;
        }
        return wall == 0 ? Double.POSITIVE_INFINITY : (double) audio / wall;
    }

    /**
     * True exactly once per slow streak, when it reaches the window length.
     */
    boolean shouldReportDegraded() {
        if (!streakReported && slowStreak >= window) {
            streakReported = true;
            return true;
        }
        return false;
    }

    int slowStreak() {
        return slowStreak;
    }

    /** Running RTF over every recorded chunk, or 0 before the first. */
    double average() {
        long wall = wallMicros.get();
        if (wall == 0) {
            return audioMicros.get() == 0 ? 0.0 : Double.POSITIVE_INFINITY;
        }
        return (double) audioMicros.get() / wall;
    }
}
