package com.phillippitts.livescribe.util;

import java.time.Duration;

/**
 * Standard timeout values for one-shot external processes.
 *
 * <p>Used by {@link com.phillippitts.livescribe.service.process.ProcessRunner} and
 * {@link com.phillippitts.livescribe.service.process.ProcessTerminator}.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Time for stream gobbler threads to flush buffered output after a one-shot process exits.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Best-effort gobbler join during cleanup. Gobblers are daemon threads.
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Graceful shutdown window for one-shot processes (recognizer, diarizer, converter)
     * before {@link Process#destroyForcibly()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Deadline after {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
