package com.phillippitts.livescribe.service.process;

import com.phillippitts.livescribe.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Two-phase process termination: {@link Process#destroy()}, wait, then
 * {@link Process#destroyForcibly()}, wait again.
 */
public final class ProcessTerminator {

    private static final Logger LOG = LogManager.getLogger(ProcessTerminator.class);

    private ProcessTerminator() {}

    /**
     * Terminates the process, escalating to a forced kill when it outlives {@code graceful}.
     *
     * @param process process to stop (null or already-dead processes are ignored)
     * @param graceful how long to wait after the polite terminate request
     * @return true if the process is no longer alive
     */
    public static boolean terminate(Process process, Duration graceful) {
        if (process == null) {
            return true;
        }
        try {
            process.destroy();
            boolean exited = process.waitFor(graceful.toMillis(), TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                LOG.debug("Process did not exit within {} ms; forcing", graceful.toMillis());
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                    return false;
                }
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
            process.destroyForcibly();
            return !process.isAlive();
        } catch (RuntimeException e) {
            LOG.warn("Error destroying process: {}", e.toString());
            return !process.isAlive();
        }
    }

    /**
     * Joins a thread for at most {@code timeout}, preserving the interrupt flag.
     *
     * @return true if the thread is no longer alive
     */
    public static boolean joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return true;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !thread.isAlive();
    }
}
