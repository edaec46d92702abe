package com.phillippitts.livescribe.service.process;

import com.phillippitts.livescribe.exception.RecognitionException;
import com.phillippitts.livescribe.exception.RecognitionExceptionBuilder;
import com.phillippitts.livescribe.util.ProcessTimeouts;
import com.phillippitts.livescribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs a one-shot external tool (whisper.cpp, the diarizer, the ffmpeg converter) to completion.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Start the process via {@link ProcessFactory}</li>
 *   <li>Capture stdout and stderr concurrently on daemon gobbler threads</li>
 *   <li>Enforce a timeout and terminate runaway processes</li>
 *   <li>Fail a run whose stdout overflowed its cap rather than return a truncated document</li>
 *   <li>Report failures as {@link RecognitionException} with exit code, duration and stderr context</li>
 * </ul>
 *
 * <p>Each {@link #run} call owns its own process and gobblers, so one runner may be shared by
 * concurrent callers.
 */
public final class ProcessRunner {

    private static final Logger LOG = LogManager.getLogger(ProcessRunner.class);

    /** Cap for captured stderr; diagnostics only. */
    static final int STDERR_MAX_BYTES = 64 * 1024;

    /** Max stderr characters copied into exception messages. */
    static final int ERROR_SNIPPET_MAX_CHARS = 500;

    private final ProcessFactory processFactory;

    public ProcessRunner() {
        this(new DefaultProcessFactory());
    }

    public ProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    public ProcessFactory processFactory() {
        return processFactory;
    }

    /**
     * Runs the command and waits for it to finish.
     *
     * @param command full command line
     * @param workingDir working directory (may be null)
     * @param timeout maximum wall-clock time
     * @param maxStdoutBytes stdout accumulation cap
     * @param toolName name used in logs and exceptions (e.g. "whisper", "ffmpeg")
     * @return captured output of a zero-exit run
     * @throws RecognitionException on timeout, non-zero exit, stdout past the cap, or I/O failure
     */
    public ProcessOutput run(List<String> command, Path workingDir, Duration timeout,
                             int maxStdoutBytes, String toolName) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }

        long startNanos = System.nanoTime();
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process = null;
        Thread outGobbler = null;
        Thread errGobbler = null;
        try {
            process = processFactory.start(command, workingDir);
            // Start gobblers before waiting to avoid pipe-buffer deadlock
            StreamGobbler outReader = new StreamGobbler(process.getInputStream(), stdout, toolName + "-out",
                    maxStdoutBytes);
            outGobbler = startGobbler(outReader);
            errGobbler = startGobbler(new StreamGobbler(process.getErrorStream(), stderr, toolName + "-err",
                    STDERR_MAX_BYTES));

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                ProcessTerminator.terminate(process, ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT);
                throw failure("Timeout after " + timeout.toSeconds() + "s", toolName, command,
                        -1, stderr, startNanos, null);
            }

            ProcessTerminator.joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            ProcessTerminator.joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw failure("Non-zero exit: " + exitCode, toolName, command, exitCode, stderr, startNanos, null);
            }
            if (outReader.capReached()) {
                throw failure("stdout exceeded " + maxStdoutBytes + " byte cap", toolName, command,
                        exitCode, stderr, startNanos, null);
            }
            long durationMs = TimeUtils.elapsedMillis(startNanos);
            LOG.debug("{} finished in {} ms (stdout={} chars)", toolName, durationMs, stdout.length());
            return new ProcessOutput(snapshot(stdout), snapshot(stderr), exitCode, durationMs);
        } catch (IOException e) {
            throw failure("I/O failure: " + e.getMessage(), toolName, command, -1, stderr, startNanos, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("Interrupted", toolName, command, -1, stderr, startNanos, e);
        } finally {
            if (process != null && process.isAlive()) {
                ProcessTerminator.terminate(process, ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT);
            }
            ProcessTerminator.joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
            ProcessTerminator.joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        }
    }

    private static String snapshot(StringBuilder sb) {
        synchronized (sb) {
            return sb.toString();
        }
    }

    private static Thread startGobbler(StreamGobbler gobbler) {
        Thread thread = new Thread(gobbler, gobbler.name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static RecognitionException failure(String msg, String toolName, List<String> command,
                                                int exitCode, StringBuilder stderr, long startNanos,
                                                Throwable cause) {
        String stderrText = snapshot(stderr);
        String snippet = stderrText.substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, stderrText.length()));
        RecognitionExceptionBuilder builder = RecognitionExceptionBuilder.create(msg)
                .engine(toolName)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNanos))
                .metadata("binary", command.get(0))
                .metadata("stderr", snippet);
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }

    /**
     * Reads lines into a capped sink. Past the cap the stream keeps draining so the child
     * never blocks on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;
        private volatile boolean capReached;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        boolean capReached() {
            return capReached;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (sink.length() > 0) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        if (line.length() > available) {
                            sink.append(line, 0, Math.max(0, available));
                            capReached = true;
                            LOG.warn("Stream '{}' reached {}B cap (truncated line)", name, maxBytes);
                        } else {
                            sink.append(line);
                        }
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }
}
