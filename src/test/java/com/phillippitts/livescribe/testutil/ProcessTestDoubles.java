package com.phillippitts.livescribe.testutil;

import com.phillippitts.livescribe.service.process.ProcessFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.SequenceInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Shared test doubles for external process management (ffmpeg, whisper.cpp, the diarizer).
 * Provides fake Process implementations for hermetic testing without real binaries.
 */
public final class ProcessTestDoubles {

    private ProcessTestDoubles() {}

    /**
     * Encapsulates test process behavior configuration.
     *
     * @param stdout stdout bytes to return
     * @param stderr stderr content to return
     * @param exitCode process exit code
     * @param finishAfterMillis delay before process finishes (-1 means never finish on its own)
     * @param streaming if true, stdout blocks after its bytes until the process is destroyed
     */
    public record ProcessBehavior(byte[] stdout, String stderr, int exitCode, long finishAfterMillis,
                                  boolean streaming) {

        public static ProcessBehavior text(String stdout, String stderr, int exitCode, long finishAfterMillis) {
            return new ProcessBehavior(stdout.getBytes(StandardCharsets.UTF_8), stderr, exitCode,
                    finishAfterMillis, false);
        }

        public static ProcessBehavior pcm(byte[] pcm, int exitCode) {
            return new ProcessBehavior(pcm, "", exitCode, 0, false);
        }

        public static ProcessBehavior live(byte[] pcm) {
            return new ProcessBehavior(pcm, "", 0, -1, true);
        }
    }

    /**
     * ProcessFactory that hands out fake processes and records every command line it was given.
     */
    public static final class StubProcessFactory implements ProcessFactory {
        private final Supplier<Process> processes;
        private final IOException failure;
        private final List<List<String>> commands = new CopyOnWriteArrayList<>();

        public StubProcessFactory(Process p) {
            this(() -> p, null);
        }

        public StubProcessFactory(Supplier<Process> processes) {
            this(processes, null);
        }

        private StubProcessFactory(Supplier<Process> processes, IOException failure) {
            this.processes = processes;
            this.failure = failure;
        }

        public static StubProcessFactory failing(String message) {
            return new StubProcessFactory(null, new IOException(message));
        }

        @Override
        public Process start(List<String> command, Path workingDir) throws IOException {
            commands.add(List.copyOf(command));
            if (failure != null) {
                throw failure;
            }
            return processes.get();
        }

        public List<List<String>> commands() {
            return List.copyOf(commands);
        }

        public List<String> lastCommand() {
            return commands.isEmpty() ? List.of() : commands.get(commands.size() - 1);
        }
    }

    /**
     * Minimal fake Process that allows controlling stdout/stderr, exit code, and termination timing.
     */
    public static final class TestProcess extends Process {
        private final int exitCode;
        private final CountDownLatch exited = new CountDownLatch(1);
        private final CountDownLatch released = new CountDownLatch(1);
        private final InputStream stdout;
        private final InputStream stderr;
        private volatile boolean destroyCalled = false;

        public TestProcess(ProcessBehavior behavior) {
            this.exitCode = behavior.exitCode();
            InputStream bytes = new ByteArrayInputStream(behavior.stdout());
            this.stdout = behavior.streaming() ? new SequenceInputStream(bytes, new HeldOpenStream()) : bytes;
            this.stderr = new ByteArrayInputStream(behavior.stderr().getBytes(StandardCharsets.UTF_8));

            long finishAfterMillis = behavior.finishAfterMillis();
            if (finishAfterMillis == 0) {
                exited.countDown();
            } else if (finishAfterMillis > 0) {
                Thread finisher = new Thread(() -> {
                    try {
                        Thread.sleep(finishAfterMillis);
                        exited.countDown();
                    } catch (InterruptedException ignored) {
                        Thread.currentThread().interrupt();
                    }
                }, "test-proc-finisher");
                finisher.setDaemon(true);
                finisher.start();
            }
        }

        public boolean wasDestroyCalled() {
            return destroyCalled;
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return stdout;
        }

        @Override
        public InputStream getErrorStream() {
            return stderr;
        }

        @Override
        public int waitFor() throws InterruptedException {
            exited.await();
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            return exited.await(timeout, unit);
        }

        @Override
        public int exitValue() {
            if (exited.getCount() > 0) {
                throw new IllegalThreadStateException("process has not exited");
            }
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyCalled = true;
            released.countDown();
            exited.countDown();
        }

        @Override
        public Process destroyForcibly() {
            destroy();
            return this;
        }

        @Override
        public boolean isAlive() {
            return exited.getCount() > 0;
        }

        /** Blocks readers until the process is destroyed, then reports end of stream. */
        private final class HeldOpenStream extends InputStream {
            @Override
            public int read() throws IOException {
                try {
                    released.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrupted", e);
                }
                return -1;
            }

            @Override
            public int read(byte[] b, int off, int len) throws IOException {
                return read();
            }
        }
    }
}
