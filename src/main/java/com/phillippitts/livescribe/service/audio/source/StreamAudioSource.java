package com.phillippitts.livescribe.service.audio.source;

import com.phillippitts.livescribe.config.properties.StreamProperties;
import com.phillippitts.livescribe.domain.AudioChunk;
import com.phillippitts.livescribe.exception.SourceUnavailableException;
import com.phillippitts.livescribe.service.audio.AudioChunker;
import com.phillippitts.livescribe.service.process.ProcessFactory;
import com.phillippitts.livescribe.service.process.ProcessTerminator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pull-model audio source backed by an ffmpeg decode process.
 *
 * <p>A daemon thread named {@code audio-decode} reads raw PCM from ffmpeg's stdout, feeds it to an
 * {@link AudioChunker}, and hands completed chunks to the {@link AudioSourceListener}. Each chunk
 * is stamped {@code chunkIndex * chunkSeconds}.
 *
 * <p>The stream ends on EOF, on an unexpected process exit, or on {@link #stop()}. The listener
 * receives {@link AudioSourceListener#onEnd()} exactly once in every case.
 *
 * <p>One instance drives one stream; it cannot be restarted.
 */
public class StreamAudioSource implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(StreamAudioSource.class);

    private final String locator;
    private final StreamProperties props;
    private final ProcessFactory processFactory;
    private final ApplicationEventPublisher publisher;
    private final AudioChunker chunker;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean endSignalled = new AtomicBoolean(false);
    private final AtomicLong bytesRead = new AtomicLong();

    private volatile Process process;
    private volatile Thread decodeThread;

    public StreamAudioSource(String locator,
                             StreamProperties props,
                             ProcessFactory processFactory,
                             ApplicationEventPublisher publisher) {
        this.locator = Objects.requireNonNull(locator, "locator");
        this.props = Objects.requireNonNull(props, "props");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.publisher = publisher;
        this.chunker = new AudioChunker(props.sampleRate(), props.chunkSeconds(),
                props.overlapBufferSeconds(), props.minTailSeconds());
    }

    /**
     * Starts the decode process and the reader thread.
     *
     * @throws SourceUnavailableException if ffmpeg cannot be started
     * @throws IllegalStateException if called twice
     */
    public void start(AudioSourceListener listener) {
        Objects.requireNonNull(listener, "listener");
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Source already started");
        }
        List<String> command = FfmpegCommands.decodeToStdout(props.ffmpegPath(), locator,
                props.sampleRate(), props.realtime());
        Process p;
        try {
            p = processFactory.start(command, null);
        } catch (IOException e) {
            publish("DECODER_START_FAILED");
            throw new SourceUnavailableException("Failed to start decoder: " + e.getMessage(), locator, e);
        }
        this.process = p;
        running.set(true);
        startStderrDrain(p);

        Map<String, String> context = ThreadContext.getImmutableContext();
        Thread t = new Thread(() -> {
            if (context != null && !context.isEmpty()) {
                ThreadContext.putAll(context);
            }
            try {
                decodeLoop(p, listener);
            } finally {
                ThreadContext.clearAll();
            }
        }, "audio-decode");
        t.setDaemon(true);
        decodeThread = t;
        t.start();
        LOG.info("Decode started: chunk={}s, rate={}Hz, realtime={}",
                props.chunkSeconds(), props.sampleRate(), props.realtime());
    }

    /**
     * Stops the stream. Safe from any thread, idempotent.
     *
     * <p>Order: clear the running flag, ask ffmpeg to exit and wait {@code terminate-timeout},
     * force-kill and wait again, then join the decode thread.
     */
    public void stop() {
        if (!stopRequested.compareAndSet(false, true)) {
            return;
        }
        running.set(false);
        ProcessTerminator.terminate(process, props.terminateTimeout());
        Thread t = decodeThread;
        if (t != null && t != Thread.currentThread()) {
            if (!ProcessTerminator.joinQuietly(t, props.threadJoinTimeout())) {
                LOG.warn("Decode thread did not terminate within {}ms", props.threadJoinTimeout().toMillis());
            }
        }
        LOG.info("Decode stopped after {} bytes ({} chunks)", bytesRead.get(), chunker.chunksEmitted());
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    public long bytesRead() {
        return bytesRead.get();
    }

    public long chunksEmitted() {
        return chunker.chunksEmitted();
    }

    /** Most recent {@code seconds} of decoded audio, for callers that want chunk overlap. */
    public short[] lastSeconds(double seconds) {
        return chunker.lastSeconds(seconds);
    }

    public String locator() {
        return locator;
    }

    private void decodeLoop(Process p, AudioSourceListener listener) {
        byte[] buf = new byte[props.readBufferBytes()];
        try (InputStream in = p.getInputStream()) {
            while (running.get()) {
                int n = in.read(buf);
                if (n < 0) {
                    LOG.debug("Decoder reached end of stream");
                    break;
                }
                if (n == 0) {
                    continue;
                }
                bytesRead.addAndGet(n);
                for (AudioChunk chunk : chunker.accept(buf, 0, n)) {
                    deliver(listener, chunk);
                }
            }
            Optional<AudioChunk> tail = chunker.flush();
            tail.ifPresent(chunk -> deliver(listener, chunk));
        } catch (IOException e) {
            if (running.get()) {
                LOG.warn("Decoder read failed: {}", e.toString());
            } else {
                LOG.debug("Decoder stream closed during stop: {}", e.toString());
            }
        } finally {
            running.set(false);
            checkExit(p, listener);
            signalEnd(listener);
        }
    }

    private void checkExit(Process p, AudioSourceListener listener) {
        if (stopRequested.get()) {
            return;
        }
        try {
            if (!p.waitFor(props.terminateTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Decoder still running after its output closed; terminating");
                ProcessTerminator.terminate(p, props.terminateTimeout());
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        int exit = p.exitValue();
        if (exit != 0 && bytesRead.get() == 0) {
            LOG.warn("Decoder exited with code {} before producing audio", exit);
            publish("DECODER_EXITED");
            try {
                listener.onError(new SourceUnavailableException(
                        "Decoder exited with code " + exit + " before producing audio", locator));
            } catch (RuntimeException e) {
                LOG.warn("Source listener failed handling error: {}", e.toString());
            }
        } else if (exit != 0) {
            LOG.info("Decoder exited with code {} after {} bytes", exit, bytesRead.get());
        }
    }

    private void deliver(AudioSourceListener listener, AudioChunk chunk) {
        try {
            listener.onChunk(chunk);
        } catch (RuntimeException e) {
            LOG.warn("Source listener failed for chunk at {}s: {}", chunk.startTime(), e.toString());
        }
    }

    private void signalEnd(AudioSourceListener listener) {
        if (endSignalled.compareAndSet(false, true)) {
            try {
                listener.onEnd();
            } catch (RuntimeException e) {
                LOG.warn("Source listener failed at end of stream: {}", e.toString());
            }
        }
    }

    private void publish(String reason) {
        if (publisher != null) {
            publisher.publishEvent(new SourceErrorEvent(reason, locator, Instant.now()));
        }
    }

    private static void startStderrDrain(Process p) {
        Thread t = new Thread(() -> {
            try (BufferedReader br = new BufferedReader(
                    new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = br.readLine()) != null) {
                    LOG.debug("ffmpeg: {}", line);
                }
            } catch (IOException e) {
                LOG.debug("ffmpeg stderr closed: {}", e.toString());
            }
        }, "audio-decode-err");
        t.setDaemon(true);
        t.start();
    }
}
