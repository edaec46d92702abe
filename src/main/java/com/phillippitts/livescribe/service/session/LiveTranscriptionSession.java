package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.domain.AudioChunk;
import com.phillippitts.livescribe.domain.Transcript;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import com.phillippitts.livescribe.exception.LiveScribeException;
import com.phillippitts.livescribe.exception.SourceUnavailableException;
import com.phillippitts.livescribe.service.audio.source.AudioSourceListener;
import com.phillippitts.livescribe.service.audio.source.StreamAudioSource;
import com.phillippitts.livescribe.service.transcript.TranscriptAssembler;
import com.phillippitts.livescribe.service.transcript.TranscriptFiles;
import com.phillippitts.livescribe.service.transcript.TranscriptWriter;
import com.phillippitts.livescribe.service.worker.RecognitionWorker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.CloseableThreadContext;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One live transcription run: decode source, recognition worker and rolling transcript.
 *
 * <p>The decode thread feeds chunks to the worker; the caller's thread pulls segments with
 * {@link #tryGetResult()} or {@link #poll()}, which also appends them to the assembler. Stopping
 * the session, or a terminal source error followed by {@link #stop()}, always flushes whatever was
 * recognized into a {@link Transcript} and persists it once.
 *
 * <p>The session id is logged as {@code sessionId}. It is scoped to {@link #start()} and
 * {@link #stop()} on the calling thread, whose context is restored when they return, and copied
 * into the worker and decode threads for their lifetime.
 */
public class LiveTranscriptionSession implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(LiveTranscriptionSession.class);

    static final String MDC_SESSION_ID = "sessionId";

    private final String sessionId;
    private final StreamAudioSource source;
    private final RecognitionWorker worker;
    private final TranscriptAssembler assembler;
    private final TranscriptWriter writer;
    private final String provider;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final CountDownLatch ended = new CountDownLatch(1);
    private volatile LiveScribeException terminalError;
    private volatile Transcript transcript;
    private volatile TranscriptFiles files;

    public LiveTranscriptionSession(String sessionId,
                                    StreamAudioSource source,
                                    RecognitionWorker worker,
                                    TranscriptAssembler assembler,
                                    TranscriptWriter writer,
                                    String provider) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.source = Objects.requireNonNull(source, "source");
        this.worker = Objects.requireNonNull(worker, "worker");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
        this.writer = writer;
        this.provider = provider;
    }

    /**
     * Starts the worker, then the decode source.
     *
     * @throws SourceUnavailableException if the decoder cannot be started; the worker is stopped
     * @throws IllegalStateException if called twice
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Session already started");
        }
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(MDC_SESSION_ID, sessionId)) {
            worker.start();
            try {
                source.start(new SessionListener());
            } catch (SourceUnavailableException e) {
                LOG.error("Session {} could not start: {}", sessionId, e.getMessage());
                worker.stop();
                stopped.set(true);
                throw e;
            }
            LOG.info("Live session started: locator={}", source.locator());
        }
    }

    /**
     * Non-blocking: the next recognized segment, if one is ready. The segment is also added to the
     * rolling transcript.
     */
    public Optional<TranscriptSegment> tryGetResult() {
        Optional<TranscriptSegment> next = worker.tryGetResult();
        next.ifPresent(assembler::addSegment);
        return next;
    }

    /**
     * Non-blocking: every segment ready now, oldest first, added to the rolling transcript.
     */
    public List<TranscriptSegment> poll() {
        List<TranscriptSegment> ready = worker.drainResults();
        ready.forEach(assembler::addSegment);
        return ready;
    }

    /**
     * Waits until the source has ended and the worker has processed every queued chunk.
     *
     * @return whether both happened within the timeout
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        if (!ended.await(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
            return false;
        }
        long remaining = Math.max(0L, deadline - System.nanoTime());
        return worker.awaitIdle(Duration.ofNanos(remaining));
    }

    /**
     * Stops source and worker, flushes pending segments and persists the transcript. Idempotent;
     * later calls return the same transcript.
     */
    public Transcript stop() {
        if (!stopped.compareAndSet(false, true)) {
            return transcript;
        }
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(MDC_SESSION_ID, sessionId)) {
            source.stop();
            worker.stop();
            List<TranscriptSegment> pending = poll();
            Transcript t = Transcript.start(sessionId);
            t.setProvider(provider);
            t.appendAll(assembler.fullTranscript());
            this.transcript = t;
            LOG.info("Live session stopped: segments={} (flushed {}), stats={}{}",
                    t.size(), pending.size(), worker.stats(),
                    terminalError == null ? "" : ", error=" + terminalError.getMessage());
            persist(t);
            return t;
        }
    }

    @Override
    public void close() {
        stop();
    }

    public String sessionId() {
        return sessionId;
    }

    public String render() {
        return assembler.render();
    }

    public TranscriptAssembler assembler() {
        return assembler;
    }

    public RecognitionWorker worker() {
        return worker;
    }

    public boolean isEnded() {
        return ended.getCount() == 0;
    }

    /** The terminal source error, if the stream failed. */
    public Optional<LiveScribeException> terminalError() {
        return Optional.ofNullable(terminalError);
    }

    /** Files written on stop, if a writer is configured and the write succeeded. */
    public Optional<TranscriptFiles> files() {
        return Optional.ofNullable(files);
    }

    private void persist(Transcript t) {
        if (writer == null) {
            return;
        }
        if (t.isEmpty()) {
            LOG.info("Nothing recognized; transcript not persisted");
            return;
        }
        try {
            files = writer.write(t);
        } catch (IOException e) {
            LOG.error("Failed to persist transcript for session {}", sessionId, e);
        }
    }

    private final class SessionListener implements AudioSourceListener {

        @Override
        public void onChunk(AudioChunk chunk) {
            worker.submit(chunk);
        }

        @Override
        public void onEnd() {
            LOG.info("Source ended after {} chunks", source.chunksEmitted());
            ended.countDown();
        }

        @Override
        public void onError(LiveScribeException error) {
            terminalError = error;
            LOG.warn("Source failed: {}", error.getMessage());
        }
    }
}
