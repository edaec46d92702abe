package com.phillippitts.livescribe.testutil;

import com.phillippitts.livescribe.domain.AudioChunk;
import com.phillippitts.livescribe.domain.RecognitionResult;
import com.phillippitts.livescribe.exception.RecognitionException;
import com.phillippitts.livescribe.service.stt.RecognitionEngine;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Test double for RecognitionEngine with configurable recognition output.
 *
 * <p>Allows tests to control:
 * <ul>
 *   <li>Returned text, either canned or computed per chunk via a responder</li>
 *   <li>Confidence (null means the engine reports none)</li>
 *   <li>Delay simulation and a gate that holds every call until released</li>
 *   <li>Explicit failure mode (throws on recognize)</li>
 *   <li>The whole-file result returned by {@link #recognizeFile(Path)}</li>
 * </ul>
 *
 * <p><b>Mutable fields:</b> {@code cannedText}, {@code available}, {@code shouldFail},
 * {@code gate} and {@code fileResult} are public to allow dynamic modification in tests.
 */
public class FakeRecognitionEngine implements RecognitionEngine {
    private final String engineName;
    private final Double confidence;
    private final int delayMs;
    private final Function<AudioChunk, String> responder;
    private final AtomicInteger invocations = new AtomicInteger();
    private final AtomicInteger initializations = new AtomicInteger();
    private final AtomicInteger interruptions = new AtomicInteger();

    public volatile String cannedText;
    public volatile boolean available = true;
    public volatile boolean shouldFail;
    public volatile CountDownLatch gate;
    public volatile RecognitionResult fileResult;
    private volatile boolean closed;

    public FakeRecognitionEngine(String name, String text, Double confidence) {
        this(name, text, confidence, 0);
    }

    public FakeRecognitionEngine(String name, String text, Double confidence, int delayMs) {
        this(name, text, confidence, delayMs, null);
    }

    /**
     * Creates an engine whose text is computed from each chunk, so consecutive chunks never
     * look like duplicates to the worker.
     */
    public FakeRecognitionEngine(String name, Function<AudioChunk, String> responder) {
        this(name, null, null, 0, responder);
    }

    private FakeRecognitionEngine(String name, String text, Double confidence, int delayMs,
                                  Function<AudioChunk, String> responder) {
        this.engineName = name;
        this.cannedText = text;
        this.confidence = confidence;
        this.delayMs = delayMs;
        this.responder = responder;
    }

    @Override
    public void initialize() {
        initializations.incrementAndGet();
    }

    @Override
    public RecognitionResult recognize(AudioChunk chunk) {
        invocations.incrementAndGet();
        pause();
        if (shouldFail) {
            throw new RecognitionException("Engine configured to fail", engineName);
        }
        String text = responder != null ? responder.apply(chunk) : cannedText;
        return new RecognitionResult(text, List.of(), List.of(), confidence, engineName);
    }

    @Override
    public RecognitionResult recognizeFile(Path wav) {
        invocations.incrementAndGet();
        pause();
        if (shouldFail) {
            throw new RecognitionException("Engine configured to fail", engineName);
        }
        RecognitionResult configured = fileResult;
        if (configured != null) {
            return configured;
        }
        return new RecognitionResult(cannedText == null ? "" : cannedText, List.of(), List.of(),
                confidence, engineName);
    }

    private void pause() {
        try {
            CountDownLatch g = gate;
            if (g != null) {
                g.await();
            }
            if (delayMs > 0) {
                Thread.sleep(delayMs);
            }
        } catch (InterruptedException e) {
            interruptions.incrementAndGet();
            Thread.currentThread().interrupt();
            throw new RecognitionException("Recognition interrupted", engineName, e);
        }
    }

    public int invocations() {
        return invocations.get();
    }

    public int initializations() {
        return initializations.get();
    }

    /** Calls that were interrupted while waiting on the gate or the delay. */
    public int interruptions() {
        return interruptions.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public String getEngineName() {
        return engineName;
    }

    @Override
    public boolean isHealthy() {
        return !closed;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public void close() {
        closed = true;
    }
}
