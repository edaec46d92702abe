package com.phillippitts.livescribe.service.worker;

import com.phillippitts.livescribe.config.properties.WorkerProperties;
import com.phillippitts.livescribe.domain.AudioChunk;
import com.phillippitts.livescribe.domain.RecognitionResult;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import com.phillippitts.livescribe.service.audio.AudioEnergy;
import com.phillippitts.livescribe.service.metrics.PipelineMetrics;
import com.phillippitts.livescribe.service.process.ProcessTerminator;
import com.phillippitts.livescribe.service.stt.RecognitionEngine;
import com.phillippitts.livescribe.util.LogSanitizer;
import com.phillippitts.livescribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Runs live recognition on a dedicated thread between two bounded queues.
 *
 * <p><b>Backpressure:</b> {@link #submit(AudioChunk)} waits at most {@code worker.offer-timeout}
 * for queue space, then drops the chunk. The result queue evicts its oldest segment on overflow, so
 * the worker never blocks on a slow consumer.
 *
 * <p><b>Per chunk:</b> skip chunks that are too short or near-silent, recognize synchronously,
 * drop blank, short, filler-only and recently repeated texts, then emit one
 * {@link TranscriptSegment} spanning the chunk. A failing recognition is counted and skipped; the
 * loop continues.
 *
 * <p><b>Threading:</b> {@code submit} is called by the decode thread, {@link #tryGetResult()} by the
 * consumer. The worker thread is the only one running recognition and mutating filter state.
 */
public class RecognitionWorker {

    private static final Logger LOG = LogManager.getLogger(RecognitionWorker.class);
    private static final long IDLE_POLL_MILLIS = 20;

    private final RecognitionEngine engine;
    private final WorkerProperties props;
    private final PipelineMetrics metrics;
    private final ApplicationEventPublisher publisher;

    private final BlockingQueue<AudioChunk> chunkQueue;
    private final BlockingQueue<TranscriptSegment> resultQueue;
    private final SegmentFilter filter;
    private final RealTimeFactorTracker rtf;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong filtered = new AtomicLong();
    private final AtomicLong evicted = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();

    private volatile Consumer<TranscriptSegment> callback;
    private volatile Thread workerThread;

    public RecognitionWorker(RecognitionEngine engine,
                             WorkerProperties props,
                             PipelineMetrics metrics,
                             ApplicationEventPublisher publisher) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = publisher;
        this.chunkQueue = new ArrayBlockingQueue<>(props.chunkQueueCapacity());
        this.resultQueue = new ArrayBlockingQueue<>(props.resultQueueCapacity());
        this.filter = new SegmentFilter(props.minTextLength(), props.fillers(), props.dedupHistory());
        this.rtf = new RealTimeFactorTracker(props.rtfWindow());
    }

    /**
     * Optional per-segment callback, invoked on the worker thread. Exceptions are logged and ignored.
     */
    public void setCallback(Consumer<TranscriptSegment> callback) {
        this.callback = callback;
    }

    /**
     * Initializes the engine (no-op if already initialized) and starts the worker thread.
     *
     * @throws com.phillippitts.livescribe.exception.RecognitionException if the engine cannot initialize
     * @throws IllegalStateException if called twice
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Worker already started");
        }
        engine.initialize();
        running.set(true);
        Map<String, String> context = ThreadContext.getImmutableContext();
        Thread t = new Thread(() -> {
            if (context != null && !context.isEmpty()) {
                ThreadContext.putAll(context);
            }
            try {
                runLoop();
            } finally {
                ThreadContext.clearAll();
            }
        }, "recognition-worker");
        t.setDaemon(true);
        workerThread = t;
        t.start();
        LOG.info("Recognition worker started: engine={}, queue={}, results={}",
                engine.getEngineName(), props.chunkQueueCapacity(), props.resultQueueCapacity());
    }

    /**
     * Queues a chunk for recognition, waiting at most {@code worker.offer-timeout}.
     *
     * @return false when the chunk was dropped
     */
    public boolean submit(AudioChunk chunk) {
        Objects.requireNonNull(chunk, "chunk");
        if (!running.get()) {
            recordDrop(chunk, "worker not running");
            return false;
        }
        // counted before the offer so isIdle() never misses a queued chunk
        submitted.incrementAndGet();
        try {
            if (chunkQueue.offer(chunk, props.offerTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                metrics.incrementChunksSubmitted();
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        submitted.decrementAndGet();
        recordDrop(chunk, "queue full");
        return false;
    }

    /**
     * Non-blocking poll for the next recognized segment.
     */
    public Optional<TranscriptSegment> tryGetResult() {
        return Optional.ofNullable(resultQueue.poll());
    }

    /**
     * Removes and returns every segment currently queued, oldest first.
     */
    public List<TranscriptSegment> drainResults() {
        List<TranscriptSegment> out = new ArrayList<>();
        resultQueue.drainTo(out);
        return out;
    }

    /**
     * Stops the worker: an in-flight recognition finishes, queued chunks are discarded.
     * Waits up to {@code worker.join-timeout} for that recognition, so its segment is in the result
     * queue when this returns. Idempotent; queued segments remain available.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        Thread t = workerThread;
        if (t != null && t != Thread.currentThread()
                && !ProcessTerminator.joinQuietly(t, props.joinTimeout())) {
            LOG.warn("Recognition worker did not terminate within {}ms; the in-flight segment will be missed",
                    props.joinTimeout().toMillis());
        }
        int discarded = chunkQueue.size();
        chunkQueue.clear();
        LOG.info("Recognition worker stopped: processed={}, failed={}, filtered={}, discarded={}, avgRtf={}",
                processed.get(), failed.get(), filtered.get(), discarded, String.format("%.2f", rtf.average()));
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * True when every accepted chunk has been processed, or the worker is stopped.
     */
    public boolean isIdle() {
        return !running.get() || completed.get() >= submitted.get();
    }

    /**
     * Waits until {@link #isIdle()} or the timeout elapses.
     *
     * @return whether the worker became idle in time
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!isIdle()) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(IDLE_POLL_MILLIS);
        }
        return true;
    }

    public WorkerStats stats() {
        return new WorkerStats(submitted.get(), dropped.get(), processed.get(), failed.get(), filtered.get(),
                evicted.get(), chunkQueue.size(), resultQueue.size(), rtf.average());
    }

    private void runLoop() {
        while (running.get()) {
            AudioChunk chunk;
            try {
                chunk = chunkQueue.poll(props.pollTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.debug("Recognition worker interrupted");
                break;
            }
            if (chunk != null) {
                try {
                    process(chunk);
                } finally {
                    completed.incrementAndGet();
                }
            }
        }
    }

    // Package-private for tests
    void process(AudioChunk chunk) {
        if (chunk.durationSeconds() < props.minChunkSeconds()) {
            recordFiltered(SegmentFilter.TOO_SHORT);
            return;
        }
        if (AudioEnergy.isNearSilent(chunk.samples(), props.silenceEnergyThreshold())) {
            recordFiltered("silence");
            return;
        }

        long start = System.nanoTime();
        RecognitionResult result;
        try {
            result = engine.recognize(chunk);
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            metrics.incrementChunksFailed(engine.getEngineName());
            LOG.warn("Recognition failed for chunk at {}s: {}", chunk.startTime(), e.getMessage());
            return;
        }
        long wallNanos = System.nanoTime() - start;
        processed.incrementAndGet();
        metrics.recordRecognitionLatency(engine.getEngineName(), wallNanos);
        trackRealTimeFactor(chunk, wallNanos);

        String text = result.text().trim();
        Optional<String> rejection = filter.rejectionReason(text);
        if (rejection.isPresent()) {
            recordFiltered(rejection.get());
            return;
        }
        filter.remember(text);
        TranscriptSegment segment = new TranscriptSegment(text, chunk.startTime(), chunk.endTime(),
                result.confidenceOr(props.defaultConfidence()), null);
        emit(segment);
    }

    private void trackRealTimeFactor(AudioChunk chunk, long wallNanos) {
        double chunkRtf = rtf.record(chunk.durationSeconds(), wallNanos);
        if (Double.isFinite(chunkRtf)) {
            metrics.recordRealTimeFactor(chunkRtf);
        }
        if (chunkRtf < 1.0) {
            LOG.warn("Recognition slower than real time: rtf={} ({} ms for {}s of audio)",
                    String.format("%.2f", chunkRtf), TimeUtils.nanosToMillis(wallNanos),
                    String.format("%.2f", chunk.durationSeconds()));
        }
        if (rtf.shouldReportDegraded()) {
            LOG.warn("Recognition degraded: average rtf {} over {} consecutive chunks",
                    String.format("%.2f", rtf.average()), rtf.slowStreak());
            if (publisher != null) {
                publisher.publishEvent(new RecognitionDegradedEvent(engine.getEngineName(), rtf.average(),
                        rtf.slowStreak(), Instant.now()));
            }
        }
    }

    private void emit(TranscriptSegment segment) {
        while (!resultQueue.offer(segment)) {
            if (resultQueue.poll() != null) {
                evicted.incrementAndGet();
                LOG.debug("Result queue full; evicted oldest segment");
            }
        }
        LOG.debug("Segment {}s-{}s (chars={}, preview='{}')", segment.start(), segment.end(),
                segment.text().length(), LogSanitizer.preview(segment.text()));
        Consumer<TranscriptSegment> cb = callback;
        if (cb != null) {
            try {
                cb.accept(segment);
            } catch (RuntimeException e) {
                LOG.warn("Segment callback failed: {}", e.toString());
            }
        }
    }

    private void recordDrop(AudioChunk chunk, String why) {
        dropped.incrementAndGet();
        metrics.incrementChunksDropped();
        LOG.debug("Dropped chunk at {}s: {}", chunk.startTime(), why);
    }

    private void recordFiltered(String reason) {
        filtered.incrementAndGet();
        metrics.incrementFiltered(reason);
    }
}
