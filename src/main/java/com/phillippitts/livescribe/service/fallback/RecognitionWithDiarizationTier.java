package com.phillippitts.livescribe.service.fallback;

import com.phillippitts.livescribe.domain.DiarizationInterval;
import com.phillippitts.livescribe.domain.RecognitionResult;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import com.phillippitts.livescribe.exception.DiarizationUnavailableException;
import com.phillippitts.livescribe.exception.RecognitionException;
import com.phillippitts.livescribe.service.stt.RecognitionEngine;
import com.phillippitts.livescribe.service.stt.diarization.DiarizationEngine;
import com.phillippitts.livescribe.service.transcript.DiarizationReconciler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Local recognition and a separate diarization pass, run in parallel and merged by segment
 * midpoint.
 *
 * <p>Both passes run on the bounded {@code sttExecutor} and share one timeout; on timeout both are
 * cancelled with interruption, which terminates their subprocesses. A diarization
 * failure fails the tier with {@link FailureKind#DIARIZATION_UNAVAILABLE} so the chain can fall back
 * to recognition only; the first such failure is logged as a warning, later ones at debug.
 */
public class RecognitionWithDiarizationTier implements ProviderTier {

    private static final Logger LOG = LogManager.getLogger(RecognitionWithDiarizationTier.class);

    private final RecognitionEngine engine;
    private final DiarizationEngine diarizer;
    private final DiarizationReconciler reconciler;
    private final Executor executor;
    private final Duration timeout;
    private final AtomicBoolean diarizationWarned = new AtomicBoolean(false);

    public RecognitionWithDiarizationTier(RecognitionEngine engine,
                                          DiarizationEngine diarizer,
                                          DiarizationReconciler reconciler,
                                          Executor executor,
                                          Duration timeout) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.diarizer = Objects.requireNonNull(diarizer, "diarizer");
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public String name() {
        return TierNames.RECOGNITION_WITH_DIARIZATION;
    }

    @Override
    public boolean isAvailable() {
        return engine.isAvailable() && diarizer.isAvailable();
    }

    @Override
    public ProviderResult transcribe(Path wav) {
        // FutureTask so that cancel(true) interrupts the pool thread, which makes ProcessRunner
        // terminate the running subprocess
        FutureTask<RecognitionResult> recognition = new FutureTask<>(() -> {
            engine.initialize();
            return engine.recognizeFile(wav);
        });
        FutureTask<List<DiarizationInterval>> diarization = new FutureTask<>(() -> diarizer.diarize(wav));
        executor.execute(recognition);
        executor.execute(diarization);

        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            awaitDone(recognition, deadline);
            awaitDone(diarization, deadline);
        } catch (TimeoutException e) {
            LOG.warn("Recognition with diarization timed out after {} ms; cancelling both passes", timeout.toMillis());
            recognition.cancel(true);
            diarization.cancel(true);
            return ProviderResult.err(name(), FailureKind.ERROR, "timed out after " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recognition.cancel(true);
            diarization.cancel(true);
            return ProviderResult.err(name(), FailureKind.ERROR, "interrupted");
        }

        RecognitionResult result;
        try {
            result = outcomeOf(recognition);
        } catch (ExecutionException e) {
            return ProviderResult.err(name(), FailureKind.ERROR, describe(e.getCause()));
        }
        List<DiarizationInterval> intervals;
        try {
            intervals = outcomeOf(diarization);
        } catch (ExecutionException e) {
            logDiarizationFailure(e.getCause());
            return ProviderResult.err(name(), FailureKind.DIARIZATION_UNAVAILABLE, describe(e.getCause()));
        }

        List<TranscriptSegment> segments = FileSegments.from(result, wav);
        List<TranscriptSegment> labeled = reconciler.assign(segments, intervals);
        LOG.debug("Reconciled {} segments against {} diarization intervals", labeled.size(), intervals.size());
        return ProviderResult.ok(name(), labeled);
    }

    private static void awaitDone(Future<?> task, long deadlineNanos) throws TimeoutException, InterruptedException {
        try {
            task.get(Math.max(0L, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            LOG.debug("Provider pass failed: {}", describe(e.getCause()));
        }
    }

    /** Result of a finished task; its failure is rethrown as {@link ExecutionException}. */
    private static <T> T outcomeOf(FutureTask<T> done) throws ExecutionException {
        try {
            return done.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionException(e);
        }
    }

    private void logDiarizationFailure(Throwable cause) {
        if (diarizationWarned.compareAndSet(false, true)) {
            LOG.warn("Diarization unavailable, falling back to recognition only: {}", describe(cause));
        } else {
            LOG.debug("Diarization unavailable: {}", describe(cause));
        }
    }

    private static String describe(Throwable t) {
        if (t instanceof RecognitionException || t instanceof DiarizationUnavailableException) {
            return t.getMessage();
        }
        return t == null ? "unknown failure" : t.getClass().getSimpleName() + ": " + t.getMessage();
    }
}
