package com.phillippitts.livescribe.service.stt;

import com.phillippitts.livescribe.exception.RecognitionException;
import jakarta.annotation.PreDestroy;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Map;

/**
 * Base class for recognizers providing once-only lifecycle management.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li><b>Uninitialized:</b> engine created but not yet initialized</li>
 *   <li><b>Initialized:</b> {@link #initialize()} succeeded; further calls are no-ops</li>
 *   <li><b>Closed:</b> {@link #close()} called; the engine is no longer usable and
 *       {@link #initialize()} fails</li>
 * </ol>
 *
 * <p>There is no restart path. A failed {@link #doInitialize()} leaves the engine uninitialized so
 * the caller may retry.
 *
 * <p><b>Thread Safety:</b> state transitions are synchronized on an internal lock. Recognition calls
 * only read state through {@link #ensureInitialized()}.
 *
 * @see RecognitionEngine
 * @see com.phillippitts.livescribe.service.stt.whisper.WhisperRecognitionEngine
 */
public abstract class AbstractRecognitionEngine implements RecognitionEngine {

    /** Guards {@link #initialized} and {@link #closed}. */
    protected final Object lock = new Object();

    /** Access must be synchronized on {@link #lock}. */
    protected boolean initialized = false;

    /** Access must be synchronized on {@link #lock}. */
    protected boolean closed = false;

    /**
     * Initializes the engine exactly once.
     *
     * @throws RecognitionException if initialization fails or the engine was closed
     */
    @Override
    public final void initialize() {
        synchronized (lock) {
            if (closed) {
                throw new RecognitionException(getEngineName() + " engine is closed", getEngineName());
            }
            if (initialized) {
                return;
            }
            doInitialize();
            initialized = true;
        }
    }

    /**
     * Engine-specific initialization, called at most once successfully within the lock.
     *
     * @throws RecognitionException if initialization fails
     */
    protected abstract void doInitialize();

    @Override
    public final boolean isHealthy() {
        synchronized (lock) {
            return initialized && !closed;
        }
    }

    /**
     * Closes the engine. Idempotent; invoked by the container on shutdown.
     */
    @Override
    @PreDestroy
    public final void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            doClose();
            closed = true;
            initialized = false;
        }
    }

    /**
     * Engine-specific cleanup. Must not throw; log instead.
     */
    protected abstract void doClose();

    /**
     * @throws RecognitionException if the engine is not initialized or is closed
     */
    protected final void ensureInitialized() {
        synchronized (lock) {
            if (!initialized || closed) {
                throw new RecognitionException(
                        getEngineName() + " engine not initialized or closed",
                        getEngineName());
            }
        }
    }

    /**
     * Publishes a failure event and rethrows as {@link RecognitionException} without double-wrapping.
     *
     * <pre>{@code
     * try {
     *     return parse(run(...));
     * } catch (RuntimeException e) {
     *     throw handleRecognitionError(e, publisher, context);
     * }
     * }</pre>
     *
     * @param publisher event publisher (may be null)
     * @param context technical context for the event; never transcript text (may be null)
     * @return never returns normally
     * @throws RecognitionException always
     */
    protected final RecognitionException handleRecognitionError(
            Exception exception,
            ApplicationEventPublisher publisher,
            Map<String, String> context) {

        EngineEventPublisher.publishFailure(publisher, getEngineName(), "recognition failure", exception, context);

        if (exception instanceof RecognitionException re) {
            throw re;
        }
        throw new RecognitionException(
                getEngineName() + " recognition failed: " + exception.getMessage(),
                getEngineName(),
                exception);
    }
}
