package com.phillippitts.livescribe.service.stt;

import com.phillippitts.livescribe.domain.AudioChunk;
import com.phillippitts.livescribe.domain.RecognitionResult;
import com.phillippitts.livescribe.exception.RecognitionException;

import java.nio.file.Path;

/**
 * Contract for speech recognizers used by the live worker and the file tiers.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Engine is constructed with configuration</li>
 *   <li>{@link #initialize()} prepares the engine exactly once; later calls are no-ops</li>
 *   <li>{@link #recognize(AudioChunk)} / {@link #recognizeFile(Path)} process audio</li>
 *   <li>{@link #close()} releases resources; a closed engine cannot be initialized again</li>
 * </ol>
 *
 * <p>Thread Safety: implementations must be safe for concurrent recognition calls.
 *
 * <p>Audio Format: chunks and files use the canonical format defined by
 * {@link com.phillippitts.livescribe.service.audio.AudioFormat}.
 */
public interface RecognitionEngine extends AutoCloseable {

    /**
     * Prepares the engine. Idempotent.
     *
     * @throws RecognitionException if initialization fails or the engine is closed
     */
    void initialize();

    /**
     * Recognizes a single live chunk. Segment timestamps in the result are relative to the chunk.
     *
     * @throws RecognitionException on engine failure
     * @throws IllegalArgumentException if chunk is null or empty
     */
    RecognitionResult recognize(AudioChunk chunk);

    /**
     * Recognizes a whole canonical WAV file. Segment timestamps are relative to the file start.
     *
     * @throws RecognitionException on engine failure
     */
    RecognitionResult recognizeFile(Path wav);

    /**
     * @return engine name for logging and events (e.g. "whisper")
     */
    String getEngineName();

    /**
     * @return true if the engine is initialized and not closed
     */
    boolean isHealthy();

    /**
     * Whether the engine's external requirements (binary, model) are present.
     * Checked once when fallback tiers are assembled.
     */
    boolean isAvailable();

    @Override
    void close();
}
