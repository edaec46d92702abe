package com.phillippitts.livescribe.service.audio.source;

import com.phillippitts.livescribe.domain.AudioChunk;
import com.phillippitts.livescribe.exception.LiveScribeException;

/**
 * Receives chunks and lifecycle signals from a {@link StreamAudioSource}.
 *
 * <p>All callbacks run on the decode thread and should return quickly; hand chunks to a queue.
 */
public interface AudioSourceListener {

    void onChunk(AudioChunk chunk);

    /** Called exactly once when the stream ends, after any {@link #onError}. */
    default void onEnd() {
    }

    default void onError(LiveScribeException error) {
    }
}
