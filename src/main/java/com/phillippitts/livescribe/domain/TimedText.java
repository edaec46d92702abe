package com.phillippitts.livescribe.domain;

/**
 * Common read view over a timestamped span of text, implemented by
 * {@link TranscriptSegment} and {@link SpeakerTurn}.
 */
public interface TimedText {

    String text();

    double start();

    double end();

    /** Speaker label, or null when unattributed. */
    String speaker();

    default double duration() {
        return end() - start();
    }
}
