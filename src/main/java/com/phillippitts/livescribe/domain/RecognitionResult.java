package com.phillippitts.livescribe.domain;

import java.util.List;
import java.util.Objects;

/**
 * Typed payload of one recognition call. Shape is validated once by the provider parser.
 *
 * @param text       full recognized text (may be empty for silence)
 * @param segments   timestamped segments, relative to the recognized audio
 * @param words      word-level tokens when the provider returns them (may be empty)
 * @param confidence overall confidence between 0.0 and 1.0, or null when the engine reports none
 * @param engine     name of the engine that produced the result
 */
public record RecognitionResult(
        String text,
        List<TranscriptSegment> segments,
        List<Word> words,
        Double confidence,
        String engine
) {
    public RecognitionResult {
        Objects.requireNonNull(text, "text must not be null");
        segments = segments == null ? List.of() : List.copyOf(segments);
        words = words == null ? List.of() : List.copyOf(words);
        if (confidence != null && (confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        Objects.requireNonNull(engine, "engine must not be null");
    }

    /** Engine confidence, or {@code fallback} when none was reported. */
    public double confidenceOr(double fallback) {
        return confidence != null ? confidence : fallback;
    }

    public boolean isBlank() {
        return text.isBlank() && segments.isEmpty() && words.isEmpty();
    }
}
