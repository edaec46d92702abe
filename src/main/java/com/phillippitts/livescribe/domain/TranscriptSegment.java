package com.phillippitts.livescribe.domain;

import java.util.Objects;

/**
 * The atomic unit flowing through the live pipeline: a timestamped span of recognized text.
 *
 * @param text       recognized text (must not be null)
 * @param start      start time in seconds
 * @param end        end time in seconds (must be &gt;= start)
 * @param confidence confidence score between 0.0 and 1.0
 * @param speaker    speaker label, or null when unattributed
 */
public record TranscriptSegment(
        String text,
        double start,
        double end,
        double confidence,
        String speaker
) implements TimedText {

    public TranscriptSegment {
        Objects.requireNonNull(text, "text must not be null");
        if (end < start) {
            throw new IllegalArgumentException("end must be >= start, got start=" + start + ", end=" + end);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    public static TranscriptSegment of(String text, double start, double end, double confidence) {
        return new TranscriptSegment(text, start, end, confidence, null);
    }

    public TranscriptSegment withSpeaker(String label) {
        return new TranscriptSegment(text, start, end, confidence, label);
    }

    public double midpoint() {
        return (start + end) / 2.0;
    }
}
