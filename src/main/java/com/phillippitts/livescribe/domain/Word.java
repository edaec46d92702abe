package com.phillippitts.livescribe.domain;

import java.util.Objects;

/**
 * A single recognized word with timing and optional speaker attribution.
 *
 * @param text         word text (must not be null)
 * @param start        start time in seconds
 * @param end          end time in seconds (must be &gt;= start)
 * @param speakerId    speaker tag from a diarizing recognizer, or null
 * @param channelIndex channel index for multi-channel audio, or null
 * @param kind         word or audio event
 */
public record Word(
        String text,
        double start,
        double end,
        String speakerId,
        Integer channelIndex,
        WordKind kind
) {
    public Word {
        Objects.requireNonNull(text, "text must not be null");
        if (end < start) {
            throw new IllegalArgumentException("end must be >= start, got start=" + start + ", end=" + end);
        }
        kind = kind == null ? WordKind.WORD : kind;
    }

    public static Word of(String text, double start, double end, String speakerId) {
        return new Word(text, start, end, speakerId, null, WordKind.WORD);
    }

    public boolean isSpoken() {
        return kind == WordKind.WORD;
    }
}
