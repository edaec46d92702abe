package com.phillippitts.livescribe.domain;

import java.util.Objects;

/**
 * A merged run of same-speaker words with no large internal gap.
 *
 * <p>Turns are frozen once the segmenter closes them; text accumulation happens in the
 * segmenter's private builder.
 *
 * @param speakerId    speaker identity (speaker tag, {@code channel_N}, or the default label)
 * @param start        start time in seconds
 * @param end          end time in seconds
 * @param text         accumulated text
 * @param channelIndex source channel, or null for single-channel audio
 */
public record SpeakerTurn(
        String speakerId,
        double start,
        double end,
        String text,
        Integer channelIndex
) implements TimedText {

    public SpeakerTurn {
        Objects.requireNonNull(speakerId, "speakerId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (end < start) {
            throw new IllegalArgumentException("end must be >= start, got start=" + start + ", end=" + end);
        }
    }

    @Override
    public String speaker() {
        return speakerId;
    }
}
