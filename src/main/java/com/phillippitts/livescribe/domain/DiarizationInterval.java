package com.phillippitts.livescribe.domain;

import java.util.Objects;

/**
 * A speaker-labeled time span returned by a standalone diarization pass.
 *
 * @param speakerLabel raw label from the diarizer (e.g. {@code SPEAKER_00})
 * @param start        start time in seconds (inclusive)
 * @param end          end time in seconds (exclusive)
 */
public record DiarizationInterval(String speakerLabel, double start, double end) {

    public DiarizationInterval {
        Objects.requireNonNull(speakerLabel, "speakerLabel must not be null");
        if (end < start) {
            throw new IllegalArgumentException("end must be >= start, got start=" + start + ", end=" + end);
        }
    }

    /**
     * Half-open containment test over {@code [start, end)}.
     */
    public boolean contains(double t) {
        return t >= start && t < end;
    }
}
