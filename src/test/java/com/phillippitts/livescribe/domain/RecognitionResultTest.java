package com.phillippitts.livescribe.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecognitionResultTest {

    @Test
    void missingConfidenceFallsBackToCallerDefault() {
        RecognitionResult r = new RecognitionResult("hi", null, null, null, "whisper");
        assertThat(r.confidenceOr(0.8)).isEqualTo(0.8);
        assertThat(r.segments()).isEmpty();
        assertThat(r.words()).isEmpty();
    }

    @Test
    void reportedConfidenceWins() {
        RecognitionResult r = new RecognitionResult("hi", List.of(), List.of(), 0.42, "whisper");
        assertThat(r.confidenceOr(0.8)).isEqualTo(0.42);
    }

    @Test
    void blankWhenNothingWasRecognized() {
        assertThat(new RecognitionResult("  ", null, null, null, "whisper").isBlank()).isTrue();
        assertThat(new RecognitionResult("", List.of(TranscriptSegment.of("x", 0, 1, 1)), null, null, "whisper")
                .isBlank()).isFalse();
    }

    @Test
    void rejectsConfidenceOutOfRange() {
        assertThatThrownBy(() -> new RecognitionResult("x", null, null, 1.2, "whisper"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
