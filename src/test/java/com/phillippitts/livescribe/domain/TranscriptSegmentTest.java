package com.phillippitts.livescribe.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptSegmentTest {

    @Test
    void midpointIsHalfwayBetweenStartAndEnd() {
        TranscriptSegment s = TranscriptSegment.of("hello", 10.0, 12.0, 0.9);
        assertThat(s.midpoint()).isEqualTo(11.0);
        assertThat(s.duration()).isEqualTo(2.0);
        assertThat(s.speaker()).isNull();
    }

    @Test
    void withSpeakerKeepsTimingAndText() {
        TranscriptSegment s = TranscriptSegment.of("hello", 1.0, 2.0, 0.5).withSpeaker("Speaker A");
        assertThat(s.speaker()).isEqualTo("Speaker A");
        assertThat(s.text()).isEqualTo("hello");
        assertThat(s.start()).isEqualTo(1.0);
        assertThat(s.confidence()).isEqualTo(0.5);
    }

    @Test
    void rejectsEndBeforeStart() {
        assertThatThrownBy(() -> TranscriptSegment.of("x", 2.0, 1.0, 0.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("end must be >= start");
    }

    @Test
    void rejectsConfidenceOutOfRange() {
        assertThatThrownBy(() -> TranscriptSegment.of("x", 0.0, 1.0, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TranscriptSegment.of("x", 0.0, 1.0, -0.1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNullText() {
        assertThatThrownBy(() -> TranscriptSegment.of(null, 0.0, 1.0, 0.5))
                .isInstanceOf(NullPointerException.class);
    }
}
