package com.phillippitts.livescribe.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AudioChunkTest {

    @Test
    void durationAndEndFollowSampleCount() {
        AudioChunk chunk = new AudioChunk(new short[24_000], 16_000, 3.0);
        assertThat(chunk.durationSeconds()).isEqualTo(1.5);
        assertThat(chunk.endTime()).isEqualTo(4.5);
        assertThat(chunk.sampleCount()).isEqualTo(24_000);
    }

    @Test
    void samplesAreDefensivelyCopied() {
        short[] raw = {1, 2, 3};
        AudioChunk chunk = new AudioChunk(raw, 16_000, 0.0);
        raw[0] = 99;
        chunk.samples()[1] = 99;
        assertThat(chunk.samples()).containsExactly(1, 2, 3);
    }

    @Test
    void equalityComparesSampleContents() {
        AudioChunk a = new AudioChunk(new short[] {1, 2}, 16_000, 1.0);
        AudioChunk b = new AudioChunk(new short[] {1, 2}, 16_000, 1.0);
        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(new AudioChunk(new short[] {1, 3}, 16_000, 1.0));
    }

    @Test
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> new AudioChunk(null, 16_000, 0.0)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new AudioChunk(new short[1], 0, 0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AudioChunk(new short[1], 16_000, -1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
