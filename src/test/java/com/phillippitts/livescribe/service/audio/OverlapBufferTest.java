package com.phillippitts.livescribe.service.audio;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OverlapBufferTest {

    @Test
    void tailReturnsMostRecentSamplesInOrder() {
        OverlapBuffer buf = new OverlapBuffer(4);
        buf.write(new short[] {1, 2, 3}, 0, 3);
        buf.write(new short[] {4, 5}, 0, 2);

        assertThat(buf.size()).isEqualTo(4);
        assertThat(buf.tail(4)).containsExactly(2, 3, 4, 5);
        assertThat(buf.tail(2)).containsExactly(4, 5);
    }

    @Test
    void oversizedWriteKeepsOnlyItsTail() {
        OverlapBuffer buf = new OverlapBuffer(3);
        buf.write(new short[] {1, 2, 3, 4, 5}, 0, 5);
        assertThat(buf.tail(10)).containsExactly(3, 4, 5);
    }

    @Test
    void clearEmptiesBuffer() {
        OverlapBuffer buf = new OverlapBuffer(3);
        buf.write(new short[] {1, 2}, 0, 2);
        buf.clear();
        assertThat(buf.size()).isZero();
        assertThat(buf.tail(2)).isEmpty();
        assertThat(buf.capacity()).isEqualTo(3);
    }
}
