package com.phillippitts.livescribe.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void convertsNanos() {
        assertThat(TimeUtils.nanosToMillis(2_500_000L)).isEqualTo(2L);
        assertThat(TimeUtils.nanosToSeconds(1_500_000_000L)).isEqualTo(1.5);
    }

    @Test
    void secondsToMillisToleratesFloatingPointNoise() {
        assertThat(TimeUtils.secondsToMillis(0.3)).isEqualTo(300L);
        assertThat(TimeUtils.secondsToMillis(1.001)).isEqualTo(1001L);
        assertThat(TimeUtils.secondsToMillis(3723.5)).isEqualTo(3_723_500L);
    }

    @Test
    void elapsedMillisIsNeverNegative() {
        assertThat(TimeUtils.elapsedMillis(System.nanoTime())).isGreaterThanOrEqualTo(0L);
    }
}
