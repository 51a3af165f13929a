package com.phillippitts.pingwatch.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void shouldCalculateElapsedMillisFromPastTimestamp() {
        long startNanos = System.nanoTime() - (1_000L * TimeUtils.NANOS_PER_MILLI);

        long elapsedMs = TimeUtils.elapsedMillis(startNanos);

        assertThat(elapsedMs).isGreaterThanOrEqualTo(950L);
        assertThat(elapsedMs).isLessThan(1050L);
    }

    @Test
    void shouldFormatDurationAsHoursMinutesSeconds() {
        assertThat(TimeUtils.formatDuration(Duration.ofSeconds(3))).isEqualTo("00:00:03");
        assertThat(TimeUtils.formatDuration(Duration.ofMinutes(61).plusSeconds(5))).isEqualTo("01:01:05");
    }

    @Test
    void shouldNotWrapHoursAtOneDay() {
        assertThat(TimeUtils.formatDuration(Duration.ofDays(2))).isEqualTo("48:00:00");
    }

    @Test
    void shouldDropFractionalSeconds() {
        assertThat(TimeUtils.formatDuration(Duration.ofMillis(2_999))).isEqualTo("00:00:02");
    }

    @Test
    void shouldRenderNullAndNegativeAsZero() {
        assertThat(TimeUtils.formatDuration(null)).isEqualTo("00:00:00");
        assertThat(TimeUtils.formatDuration(Duration.ofSeconds(-5))).isEqualTo("00:00:00");
    }
}
