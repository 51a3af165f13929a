package com.phillippitts.pingwatch.util;

import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Utility methods for time conversions, elapsed time calculations and duration display.
 *
 * <p>Measures elapsed milliseconds against {@link System#nanoTime()} for round-trip timing
 * and renders disruption durations as {@code HH:mm:ss} for snapshots and reports.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    /**
     * Timestamp layout used in reports and trace banners ({@code 2024/05/01 13:45:10}).
     */
    public static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Formats a duration as {@code HH:mm:ss}. Hours are not wrapped at 24, so a
     * two-day outage renders as {@code 48:00:00}. Negative or null durations render as zero.
     *
     * @param duration duration to format (may be null)
     * @return formatted duration, never null
     */
    public static String formatDuration(Duration duration) {
        if (duration == null || duration.isNegative()) {
            return "00:00:00";
        }
        long totalSeconds = duration.getSeconds();
        long hours = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long seconds = totalSeconds % 60;
        return String.format("%02d:%02d:%02d", hours, minutes, seconds);
    }
}
