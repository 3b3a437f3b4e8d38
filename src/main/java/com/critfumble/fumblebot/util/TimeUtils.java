package com.critfumble.fumblebot.util;

import java.time.Duration;

/**
 * Time conversions for latency logging and session statistics.
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a {@link System#nanoTime()} timestamp.
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Formats a duration as {@code 1h 5m}, {@code 12m 3s} or {@code 40s}.
     *
     * @param duration non-negative duration; negative values are clamped to zero
     * @return short human-readable form
     */
    public static String humanDuration(Duration duration) {
        long total = Math.max(0, duration.getSeconds());
        long hours = total / 3600;
        long minutes = (total % 3600) / 60;
        long seconds = total % 60;
        if (hours > 0) {
            return hours + "h " + minutes + "m";
        }
        if (minutes > 0) {
            return minutes + "m " + seconds + "s";
        }
        return seconds + "s";
    }
}
