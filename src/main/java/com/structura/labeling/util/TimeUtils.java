package com.structura.labeling.util;

import java.time.Duration;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * <p>Configuration expresses timeouts as fractional seconds; the components work with
 * {@link Duration} at millisecond precision.
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
     * Converts nanoseconds to milliseconds (truncated).
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Calculates elapsed nanoseconds since a {@link System#nanoTime()} timestamp.
     */
    public static long elapsedNanos(long startNanos) {
        return System.nanoTime() - startNanos;
    }

    /**
     * Converts fractional seconds to a millisecond-precision duration.
     *
     * @param seconds seconds, e.g. 0.5
     * @return duration rounded to the nearest millisecond
     * @throws IllegalArgumentException if seconds is NaN or infinite
     */
    public static Duration secondsToDuration(double seconds) {
        if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
            throw new IllegalArgumentException("seconds must be finite, got: " + seconds);
        }
        return Duration.ofMillis(Math.round(seconds * 1000.0));
    }

    /**
     * Fractional seconds of a duration, for log lines.
     */
    public static double toSeconds(Duration duration) {
        return duration.toMillis() / 1000.0;
    }
}
