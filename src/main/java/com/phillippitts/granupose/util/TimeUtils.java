package com.phillippitts.granupose.util;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * @since 1.0
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
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * <pre>
     * long startTime = System.nanoTime();
     * // ... do work ...
     * long elapsedMs = TimeUtils.elapsedMillis(startTime);
     * </pre>
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Formats a millisecond interval for log lines: {@code 250ms}, {@code 1s}, {@code 1500ms}.
     *
     * @param millis interval in milliseconds
     * @return whole seconds when exact, otherwise milliseconds
     */
    public static String formatMillis(long millis) {
        return millis % 1000 == 0 && millis != 0 ? (millis / 1000) + "s" : millis + "ms";
    }
}
