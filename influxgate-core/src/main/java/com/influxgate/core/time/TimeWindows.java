package com.influxgate.core.time;

import com.influxgate.core.error.InvalidQueryInputException;
import java.time.Duration;
import java.time.Instant;

/** Epoch-aligned window arithmetic, matching how both backends place aggregation windows. */
public final class TimeWindows {

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private TimeWindows() {}

    public record ResolvedRange(Instant start, Instant stop) {}

    /** Largest window boundary at or before {@code instant}. */
    public static Instant floor(Instant instant, Duration every) {
        try {
            long size = every.toNanos();
            long nanos = toEpochNanos(instant);
            long floored = Math.multiplyExact(Math.floorDiv(nanos, size), size);
            return fromEpochNanos(floored);
        } catch (ArithmeticException e) {
            throw new InvalidQueryInputException(
                    "Window " + every + " cannot be aligned at " + instant + ": outside the nanosecond epoch range");
        }
    }

    /** Smallest window boundary at or after {@code instant}. */
    public static Instant ceil(Instant instant, Duration every) {
        Instant floored = floor(instant, every);
        if (floored.equals(instant)) {
            return instant;
        }
        try {
            return fromEpochNanos(Math.addExact(toEpochNanos(floored), every.toNanos()));
        } catch (ArithmeticException e) {
            throw new InvalidQueryInputException(
                    "Window " + every + " cannot be aligned at " + instant + ": outside the nanosecond epoch range");
        }
    }

    /** Widens {@code [start, stop)} outward to whole windows. */
    public static ResolvedRange align(Instant start, Instant stop, Duration every) {
        return new ResolvedRange(floor(start, every), ceil(stop, every));
    }

    static long toEpochNanos(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), NANOS_PER_SECOND), instant.getNano());
    }

    static Instant fromEpochNanos(long nanos) {
        return Instant.ofEpochSecond(Math.floorDiv(nanos, NANOS_PER_SECOND), Math.floorMod(nanos, NANOS_PER_SECOND));
    }
}
