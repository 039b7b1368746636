package com.influxgate.core.time;

import com.influxgate.core.error.InvalidQueryInputException;
import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A signed duration expression such as {@code -3d}, {@code 1h30m} or {@code 250ms}. ISO-8601
 * input ({@code PT5M}) is accepted and rewritten to the shorthand form.
 *
 * <p>Units: {@code ns us µs ms s m h d w}. Calendar units ({@code mo}, {@code y}) are rejected
 * because they have no fixed length and the SQL-like dialect cannot express them.
 */
public record DurationLiteral(boolean negative, String magnitude, Duration duration) {

    private static final Pattern WHOLE = Pattern.compile("(?:\\d+(?:ns|us|µs|ms|s|m|h|d|w))+");
    private static final Pattern SEGMENT = Pattern.compile("(\\d+)(ns|us|µs|ms|s|m|h|d|w)");

    public DurationLiteral {
        if (magnitude == null || !WHOLE.matcher(magnitude).matches()) {
            throw new InvalidQueryInputException("Invalid duration: " + magnitude);
        }
    }

    public static DurationLiteral parse(String input) {
        if (input == null || input.isBlank()) {
            throw new InvalidQueryInputException("Duration cannot be null or empty");
        }
        String trimmed = input.trim();
        boolean negative = false;
        String body = trimmed;
        if (body.startsWith("-") || body.startsWith("+")) {
            negative = body.charAt(0) == '-';
            body = body.substring(1);
        }

        if (body.toUpperCase(Locale.ROOT).startsWith("P")) {
            Duration iso;
            try {
                iso = Duration.parse(body.toUpperCase(Locale.ROOT));
            } catch (Exception e) {
                throw new InvalidQueryInputException("Invalid duration: " + input);
            }
            if (iso.isNegative()) {
                throw new InvalidQueryInputException("Invalid duration: " + input);
            }
            requireNanosRange(iso, input);
            return new DurationLiteral(negative, shorthand(iso), iso);
        }

        if (!WHOLE.matcher(body).matches()) {
            throw new InvalidQueryInputException("Unsupported duration format: " + input);
        }
        Duration total = Duration.ZERO;
        Matcher m = SEGMENT.matcher(body);
        while (m.find()) {
            long value;
            try {
                value = Long.parseLong(m.group(1));
            } catch (NumberFormatException e) {
                throw new InvalidQueryInputException("Duration out of range: " + input);
            }
            try {
                total = total.plus(unitDuration(m.group(2), value));
            } catch (ArithmeticException e) {
                throw new InvalidQueryInputException("Duration out of range: " + input);
            }
        }
        requireNanosRange(total, input);
        return new DurationLiteral(negative, body, total);
    }

    /** Parses a duration that must be strictly positive, such as a window size. */
    public static DurationLiteral parsePositive(String input) {
        DurationLiteral literal = parse(input);
        if (literal.negative() || literal.duration().isZero()) {
            throw new InvalidQueryInputException("Duration must be positive: " + input);
        }
        return literal;
    }

    /** Signed offset from the reference instant. */
    public Duration offset() {
        return negative ? duration.negated() : duration;
    }

    /** Pipeline-dialect rendering: the expression as written, sign included. */
    public String toFlux() {
        return (negative ? "-" : "") + magnitude;
    }

    /**
     * SQL-like rendering of the unsigned magnitude. That dialect only takes single-unit literals
     * and spells microseconds {@code u}, so composite expressions are folded into the largest
     * unit that divides them.
     */
    public String influxQlMagnitude() {
        Matcher m = SEGMENT.matcher(magnitude);
        m.find();
        if (m.end() == magnitude.length()) {
            String unit = m.group(2);
            if ("us".equals(unit) || "µs".equals(unit)) {
                return m.group(1) + "u";
            }
            return magnitude;
        }
        return shorthand(duration).replace("us", "u");
    }

    @Override
    public String toString() {
        return toFlux();
    }

    /** Both backends count durations in signed 64-bit nanoseconds. */
    private static void requireNanosRange(Duration duration, String input) {
        try {
            duration.toNanos();
        } catch (ArithmeticException e) {
            throw new InvalidQueryInputException("Duration out of range: " + input);
        }
    }

    private static Duration unitDuration(String unit, long value) {
        return switch (unit) {
            case "ns" -> Duration.ofNanos(value);
            case "us", "µs" -> Duration.ofNanos(Math.multiplyExact(value, 1_000L));
            case "ms" -> Duration.ofMillis(value);
            case "s" -> Duration.ofSeconds(value);
            case "m" -> Duration.ofMinutes(value);
            case "h" -> Duration.ofHours(value);
            case "d" -> Duration.ofDays(value);
            case "w" -> Duration.ofDays(Math.multiplyExact(value, 7L));
            default -> throw new InvalidQueryInputException("Unsupported duration unit: " + unit);
        };
    }

    private static String shorthand(Duration d) {
        long nanos = d.toNanos();
        if (nanos == 0) {
            return "0s";
        }
        long[] sizes = {
            Duration.ofDays(7).toNanos(),
            Duration.ofDays(1).toNanos(),
            Duration.ofHours(1).toNanos(),
            Duration.ofMinutes(1).toNanos(),
            Duration.ofSeconds(1).toNanos(),
            Duration.ofMillis(1).toNanos(),
            1_000L,
            1L
        };
        String[] units = {"w", "d", "h", "m", "s", "ms", "us", "ns"};
        for (int i = 0; i < sizes.length; i++) {
            if (nanos % sizes[i] == 0) {
                return (nanos / sizes[i]) + units[i];
            }
        }
        return nanos + "ns";
    }
}
