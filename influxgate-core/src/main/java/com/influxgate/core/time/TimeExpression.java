package com.influxgate.core.time;

import com.influxgate.core.error.InvalidQueryInputException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * One end of a time range: {@code now}, a signed offset relative to now, or an absolute
 * instant.
 *
 * Time shorthands:
 *   now | now()        => current instant
 *   -<n><unit>...      => relative to now, e.g. -15m, -1h30m, +5m
 *   ISO-8601           => absolute; inputs without an offset are UTC
 */
public sealed interface TimeExpression {

    TimeExpression NOW = new Now();

    Instant resolve(Instant now);

    record Now() implements TimeExpression {
        @Override
        public Instant resolve(Instant now) {
            return now;
        }

        @Override
        public String toString() {
            return "now";
        }
    }

    record Relative(DurationLiteral offset) implements TimeExpression {
        @Override
        public Instant resolve(Instant now) {
            return now.plus(offset.offset());
        }

        @Override
        public String toString() {
            return offset.toFlux();
        }
    }

    record Absolute(Instant instant) implements TimeExpression {
        @Override
        public Instant resolve(Instant now) {
            return instant;
        }

        @Override
        public String toString() {
            return instant.toString();
        }
    }

    static TimeExpression parse(String input) {
        if (input == null || input.isBlank()) {
            throw new InvalidQueryInputException("Time expression cannot be empty");
        }
        String t = input.trim();
        String lower = t.toLowerCase(Locale.ROOT);
        if (lower.equals("now") || lower.equals("now()")) {
            return NOW;
        }
        if (t.startsWith("-") || t.startsWith("+")) {
            return new Relative(DurationLiteral.parse(t));
        }
        return new Absolute(parseInstant(t));
    }

    private static Instant parseInstant(String t) {
        try {
            int timeSep = t.indexOf('T') >= 0 ? t.indexOf('T') : t.indexOf('t');
            if (timeSep < 0) {
                return LocalDate.parse(t).atStartOfDay().toInstant(ZoneOffset.UTC);
            }
            String time = t.substring(timeSep + 1);
            boolean hasOffset = time.endsWith("Z") || time.endsWith("z")
                    || time.indexOf('+') >= 0 || time.indexOf('-') >= 0;
            if (hasOffset) {
                return OffsetDateTime.parse(t.toUpperCase(Locale.ROOT)).toInstant();
            }
            return LocalDateTime.parse(t.toUpperCase(Locale.ROOT)).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidQueryInputException(
                    "Invalid time format '" + t + "'. Must be ISO 8601 or relative (e.g., '-7d').");
        }
    }
}
