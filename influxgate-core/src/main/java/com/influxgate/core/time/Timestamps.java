package com.influxgate.core.time;

import com.influxgate.core.error.BackendQueryException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/** Converts backend time encodings to the canonical UTC ISO-8601 text form. */
public final class Timestamps {

    private static final DateTimeFormatter ISO_INSTANT = DateTimeFormatter.ISO_INSTANT;

    private Timestamps() {}

    public static String format(Instant instant) {
        return ISO_INSTANT.format(instant);
    }

    /** Parses an RFC-3339 string (any offset) or a decimal epoch-nanosecond count. */
    public static Instant parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new BackendQueryException("Missing timestamp in backend response");
        }
        String t = raw.trim();
        if (isInteger(t)) {
            return fromEpochNanos(Long.parseLong(t));
        }
        try {
            return OffsetDateTime.parse(t).toInstant();
        } catch (DateTimeParseException e) {
            throw new BackendQueryException("Unparseable timestamp in backend response: " + t);
        }
    }

    public static Instant fromEpochNanos(long nanos) {
        return TimeWindows.fromEpochNanos(nanos);
    }

    /** Canonical text for an RFC-3339 string or epoch-nanosecond value. */
    public static String normalize(String raw) {
        return format(parse(raw));
    }

    private static boolean isInteger(String t) {
        int i = t.startsWith("-") ? 1 : 0;
        if (i == t.length()) {
            return false;
        }
        for (; i < t.length(); i++) {
            if (!Character.isDigit(t.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
