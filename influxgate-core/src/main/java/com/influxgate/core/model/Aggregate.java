package com.influxgate.core.model;

import com.influxgate.core.error.InvalidQueryInputException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** Aggregation functions both dialects implement under the same name. */
public enum Aggregate {
    MEAN,
    MAX,
    MIN,
    SUM,
    COUNT,
    MEDIAN,
    SPREAD,
    LAST,
    FIRST;

    public static Aggregate fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidQueryInputException("Aggregate function cannot be empty");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (Aggregate a : values()) {
            if (a.name().equals(normalized)) {
                return a;
            }
        }
        throw new InvalidQueryInputException(
                "Unsupported aggregate function: " + name + ". Allowed: " + allowedNames());
    }

    /** Function name as written in either dialect. */
    public String functionName() {
        return name().toLowerCase(Locale.ROOT);
    }

    private static String allowedNames() {
        return Arrays.stream(values()).map(Aggregate::functionName).collect(Collectors.joining(", "));
    }
}
