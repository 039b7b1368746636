package com.influxgate.core.dialect;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** The two query languages the engine can speak. */
public enum Dialect {
    /** Pipeline-style language of InfluxDB 2.x; containers are buckets. */
    FLUX,
    /** SQL-like language of InfluxDB 1.x; containers are databases. */
    INFLUXQL;

    /**
     * Resolves a configured version override. Returns {@code null} for {@code auto} or blank,
     * meaning the backend must be probed.
     */
    public static Dialect fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "auto" -> null;
            case "2", "v2", "flux" -> FLUX;
            case "1", "v1", "influxql" -> INFLUXQL;
            default -> throw new IllegalArgumentException("Unsupported InfluxDB version: " + value);
        };
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
