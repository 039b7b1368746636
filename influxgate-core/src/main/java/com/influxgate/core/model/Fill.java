package com.influxgate.core.model;

import com.influxgate.core.error.InvalidQueryInputException;
import java.util.Locale;

/** How empty aggregation windows are reported. */
public enum Fill {
    /** Empty windows are omitted. */
    NONE,
    /** Empty windows are kept with a null value, which the normalizers then drop. */
    NULL,
    PREVIOUS,
    LINEAR;

    public static Fill fromName(String name) {
        if (name == null || name.isBlank()) {
            return NONE;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "none" -> NONE;
            case "null" -> NULL;
            case "previous" -> PREVIOUS;
            case "linear" -> LINEAR;
            default -> throw new InvalidQueryInputException("Unsupported fill mode: " + name);
        };
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
