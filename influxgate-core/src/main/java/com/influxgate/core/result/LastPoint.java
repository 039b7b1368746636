package com.influxgate.core.result;

import java.util.Map;

/** Most recent value of a series. {@code value} is a Long, Double, Boolean or String. */
public record LastPoint(String time, Object value, String field, Map<String, String> tags) {
    public LastPoint {
        tags = Map.copyOf(tags);
    }
}
