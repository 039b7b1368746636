package com.influxgate.core.result;

import java.util.List;

public record FieldListing(List<FieldInfo> fields) {
    public FieldListing {
        fields = List.copyOf(fields);
    }

    /** A field key; {@code type} is only known for the SQL-like dialect. */
    public record FieldInfo(String name, String type) {}
}
