package com.influxgate.core.query;

import com.influxgate.core.dialect.Dialect;
import com.influxgate.core.model.Aggregate;
import java.time.Instant;

/**
 * A rendered query plus what the normalizer needs to interpret its response. The effective
 * bounds are computed by the builder because not every backend reports them.
 */
public record BuiltQuery(
        Dialect dialect,
        String text,
        String database, // InfluxQL only
        String retentionPolicy, // InfluxQL only
        String field,
        Instant effectiveStart,
        Instant effectiveStop,
        Aggregate aggregate,
        String every,
        int limit) {

    /** A schema-exploration or listing query with no time bounds of its own. */
    public static BuiltQuery schema(Dialect dialect, String text, String database, int limit) {
        return new BuiltQuery(dialect, text, database, null, null, null, null, null, null, limit);
    }
}
