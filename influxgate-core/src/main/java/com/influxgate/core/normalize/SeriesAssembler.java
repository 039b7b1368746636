package com.influxgate.core.normalize;

import com.influxgate.core.error.BackendQueryException;
import com.influxgate.core.query.BuiltQuery;
import com.influxgate.core.result.QueryStats;
import com.influxgate.core.result.Series;
import com.influxgate.core.result.SeriesPoint;
import com.influxgate.core.time.Timestamps;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Collects points for one series query, enforcing the query's limit. */
final class SeriesAssembler {

    static final String NO_DATA = "No data found for the specified criteria.";

    private final BuiltQuery query;
    private final List<SeriesPoint> points = new ArrayList<>();
    private boolean truncated;

    SeriesAssembler(BuiltQuery query) {
        this.query = query;
    }

    /** Adds a point unless its value is null. Returns false once the limit is reached. */
    boolean add(Instant time, Object value) {
        if (value == null || time == null) {
            return true;
        }
        if (points.size() >= query.limit()) {
            truncated = true;
            return false;
        }
        points.add(new SeriesPoint(Timestamps.format(time), value));
        return true;
    }

    Series build() {
        QueryStats stats = new QueryStats(
                points.size(),
                query.effectiveStart() == null ? null : Timestamps.format(query.effectiveStart()),
                query.effectiveStop() == null ? null : Timestamps.format(query.effectiveStop()),
                query.aggregate() == null ? null : query.aggregate().functionName(),
                query.every(),
                truncated);
        return new Series(points, stats);
    }

    static BackendQueryException noData() {
        return new BackendQueryException(NO_DATA);
    }

    /** Integral JSON numbers arrive as Integer or BigInteger; values are always Long or Double. */
    static Object widen(Object value) {
        if (value instanceof Integer i) {
            return i.longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        if (value instanceof java.math.BigInteger b) {
            return b.bitLength() < 64 ? (Object) b.longValue() : (Object) b.doubleValue();
        }
        if (value instanceof java.math.BigDecimal d) {
            return d.doubleValue();
        }
        return value;
    }
}
