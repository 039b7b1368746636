package com.influxgate.core.query;

import com.influxgate.core.codec.InfluxQlValueCodec;
import com.influxgate.core.codec.ValueCodec;
import com.influxgate.core.dialect.Dialect;
import com.influxgate.core.model.QueryLimits;
import com.influxgate.core.model.QueryModel;
import com.influxgate.core.model.Target;
import com.influxgate.core.time.DurationLiteral;
import com.influxgate.core.time.TimeExpression;
import com.influxgate.core.time.TimeWindows.ResolvedRange;
import com.influxgate.core.time.Timestamps;
import java.time.Clock;
import java.util.Map;

/**
 * Renders InfluxQL statements, e.g.
 *
 *   SELECT max("rssi") FROM "device_status"
 *   WHERE time >= now() - 3d AND time <= now() AND "device_id" = 'xyz-789'
 *   GROUP BY time(1h) fill(none) LIMIT 1000
 *
 * The database travels as a request parameter ({@link BuiltQuery#database()}); a {@code db/rp}
 * target qualifies the measurement with its retention policy.
 */
public final class InfluxQlQueryBuilder implements QueryBuilder {

    private final ValueCodec codec = InfluxQlValueCodec.INSTANCE;
    private final Clock clock;
    private final QueryLimits limits;

    public InfluxQlQueryBuilder(Clock clock, QueryLimits limits) {
        this.clock = clock;
        this.limits = limits;
    }

    @Override
    public BuiltQuery buildListContainers() {
        return BuiltQuery.schema(Dialect.INFLUXQL, "SHOW DATABASES", null, limits.rowCeiling());
    }

    @Override
    public BuiltQuery buildListRetentionPolicies(String database) {
        String q = "SHOW RETENTION POLICIES ON " + codec.quoteIdentifier(database);
        return BuiltQuery.schema(Dialect.INFLUXQL, q, database, limits.rowCeiling());
    }

    @Override
    public BuiltQuery buildListMeasurements(String target) {
        Target t = Target.parse(target);
        return BuiltQuery.schema(Dialect.INFLUXQL, "SHOW MEASUREMENTS", t.container(), limits.rowCeiling());
    }

    @Override
    public BuiltQuery buildListFields(String target, String measurement) {
        Target t = Target.parse(target);
        String q = "SHOW FIELD KEYS FROM " + source(t, measurement);
        return BuiltQuery.schema(Dialect.INFLUXQL, q, t.container(), limits.rowCeiling());
    }

    @Override
    public BuiltQuery buildListTags(String target, String measurement) {
        Target t = Target.parse(target);
        String q = "SHOW TAG KEYS FROM " + source(t, measurement);
        return BuiltQuery.schema(Dialect.INFLUXQL, q, t.container(), limits.rowCeiling());
    }

    @Override
    public BuiltQuery buildListTagValues(String target, String measurement, String tagKey, int maxValues) {
        Target t = Target.parse(target);
        int n = Math.max(1, Math.min(maxValues, limits.rowCeiling()));
        String q = "SHOW TAG VALUES FROM " + source(t, measurement)
                + " WITH KEY = " + codec.quoteIdentifier(tagKey)
                + " LIMIT " + n;
        return BuiltQuery.schema(Dialect.INFLUXQL, q, t.container(), n);
    }

    @Override
    public BuiltQuery buildSeriesQuery(QueryModel model) {
        Target t = model.parsedTarget();
        String measurement = model.requireMeasurement();
        String field = QueryBuilder.requireField(model);
        ResolvedRange range = QueryBuilder.effectiveRange(model, clock);
        int limit = limits.effective(model.limit());

        StringBuilder q = new StringBuilder(256).append("SELECT ");
        if (model.windowed()) {
            q.append(model.aggregate().functionName()).append('(').append(codec.quoteIdentifier(field)).append(')');
        } else {
            q.append(codec.quoteIdentifier(field));
        }
        q.append(" FROM ").append(source(t, measurement))
                .append(" WHERE time >= ").append(render(model.start()))
                .append(" AND time <= ").append(render(model.stop()));
        appendTagPredicates(q, model.tags(), " AND ");
        if (model.windowed()) {
            q.append(" GROUP BY time(").append(model.every().influxQlMagnitude()).append(')')
                    .append(" fill(").append(model.fill().wireValue()).append(')');
        }
        q.append(" LIMIT ").append(limit);

        return new BuiltQuery(
                Dialect.INFLUXQL,
                q.toString(),
                t.container(),
                t.retentionPolicy(),
                field,
                range.start(),
                range.stop(),
                model.aggregate(),
                model.windowed() ? model.every().toFlux() : null,
                limit);
    }

    @Override
    public BuiltQuery buildLastPoint(QueryModel model) {
        Target t = model.parsedTarget();
        String measurement = model.requireMeasurement();
        var now = clock.instant();

        StringBuilder q = new StringBuilder(192).append("SELECT ");
        q.append(model.field() != null ? codec.quoteIdentifier(model.field()) : "*");
        q.append(" FROM ").append(source(t, measurement));
        appendTagPredicates(q, model.tags(), " WHERE ");
        q.append(" GROUP BY * ORDER BY time DESC LIMIT 1");

        return new BuiltQuery(
                Dialect.INFLUXQL, q.toString(), t.container(), t.retentionPolicy(), model.field(), null, now, null, null, 1);
    }

    private String source(Target t, String measurement) {
        if (t.retentionPolicy() != null) {
            return codec.quoteIdentifier(t.retentionPolicy()) + "." + codec.quoteIdentifier(measurement);
        }
        return codec.quoteIdentifier(measurement);
    }

    private void appendTagPredicates(StringBuilder q, Map<String, String> tags, String lead) {
        boolean first = true;
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            q.append(first ? lead : " AND ")
                    .append(codec.quoteIdentifier(tag.getKey()))
                    .append(" = ")
                    .append(codec.quoteLiteral(tag.getValue()));
            first = false;
        }
    }

    private String render(TimeExpression t) {
        if (t instanceof TimeExpression.Relative r) {
            DurationLiteral offset = r.offset();
            return "now() " + (offset.negative() ? "-" : "+") + " " + offset.influxQlMagnitude();
        }
        if (t instanceof TimeExpression.Absolute a) {
            return codec.quoteLiteral(Timestamps.format(a.instant()));
        }
        return "now()";
    }
}
