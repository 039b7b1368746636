package com.influxgate.core.query;

import com.influxgate.core.codec.FluxValueCodec;
import com.influxgate.core.codec.ValueCodec;
import com.influxgate.core.dialect.Dialect;
import com.influxgate.core.model.Fill;
import com.influxgate.core.model.QueryLimits;
import com.influxgate.core.model.QueryModel;
import com.influxgate.core.time.TimeExpression;
import com.influxgate.core.time.TimeWindows.ResolvedRange;
import com.influxgate.core.time.Timestamps;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Renders Flux pipelines:
 *
 *   from(bucket: "iot")
 *     |> range(start: -3d, stop: now())
 *     |> filter(fn: (r) => r["_measurement"] == "device_status")
 *     |> filter(fn: (r) => r["_field"] == "rssi")
 *     |> filter(fn: (r) => r["device_id"] == "xyz-789")
 *     |> aggregateWindow(every: 1h, fn: max, createEmpty: false)
 *     |> limit(n: 1000)
 *     |> yield(name: "results")
 *
 * The whole target is the bucket name.
 */
public final class FluxQueryBuilder implements QueryBuilder {

    static final String FIELD_KEYS_LOOKBACK = "-365d";
    static final String TAG_LOOKBACK = "-30d";
    static final Duration LAST_POINT_LOOKBACK = Duration.ofDays(365);

    private static final String SCHEMA_IMPORT = "import \"influxdata/influxdb/schema\"\n\n";

    private final ValueCodec codec = FluxValueCodec.INSTANCE;
    private final Clock clock;
    private final QueryLimits limits;

    public FluxQueryBuilder(Clock clock, QueryLimits limits) {
        this.clock = clock;
        this.limits = limits;
    }

    @Override
    public BuiltQuery buildListContainers() {
        return BuiltQuery.schema(Dialect.FLUX, "buckets()", null, limits.rowCeiling());
    }

    @Override
    public BuiltQuery buildListRetentionPolicies(String database) {
        return null;
    }

    @Override
    public BuiltQuery buildListMeasurements(String target) {
        String flux = SCHEMA_IMPORT + "schema.measurements(bucket: " + codec.quoteIdentifier(target) + ")";
        return BuiltQuery.schema(Dialect.FLUX, flux, null, limits.rowCeiling());
    }

    @Override
    public BuiltQuery buildListFields(String target, String measurement) {
        String flux = SCHEMA_IMPORT
                + "schema.measurementFieldKeys(\n"
                + "  bucket: " + codec.quoteIdentifier(target) + ",\n"
                + "  measurement: " + codec.quoteLiteral(measurement) + ",\n"
                + "  start: " + FIELD_KEYS_LOOKBACK + "\n"
                + ")";
        return BuiltQuery.schema(Dialect.FLUX, flux, null, limits.rowCeiling());
    }

    @Override
    public BuiltQuery buildListTags(String target, String measurement) {
        String flux = SCHEMA_IMPORT
                + "schema.measurementTagKeys(\n"
                + "  bucket: " + codec.quoteIdentifier(target) + ",\n"
                + "  measurement: " + codec.quoteLiteral(measurement) + ",\n"
                + "  start: " + TAG_LOOKBACK + "\n"
                + ")";
        return BuiltQuery.schema(Dialect.FLUX, flux, null, limits.rowCeiling());
    }

    @Override
    public BuiltQuery buildListTagValues(String target, String measurement, String tagKey, int maxValues) {
        int n = Math.max(1, Math.min(maxValues, limits.rowCeiling()));
        String flux = SCHEMA_IMPORT
                + "schema.measurementTagValues(\n"
                + "  bucket: " + codec.quoteIdentifier(target) + ",\n"
                + "  measurement: " + codec.quoteLiteral(measurement) + ",\n"
                + "  tag: " + codec.quoteLiteral(tagKey) + ",\n"
                + "  start: " + TAG_LOOKBACK + "\n"
                + ")\n"
                + "  |> limit(n: " + n + ")";
        return BuiltQuery.schema(Dialect.FLUX, flux, null, n);
    }

    @Override
    public BuiltQuery buildSeriesQuery(QueryModel model) {
        String measurement = model.requireMeasurement();
        String field = QueryBuilder.requireField(model);
        ResolvedRange range = QueryBuilder.effectiveRange(model, clock);
        int limit = limits.effective(model.limit());

        StringBuilder flux = new StringBuilder(512);
        if (model.windowed() && model.fill() == Fill.LINEAR) {
            flux.append("import \"interpolate\"\n\n");
        }
        flux.append("from(bucket: ").append(codec.quoteIdentifier(model.target())).append(")\n")
                .append("  |> range(start: ")
                .append(render(model.start()))
                .append(", stop: ")
                .append(render(model.stop()))
                .append(")\n");
        appendFilters(flux, measurement, field, model.tags());

        if (model.windowed()) {
            String every = model.every().toFlux();
            boolean createEmpty = model.fill() == Fill.NULL || model.fill() == Fill.PREVIOUS;
            flux.append("  |> aggregateWindow(every: ")
                    .append(every)
                    .append(", fn: ")
                    .append(model.aggregate().functionName())
                    .append(", createEmpty: ")
                    .append(createEmpty)
                    .append(")\n");
            if (model.fill() == Fill.PREVIOUS) {
                flux.append("  |> fill(usePrevious: true)\n");
            } else if (model.fill() == Fill.LINEAR) {
                flux.append("  |> interpolate.linear(every: ").append(every).append(")\n");
            }
        }

        flux.append("  |> limit(n: ").append(limit).append(")\n")
                .append("  |> yield(name: \"results\")");

        return new BuiltQuery(
                Dialect.FLUX,
                flux.toString(),
                null,
                null,
                field,
                range.start(),
                range.stop(),
                model.aggregate(),
                model.windowed() ? model.every().toFlux() : null,
                limit);
    }

    @Override
    public BuiltQuery buildLastPoint(QueryModel model) {
        String measurement = model.requireMeasurement();
        var now = clock.instant();

        StringBuilder flux = new StringBuilder(384);
        flux.append("from(bucket: ").append(codec.quoteIdentifier(model.target())).append(")\n")
                .append("  |> range(start: -")
                .append(LAST_POINT_LOOKBACK.toDays())
                .append("d)\n");
        appendFilters(flux, measurement, model.field(), model.tags());
        flux.append("  |> last()\n")
                .append("  |> group()\n")
                .append("  |> sort(columns: [\"_time\"], desc: true)\n")
                .append("  |> limit(n: 1)");

        return new BuiltQuery(
                Dialect.FLUX, flux.toString(), null, null, model.field(), now.minus(LAST_POINT_LOOKBACK), now, null, null, 1);
    }

    private void appendFilters(StringBuilder flux, String measurement, String field, Map<String, String> tags) {
        flux.append("  |> filter(fn: (r) => r[\"_measurement\"] == ")
                .append(codec.quoteLiteral(measurement))
                .append(")\n");
        if (field != null) {
            flux.append("  |> filter(fn: (r) => r[\"_field\"] == ")
                    .append(codec.quoteLiteral(field))
                    .append(")\n");
        }
        if (!tags.isEmpty()) {
            flux.append("  |> filter(fn: (r) => ");
            boolean first = true;
            for (Map.Entry<String, String> tag : tags.entrySet()) {
                if (!first) flux.append(" and ");
                flux.append("r[")
                        .append(codec.quoteIdentifier(tag.getKey()))
                        .append("] == ")
                        .append(codec.quoteLiteral(tag.getValue()));
                first = false;
            }
            flux.append(")\n");
        }
    }

    private static String render(TimeExpression t) {
        if (t instanceof TimeExpression.Relative r) {
            return r.offset().toFlux();
        }
        if (t instanceof TimeExpression.Absolute a) {
            return Timestamps.format(a.instant());
        }
        return "now()";
    }
}
