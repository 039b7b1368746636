package com.influxgate.core.normalize;

import com.influxgate.core.normalize.FluxTables.Row;
import com.influxgate.core.query.BuiltQuery;
import com.influxgate.core.result.ContainerInfo;
import com.influxgate.core.result.ContainerKind;
import com.influxgate.core.result.FieldListing.FieldInfo;
import com.influxgate.core.result.LastPoint;
import com.influxgate.core.result.Series;
import com.influxgate.core.time.Timestamps;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Normalizes Flux annotated CSV. */
public final class FluxResultNormalizer implements ResultNormalizer {

    public static final FluxResultNormalizer INSTANCE = new FluxResultNormalizer();

    private FluxResultNormalizer() {}

    @Override
    public List<ContainerInfo> normalizeContainers(String raw) {
        List<ContainerInfo> out = new ArrayList<>();
        for (Row row : FluxTables.parse(raw)) {
            String name = row.string("name");
            if (name != null) {
                out.add(new ContainerInfo(name, ContainerKind.BUCKET, retention(row.get("retentionPeriod"))));
            }
        }
        return out;
    }

    @Override
    public List<ContainerInfo> normalizeRetentionPolicies(String database, String raw) {
        return List.of(new ContainerInfo(database, ContainerKind.BUCKET, null));
    }

    @Override
    public List<String> normalizeMeasurements(String raw) {
        return values(raw);
    }

    @Override
    public List<FieldInfo> normalizeFields(String raw) {
        List<FieldInfo> out = new ArrayList<>();
        for (String name : values(raw)) {
            out.add(new FieldInfo(name, null));
        }
        return out;
    }

    @Override
    public List<String> normalizeTagKeys(String raw) {
        List<String> out = new ArrayList<>();
        for (String key : values(raw)) {
            if (!key.startsWith("_")) {
                out.add(key);
            }
        }
        return out;
    }

    @Override
    public List<String> normalizeTagValues(String raw) {
        return values(raw);
    }

    @Override
    public Series normalizeSeries(String raw, BuiltQuery query) {
        SeriesAssembler assembler = new SeriesAssembler(query);
        for (Row row : FluxTables.parse(raw)) {
            if (!assembler.add(row.time(), row.get("_value"))) {
                break;
            }
        }
        return assembler.build();
    }

    @Override
    public LastPoint normalizeLastPoint(String raw, BuiltQuery query) {
        Row newest = null;
        for (Row row : FluxTables.parse(raw)) {
            if (row.get("_value") == null || row.time() == null) {
                continue;
            }
            if (newest == null || row.time().isAfter(newest.time())) {
                newest = row;
            }
        }
        if (newest == null) {
            throw SeriesAssembler.noData();
        }
        String field = newest.string("_field");
        return new LastPoint(
                Timestamps.format(newest.time()),
                newest.get("_value"),
                field != null ? field : query.field(),
                newest.tags());
    }

    /** Distinct {@code _value} strings in response order. */
    private static List<String> values(String raw) {
        Set<String> out = new LinkedHashSet<>();
        for (Row row : FluxTables.parse(raw)) {
            String v = row.string("_value");
            if (v != null) {
                out.add(v);
            }
        }
        return new ArrayList<>(out);
    }

    /** Bucket retention as a duration literal; zero means the bucket keeps data forever. */
    private static String retention(Object nanos) {
        if (!(nanos instanceof Long n)) {
            return null;
        }
        if (n <= 0) {
            return "infinite";
        }
        Duration d = Duration.ofNanos(n);
        if (d.toHours() > 0 && d.equals(Duration.ofHours(d.toHours()))) {
            return d.toHours() + "h";
        }
        return d.getSeconds() + "s";
    }
}
