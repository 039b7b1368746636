package com.influxgate.core.normalize;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.influxgate.core.error.BackendQueryException;
import com.influxgate.core.query.BuiltQuery;
import com.influxgate.core.result.ContainerInfo;
import com.influxgate.core.result.ContainerKind;
import com.influxgate.core.result.FieldListing.FieldInfo;
import com.influxgate.core.result.LastPoint;
import com.influxgate.core.result.Series;
import com.influxgate.core.time.Timestamps;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Normalizes the JSON envelope of the {@code /query} endpoint:
 *
 *   {"results":[{"statement_id":0,"series":[
 *     {"name":"device_status","tags":{"device_id":"abc"},"columns":["time","max"],"values":[[...]]}]}]}
 *
 * A statement error or a top-level {@code error} fails the whole response.
 */
public final class InfluxQlResultNormalizer implements ResultNormalizer {

    private static final String TIME = "time";

    private final ObjectMapper mapper;

    public InfluxQlResultNormalizer() {
        this(new ObjectMapper());
    }

    public InfluxQlResultNormalizer(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, false);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Envelope(List<Statement> results, String error) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Statement(@JsonProperty("statement_id") Integer statementId, List<SeriesBlock> series, String error) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SeriesBlock(String name, Map<String, String> tags, List<String> columns, List<List<Object>> values) {

        int column(String name) {
            return columns == null ? -1 : columns.indexOf(name);
        }

        List<List<Object>> rows() {
            return values == null ? List.of() : values;
        }

        Map<String, String> tagMap() {
            return tags == null ? Map.of() : tags;
        }
    }

    @Override
    public List<ContainerInfo> normalizeContainers(String raw) {
        List<ContainerInfo> out = new ArrayList<>();
        for (String name : firstColumn(raw, "name")) {
            out.add(new ContainerInfo(name, ContainerKind.DATABASE, null));
        }
        return out;
    }

    @Override
    public List<ContainerInfo> normalizeRetentionPolicies(String database, String raw) {
        List<ContainerInfo> out = new ArrayList<>();
        for (SeriesBlock block : blocks(raw)) {
            int name = block.column("name");
            int duration = block.column("duration");
            int replicaN = block.column("replicaN");
            if (name < 0) {
                continue;
            }
            for (List<Object> row : block.rows()) {
                Object rp = cell(row, name);
                if (rp == null) {
                    continue;
                }
                String policy = cell(row, duration) + "/" + cell(row, replicaN);
                out.add(new ContainerInfo(database + "/" + rp, ContainerKind.DATABASE, policy));
            }
        }
        if (out.isEmpty()) {
            out.add(new ContainerInfo(database, ContainerKind.DATABASE, null));
        }
        return out;
    }

    @Override
    public List<String> normalizeMeasurements(String raw) {
        return firstColumn(raw, "name");
    }

    @Override
    public List<FieldInfo> normalizeFields(String raw) {
        Map<String, FieldInfo> out = new LinkedHashMap<>();
        for (SeriesBlock block : blocks(raw)) {
            int key = block.column("fieldKey");
            int type = block.column("fieldType");
            for (List<Object> row : block.rows()) {
                Object name = cell(row, key);
                if (name != null) {
                    Object t = cell(row, type);
                    out.putIfAbsent(name.toString(), new FieldInfo(name.toString(), t == null ? null : t.toString()));
                }
            }
        }
        return new ArrayList<>(out.values());
    }

    @Override
    public List<String> normalizeTagKeys(String raw) {
        List<String> out = new ArrayList<>();
        for (String key : firstColumn(raw, "tagKey")) {
            if (!key.startsWith("_")) {
                out.add(key);
            }
        }
        return out;
    }

    @Override
    public List<String> normalizeTagValues(String raw) {
        return firstColumn(raw, "value");
    }

    @Override
    public Series normalizeSeries(String raw, BuiltQuery query) {
        SeriesAssembler assembler = new SeriesAssembler(query);
        String valueColumn = query.aggregate() != null ? query.aggregate().functionName() : query.field();
        outer:
        for (SeriesBlock block : blocks(raw)) {
            int time = block.column(TIME);
            int value = block.column(valueColumn);
            if (value < 0) {
                value = soleValueColumn(block);
            }
            if (time < 0 || value < 0) {
                continue;
            }
            for (List<Object> row : block.rows()) {
                if (!assembler.add(time(cell(row, time)), SeriesAssembler.widen(cell(row, value)))) {
                    break outer;
                }
            }
        }
        return assembler.build();
    }

    @Override
    public LastPoint normalizeLastPoint(String raw, BuiltQuery query) {
        LastPoint newest = null;
        Instant newestTime = null;
        for (SeriesBlock block : blocks(raw)) {
            int time = block.column(TIME);
            if (time < 0) {
                continue;
            }
            for (List<Object> row : block.rows()) {
                Instant t = time(cell(row, time));
                if (t == null || (newestTime != null && !t.isAfter(newestTime))) {
                    continue;
                }
                LastPoint candidate = lastPoint(block, row, t, query.field());
                if (candidate != null) {
                    newest = candidate;
                    newestTime = t;
                }
            }
        }
        if (newest == null) {
            throw SeriesAssembler.noData();
        }
        return newest;
    }

    private static LastPoint lastPoint(SeriesBlock block, List<Object> row, Instant time, String field) {
        String valueColumn = field;
        if (valueColumn == null) {
            // first non-null value column in name order
            Set<String> names = new TreeSet<>(block.columns());
            names.remove(TIME);
            for (String name : names) {
                if (cell(row, block.column(name)) != null) {
                    valueColumn = name;
                    break;
                }
            }
        }
        if (valueColumn == null) {
            return null;
        }
        Object value = cell(row, block.column(valueColumn));
        if (value == null) {
            return null;
        }
        Map<String, String> tags = new LinkedHashMap<>(block.tagMap());
        if (field != null) {
            for (int i = 0; i < block.columns().size(); i++) {
                String column = block.columns().get(i);
                Object v = cell(row, i);
                if (!TIME.equals(column) && !column.equals(valueColumn) && v instanceof String s) {
                    tags.putIfAbsent(column, s);
                }
            }
        }
        return new LastPoint(Timestamps.format(time), SeriesAssembler.widen(value), valueColumn, tags);
    }

    /** When the value column cannot be named, a block with a single non-time column uses it. */
    private static int soleValueColumn(SeriesBlock block) {
        if (block.columns() == null || block.columns().size() != 2) {
            return -1;
        }
        return TIME.equals(block.columns().get(0)) ? 1 : TIME.equals(block.columns().get(1)) ? 0 : -1;
    }

    private static Instant time(Object raw) {
        if (raw == null) {
            return null;
        }
        return Timestamps.parse(raw.toString());
    }

    private static Object cell(List<Object> row, int index) {
        return index < 0 || index >= row.size() ? null : row.get(index);
    }

    /** Distinct string values of the named column across all series. */
    private List<String> firstColumn(String raw, String column) {
        Set<String> out = new LinkedHashSet<>();
        for (SeriesBlock block : blocks(raw)) {
            int index = block.column(column);
            if (index < 0) {
                continue;
            }
            for (List<Object> row : block.rows()) {
                Object v = cell(row, index);
                if (v != null) {
                    out.add(v.toString());
                }
            }
        }
        return new ArrayList<>(out);
    }

    private List<SeriesBlock> blocks(String raw) {
        Envelope envelope = parse(raw);
        if (envelope.error() != null) {
            throw new BackendQueryException("InfluxQL query failed: " + envelope.error());
        }
        List<SeriesBlock> out = new ArrayList<>();
        if (envelope.results() == null) {
            return out;
        }
        for (Statement statement : envelope.results()) {
            if (statement.error() != null) {
                throw new BackendQueryException("InfluxQL query failed: " + statement.error());
            }
            if (statement.series() != null) {
                out.addAll(statement.series());
            }
        }
        return out;
    }

    private Envelope parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return new Envelope(List.of(), null);
        }
        try {
            return mapper.readValue(raw, Envelope.class);
        } catch (JsonProcessingException e) {
            throw new BackendQueryException("Malformed JSON in backend response");
        }
    }
}
