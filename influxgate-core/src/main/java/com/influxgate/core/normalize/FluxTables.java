package com.influxgate.core.normalize;

import com.influxgate.core.error.BackendQueryException;
import com.influxgate.core.time.Timestamps;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvException;
import java.io.IOException;
import java.io.StringReader;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reader for Flux annotated CSV. A response is a sequence of blocks; each block is an optional
 * run of {@code #datatype}, {@code #group} and {@code #default} annotation rows, one header row
 * and its records, and blocks are separated by blank lines. Columns are addressed by header name.
 * Quoting follows RFC 4180, so backslashes in values are literal.
 *
 *   #datatype,string,long,dateTime:RFC3339,double,string
 *   #group,false,false,false,false,true
 *   #default,results,,,,
 *   ,result,table,_time,_value,_field
 *   ,,0,2024-01-01T00:00:00Z,42.5,rssi
 */
final class FluxTables {

    /** Columns every Flux table carries that are neither tags nor values. */
    private static final Set<String> ANNOTATION_COLUMNS = Set.of("", "result", "table");

    private FluxTables() {}

    /** One record of one table, values typed from the block's {@code #datatype} row. */
    record Row(long table, Map<String, Object> values) {

        Object get(String column) {
            return values.get(column);
        }

        String string(String column) {
            Object v = values.get(column);
            return v == null ? null : v.toString();
        }

        Instant time() {
            Object v = values.get("_time");
            return v instanceof Instant i ? i : null;
        }

        /** Columns that are not reserved ({@code _}-prefixed) or annotation columns. */
        Map<String, String> tags() {
            Map<String, String> tags = new LinkedHashMap<>();
            values.forEach((k, v) -> {
                if (!k.startsWith("_") && !ANNOTATION_COLUMNS.contains(k) && v != null) {
                    tags.put(k, v.toString());
                }
            });
            return tags;
        }
    }

    static List<Row> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        List<String[]> lines;
        try (CSVReader reader = new CSVReaderBuilder(new StringReader(raw))
                .withCSVParser(new RFC4180ParserBuilder().build())
                .build()) {
            lines = reader.readAll();
        } catch (IOException | CsvException e) {
            throw new BackendQueryException("Malformed annotated CSV in backend response");
        }

        List<Row> rows = new ArrayList<>();
        String[] datatypes = null;
        String[] defaults = null;
        String[] header = null;
        for (String[] line : lines) {
            if (isBlank(line)) {
                datatypes = null;
                defaults = null;
                header = null;
                continue;
            }
            if (line[0].startsWith("#")) {
                if (header != null) {
                    // annotations of the next block without a separating blank line
                    datatypes = null;
                    defaults = null;
                    header = null;
                }
                switch (line[0]) {
                    case "#datatype" -> datatypes = line;
                    case "#default" -> defaults = line;
                    default -> {
                        // #group carries nothing the normalizers use
                    }
                }
                continue;
            }
            if (header == null) {
                header = line;
                continue;
            }
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 0; i < header.length; i++) {
                String column = header[i];
                if (column.isEmpty() && i == 0) {
                    continue;
                }
                String cell = i < line.length ? line[i] : "";
                if (cell.isEmpty() && defaults != null && i < defaults.length) {
                    cell = defaults[i];
                }
                String type = datatypes != null && i < datatypes.length ? datatypes[i] : "string";
                values.put(column, convert(cell, type));
            }
            if (isErrorHeader(header)) {
                Object message = values.get("error");
                throw new BackendQueryException("Flux query failed: " + (message == null ? "unknown error" : message));
            }
            Object table = values.get("table");
            rows.add(new Row(table instanceof Long l ? l : 0L, Collections.unmodifiableMap(values)));
        }
        return rows;
    }

    private static boolean isBlank(String[] line) {
        if (line.length == 0) {
            return true;
        }
        for (String cell : line) {
            if (cell != null && !cell.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * An error table has exactly the columns {@code error} and optionally {@code reference}
     * besides the leading annotation column. A data table with an {@code error} tag is not one.
     */
    private static boolean isErrorHeader(String[] header) {
        List<String> columns = new ArrayList<>();
        for (String column : header) {
            if (!column.isEmpty()) {
                columns.add(column);
            }
        }
        return columns.equals(List.of("error")) || columns.equals(List.of("error", "reference"));
    }

    static Object convert(String cell, String type) {
        if (cell == null || cell.isEmpty()) {
            return null;
        }
        try {
            return switch (type) {
                case "long" -> Long.parseLong(cell);
                case "unsignedLong" -> parseUnsigned(cell);
                case "double" -> parseDouble(cell);
                case "boolean" -> Boolean.parseBoolean(cell);
                case "dateTime:RFC3339", "dateTime:RFC3339Nano", "dateTime" -> Timestamps.parse(cell);
                default -> cell;
            };
        } catch (NumberFormatException e) {
            throw new BackendQueryException("Unparseable " + type + " value in backend response");
        }
    }

    private static Object parseUnsigned(String cell) {
        long v = Long.parseUnsignedLong(cell);
        return v >= 0 ? (Object) v : (Object) Double.parseDouble(cell);
    }

    private static Double parseDouble(String cell) {
        return switch (cell) {
            case "+Inf", "Inf" -> Double.POSITIVE_INFINITY;
            case "-Inf" -> Double.NEGATIVE_INFINITY;
            default -> Double.parseDouble(cell);
        };
    }
}
