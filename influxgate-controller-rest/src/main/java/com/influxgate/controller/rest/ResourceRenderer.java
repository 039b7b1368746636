package com.influxgate.controller.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.influxgate.core.result.Series;
import com.influxgate.core.result.SeriesPoint;
import java.util.List;

/**
 * Text form of a resource read: a header, the first points as tab-separated lines, and the full
 * JSON result.
 */
public class ResourceRenderer {

    static final int PREVIEW_POINTS = 20;

    private final ObjectMapper mapper;

    public ResourceRenderer(ObjectMapper mapper) {
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String render(String uri, Series series) {
        StringBuilder out = new StringBuilder(1024);
        out.append("--- Query Results for ").append(uri).append(" ---\n")
                .append("Status: ").append(series.stats().pointsReturned()).append(" points returned");
        if (series.stats().truncated()) {
            out.append(" (truncated to the row limit)");
        }
        out.append('\n')
                .append("Time Range: ")
                .append(series.stats().startEffective())
                .append(" to ")
                .append(series.stats().stopEffective())
                .append('\n');

        List<SeriesPoint> points = series.series();
        for (int i = 0; i < Math.min(PREVIEW_POINTS, points.size()); i++) {
            out.append(points.get(i).time()).append('\t').append(points.get(i).value()).append('\n');
        }
        if (points.size() > PREVIEW_POINTS) {
            out.append("... (truncated, ").append(points.size() - PREVIEW_POINTS).append(" more points)\n");
        }

        out.append("\n--- Full JSON Response ---\n");
        try {
            out.append(mapper.writeValueAsString(series));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize series", e);
        }
        return out.toString();
    }
}
