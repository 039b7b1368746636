package com.influxgate.controller.rest;

import com.influxgate.core.model.QueryModel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.Map;

/**
 * Body of {@code POST /api/tools/query-timeseries}. Times are ISO-8601 or relative
 * ({@code -24h}); {@code every} and {@code aggregate} go together.
 */
public record QueryTimeseriesRequest(
        String target,
        @NotBlank String measurement,
        @NotBlank String field,
        String start,
        String stop,
        String every,
        String aggregate,
        String fill,
        @Positive Integer limit,
        Map<String, String> tags) {

    QueryModel toModel(String resolvedTarget, String defaultLookback) {
        return QueryModel.builder()
                .target(resolvedTarget)
                .measurement(measurement)
                .field(field)
                .defaultStart(defaultLookback)
                .start(start)
                .stop(stop)
                .every(every)
                .aggregate(aggregate)
                .fill(fill)
                .limit(limit)
                .tags(tags)
                .build();
    }
}
