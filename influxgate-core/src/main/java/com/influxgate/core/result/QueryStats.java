package com.influxgate.core.result;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Statistics of one series query. {@code pointsReturned} counts what was returned after
 * truncation, never what was requested.
 */
public record QueryStats(
        @JsonProperty("points_returned") int pointsReturned,
        @JsonProperty("start_effective") String startEffective,
        @JsonProperty("stop_effective") String stopEffective,
        @JsonProperty("aggregate_function") String aggregateFunction,
        @JsonProperty("downsample_interval") String downsampleInterval,
        boolean truncated) {}
