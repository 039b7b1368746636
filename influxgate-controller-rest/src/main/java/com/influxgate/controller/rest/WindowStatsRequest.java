package com.influxgate.controller.rest;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/** Body of {@code POST /api/tools/window-stats}; {@code window} is a trailing duration such as {@code -24h}. */
public record WindowStatsRequest(
        String target,
        @NotBlank String measurement,
        @NotBlank String field,
        @NotBlank String window,
        Map<String, String> tags) {}
