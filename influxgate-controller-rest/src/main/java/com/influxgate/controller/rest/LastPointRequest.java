package com.influxgate.controller.rest;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/** Body of {@code POST /api/tools/last-point}. A blank target selects the configured default. */
public record LastPointRequest(
        String target, @NotBlank String measurement, String field, Map<String, String> tags) {}
