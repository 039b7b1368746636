package com.influxgate.core.result;

public record SeriesPoint(String time, Object value) {}
