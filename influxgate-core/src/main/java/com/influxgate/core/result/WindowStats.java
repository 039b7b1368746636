package com.influxgate.core.result;

/** Summary statistics of one field over a trailing window. */
public record WindowStats(Double mean, Object min, Object max, Object last, long count, String start, String stop) {}
