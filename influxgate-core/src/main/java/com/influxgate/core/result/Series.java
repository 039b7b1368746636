package com.influxgate.core.result;

import java.util.List;

public record Series(List<SeriesPoint> series, QueryStats stats) {
    public Series {
        series = List.copyOf(series);
    }
}
