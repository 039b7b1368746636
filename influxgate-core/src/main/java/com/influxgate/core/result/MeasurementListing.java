package com.influxgate.core.result;

import java.util.List;

public record MeasurementListing(List<String> measurements) {
    public MeasurementListing {
        measurements = List.copyOf(measurements);
    }
}
