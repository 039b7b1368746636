package com.influxgate.core.result;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.influxgate.core.dialect.Dialect;
import java.util.List;

/** Outcome of a connectivity check: the detected dialect and a few containers. */
public record ProbeReport(Dialect dialect, @JsonProperty("sample_containers") List<ContainerInfo> sampleContainers) {
    public ProbeReport {
        sampleContainers = List.copyOf(sampleContainers);
    }
}
