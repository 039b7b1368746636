package com.influxgate.core.result;

import java.util.List;

public record ContainerListing(List<ContainerInfo> results) {
    public ContainerListing {
        results = List.copyOf(results);
    }
}
