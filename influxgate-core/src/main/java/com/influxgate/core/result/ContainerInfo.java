package com.influxgate.core.result;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A bucket, or a database (optionally {@code db/rp} with its retention policy as {@code duration/replicaN}). */
public record ContainerInfo(String name, ContainerKind kind, @JsonProperty("retention_policy") String retentionPolicy) {}
