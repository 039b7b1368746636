package com.influxgate.core.spi;

/** Read-only endpoints used to detect the server dialect. */
public enum ProbeEndpoint {
    /** {@code GET /api/v2/ready}, unauthenticated. */
    FLUX_READY,
    /** {@code GET /api/v2/buckets?limit=1}, authenticated. */
    FLUX_BUCKETS,
    /** {@code GET /ping}, unauthenticated. */
    INFLUXQL_PING,
    /** {@code SHOW DATABASES} against {@code /query}, authenticated. */
    INFLUXQL_DATABASES
}
