package com.influxgate.core.engine;

import com.influxgate.core.model.QueryLimits;
import java.time.Duration;

/**
 * Tunables of the query engine.
 *
 * @param limits row ceiling and default limit
 * @param requestTimeout timeout handed to the backend for every call
 * @param maxTagValues number of sample values listed per tag key
 * @param defaultLookback start used when a request names none
 * @param defaultBucket target used for Flux requests that name none, may be null
 * @param defaultDatabase target ({@code db} or {@code db/rp}) used for InfluxQL requests that name none, may be null
 */
public record EngineSettings(
        QueryLimits limits,
        Duration requestTimeout,
        int maxTagValues,
        String defaultLookback,
        String defaultBucket,
        String defaultDatabase) {

    public static final EngineSettings DEFAULTS =
            new EngineSettings(QueryLimits.DEFAULTS, Duration.ofSeconds(30), 100, "-1h", null, null);

    public EngineSettings {
        if (limits == null) limits = QueryLimits.DEFAULTS;
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (maxTagValues <= 0) {
            throw new IllegalArgumentException("maxTagValues must be positive");
        }
        if (defaultLookback == null || defaultLookback.isBlank()) defaultLookback = "-1h";
    }
}
