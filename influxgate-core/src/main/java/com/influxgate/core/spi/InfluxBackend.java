package com.influxgate.core.spi;

import com.influxgate.core.query.BuiltQuery;
import java.io.Closeable;
import java.time.Duration;

/**
 * Transport to one InfluxDB server. Implementations own the credentials; nothing above this
 * interface ever sees them.
 */
public interface InfluxBackend extends Closeable {

    /**
     * Calls one probe endpoint. Returns the classified HTTP outcome; throws
     * {@link com.influxgate.core.error.BackendConnectionException} or
     * {@link com.influxgate.core.error.BackendTimeoutException} when no response arrives.
     */
    ProbeStatus probe(ProbeEndpoint endpoint);

    /**
     * Executes a built query and returns the raw response body: annotated CSV for Flux, JSON for
     * InfluxQL.
     *
     * @throws com.influxgate.core.error.BackendAuthException on 401/403
     * @throws com.influxgate.core.error.BackendQueryException on any other non-2xx status
     * @throws com.influxgate.core.error.BackendConnectionException when the server is unreachable
     * @throws com.influxgate.core.error.BackendTimeoutException when {@code timeout} elapses
     */
    String execute(BuiltQuery query, Duration timeout);

    @Override
    default void close() {}
}
