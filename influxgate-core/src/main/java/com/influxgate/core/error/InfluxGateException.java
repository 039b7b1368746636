package com.influxgate.core.error;

/**
 * Base of the query engine's error taxonomy.
 *
 * <p>Messages never carry credential values: tokens and passwords do not enter any string the
 * engine builds.
 */
public abstract class InfluxGateException extends RuntimeException {

    protected InfluxGateException(String message) {
        super(message);
    }

    protected InfluxGateException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Whether the caller may retry the same request unchanged. */
    public boolean retryable() {
        return false;
    }
}
