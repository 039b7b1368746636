package com.influxgate.core.error;

/** The backend accepted the request but rejected the query itself, or returned no usable data. */
public class BackendQueryException extends InfluxGateException {

    private final int status;

    public BackendQueryException(String message) {
        this(message, 0);
    }

    public BackendQueryException(String message, int status) {
        super(message);
        this.status = status;
    }

    /** HTTP status reported by the backend, or 0 when the error came from the response body. */
    public int status() {
        return status;
    }
}
