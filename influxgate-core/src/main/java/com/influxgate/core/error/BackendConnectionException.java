package com.influxgate.core.error;

/** The backend could not be reached. */
public class BackendConnectionException extends InfluxGateException {

    public BackendConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
