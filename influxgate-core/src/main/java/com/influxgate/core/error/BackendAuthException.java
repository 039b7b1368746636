package com.influxgate.core.error;

/** The backend rejected the configured credentials. */
public class BackendAuthException extends InfluxGateException {

    private final int status;

    public BackendAuthException(String message, int status) {
        super(message);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
