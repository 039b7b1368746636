package com.influxgate.core.error;

/** Version detection reached the backend but could not classify it. */
public class UnknownVersionException extends InfluxGateException {

    public UnknownVersionException(String message) {
        super(message);
    }
}
