package com.influxgate.core.error;

/** A resource URI could not be decoded into a query model. */
public class InvalidResourceUriException extends InfluxGateException {

    public InvalidResourceUriException(String message) {
        super(message);
    }

    public InvalidResourceUriException(String message, Throwable cause) {
        super(message, cause);
    }
}
