package com.influxgate.core.error;

/** A query parameter, identifier or value was rejected before any backend call. */
public class InvalidQueryInputException extends InfluxGateException {

    public InvalidQueryInputException(String message) {
        super(message);
    }
}
