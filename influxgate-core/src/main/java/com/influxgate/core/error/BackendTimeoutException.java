package com.influxgate.core.error;

/** The backend did not answer within the caller-supplied timeout, or the call was cancelled. */
public class BackendTimeoutException extends InfluxGateException {

    public BackendTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
