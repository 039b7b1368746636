package com.influxgate.core.spi;

public enum ProbeStatus {
    OK,
    UNAUTHORIZED,
    NOT_FOUND,
    UNEXPECTED;

    public static ProbeStatus fromHttpStatus(int code) {
        if (code >= 200 && code < 300) {
            return OK;
        }
        if (code == 401 || code == 403) {
            return UNAUTHORIZED;
        }
        if (code == 404) {
            return NOT_FOUND;
        }
        return UNEXPECTED;
    }
}
