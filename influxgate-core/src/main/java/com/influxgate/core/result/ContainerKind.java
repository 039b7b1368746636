package com.influxgate.core.result;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ContainerKind {
    BUCKET("bucket"),
    DATABASE("db");

    private final String wireValue;

    ContainerKind(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
