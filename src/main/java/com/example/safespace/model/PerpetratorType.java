package com.example.safespace.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PerpetratorType implements IncidentCategory {
    SUPERVISOR("supervisor"),
    COLLEAGUE("colleague"),
    LECTURER("lecturer"),
    CLIENT("client"),
    STRANGER("stranger");

    private final String value;

    PerpetratorType(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }
}
