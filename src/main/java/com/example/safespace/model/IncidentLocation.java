package com.example.safespace.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Where the incident took place. */
public enum IncidentLocation implements IncidentCategory {
    PUBLIC_SPACE("public space"),
    ONLINE("online"),
    KAMPUS("kampus"),
    SEKOLAH("sekolah"),
    WORKPLACE("workplace");

    private final String value;

    IncidentLocation(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }
}
