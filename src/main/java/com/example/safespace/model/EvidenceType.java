package com.example.safespace.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EvidenceType implements IncidentCategory {
    MESSAGES("messages"),
    EMAILS("emails"),
    WITNESS("witness"),
    NONE("none");

    private final String value;

    EvidenceType(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }
}
