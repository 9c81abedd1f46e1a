package com.example.safespace.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TurnRole {
    USER("user"),
    ASSISTANT("assistant");

    private final String value;

    TurnRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
