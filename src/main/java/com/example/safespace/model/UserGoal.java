package com.example.safespace.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** What the reporting person wants to achieve right now. */
public enum UserGoal implements IncidentCategory {
    UNDERSTAND_RISK("understand the risk"),
    DOCUMENT_SAFELY("document safely"),
    CONSIDER_REPORTING("consider reporting"),
    EXPLORE_OPTIONS("explore options");

    private final String value;

    UserGoal(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }
}
