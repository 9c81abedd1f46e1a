package com.example.safespace.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Nature of the incident, submitted as {@code description}. */
public enum IncidentType implements IncidentCategory {
    INAPPROPRIATE_COMMENTS("inappropriate comments"),
    UNWANTED_PHYSICAL_TOUCH("unwanted physical touch"),
    REPEATED_PRESSURE("repeated pressure"),
    THREAT_OR_COERCION("threat or coercion"),
    DIGITAL_HARASSMENT("digital harassment");

    private final String value;

    IncidentType(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }
}
