package com.example.safespace.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Progress of the narrative generation for a report.
 *
 * <p>A report starts as {@link #PENDING_GENERATION} once its structured fields are durably saved.
 * It moves to {@link #GENERATED} exactly once, or to {@link #GENERATION_FAILED} when the
 * collaborator gave up. A failed report can still become {@link #GENERATED} on regeneration.
 */
public enum ReportStatus {
    PENDING_GENERATION("pending_generation"),
    GENERATED("generated"),
    GENERATION_FAILED("generation_failed");

    private final String value;

    ReportStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
