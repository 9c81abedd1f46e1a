package com.example.safespace.model;

import java.util.Objects;

/** The five structured fields of an incident report. Immutable once a report is created. */
public record IncidentDetails(
        IncidentLocation location,
        PerpetratorType perpetrator,
        IncidentType description,
        EvidenceType evidence,
        UserGoal userGoal
) {

    public IncidentDetails {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(perpetrator, "perpetrator");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(evidence, "evidence");
        Objects.requireNonNull(userGoal, "userGoal");
    }
}
