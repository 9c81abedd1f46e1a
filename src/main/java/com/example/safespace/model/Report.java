package com.example.safespace.model;

import java.time.Instant;
import java.util.UUID;

public record Report(
        UUID id,
        UUID sessionId,
        IncidentDetails details,
        ReportStatus status,
        String generatedDocument,
        Instant createdAt
) {

    public boolean isGenerated() {
        return status == ReportStatus.GENERATED;
    }
}
