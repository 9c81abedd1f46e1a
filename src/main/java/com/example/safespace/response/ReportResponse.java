package com.example.safespace.response;

import com.example.safespace.model.EvidenceType;
import com.example.safespace.model.IncidentDetails;
import com.example.safespace.model.IncidentLocation;
import com.example.safespace.model.IncidentType;
import com.example.safespace.model.PerpetratorType;
import com.example.safespace.model.Report;
import com.example.safespace.model.ReportStatus;
import com.example.safespace.model.UserGoal;

import java.time.Instant;
import java.util.UUID;

public record ReportResponse(
        UUID id,
        UUID sessionId,
        IncidentLocation location,
        PerpetratorType perpetrator,
        IncidentType description,
        EvidenceType evidence,
        UserGoal userGoal,
        ReportStatus status,
        String generatedDocument,
        Instant createdAt
) {

    public static ReportResponse from(Report report) {
        IncidentDetails details = report.details();
        return new ReportResponse(
                report.id(),
                report.sessionId(),
                details.location(),
                details.perpetrator(),
                details.description(),
                details.evidence(),
                details.userGoal(),
                report.status(),
                report.generatedDocument(),
                report.createdAt());
    }
}
