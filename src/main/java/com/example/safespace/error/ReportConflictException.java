package com.example.safespace.error;

import java.util.UUID;

/** A report already exists for the session, or its narrative was already generated. */
public class ReportConflictException extends RuntimeException {

    private final UUID reportId;

    public ReportConflictException(String message, UUID reportId) {
        super(message);
        this.reportId = reportId;
    }

    public UUID getReportId() {
        return reportId;
    }
}
