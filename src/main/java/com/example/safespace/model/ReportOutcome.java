package com.example.safespace.model;

import java.util.Objects;

/**
 * Result of running narrative generation for a report.
 *
 * <p>The report is always present: its structured fields were committed before generation was
 * attempted. When {@link #generated()} is {@code false} the data is preserved and
 * {@link #failureReason()} tells why the narrative is missing.
 */
public record ReportOutcome(Report report, boolean generated, String failureReason) {

    public ReportOutcome {
        Objects.requireNonNull(report, "report");
    }

    public static ReportOutcome generated(Report report) {
        return new ReportOutcome(report, true, null);
    }

    public static ReportOutcome generationFailed(Report report, String failureReason) {
        return new ReportOutcome(report, false, failureReason);
    }
}
