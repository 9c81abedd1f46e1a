package com.example.safespace.request;

/**
 * Incident form as submitted. Values stay raw strings here so that anything outside the closed
 * sets is rejected with a field-level reason instead of a generic parse failure.
 */
public record ReportRequest(
        String location,
        String perpetrator,
        String description,
        String evidence,
        String userGoal
) {
}
