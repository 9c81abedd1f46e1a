package com.example.safespace.error;

import java.util.UUID;

public class ReportNotFoundException extends RuntimeException {

    public ReportNotFoundException(UUID sessionId) {
        super("No report found for session " + sessionId);
    }
}
