package com.example.safespace.controller;

import com.example.safespace.error.ReportConflictException;
import com.example.safespace.error.StoreUnavailableException;
import com.example.safespace.model.ReportOutcome;
import com.example.safespace.response.ApiError;
import com.example.safespace.error.ValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/** Builds the response entities the controllers share, success and error alike. */
final class ApiResponses {

    private ApiResponses() {
    }

    static ResponseEntity<Object> of(HttpStatus status, Object body) {
        return ResponseEntity.status(status).body(body);
    }

    static ResponseEntity<Object> notFound(RuntimeException ex) {
        return of(HttpStatus.NOT_FOUND, ApiError.of("not_found", ex.getMessage()));
    }

    static ResponseEntity<Object> validation(ValidationException ex) {
        return of(HttpStatus.UNPROCESSABLE_ENTITY, ApiError.builder()
                .error("validation_error")
                .message("Request validation failed")
                .details(ex.getReasons())
                .build());
    }

    static ResponseEntity<Object> conflict(ReportConflictException ex) {
        return of(HttpStatus.CONFLICT, ApiError.builder()
                .error("conflict")
                .message(ex.getMessage())
                .reportId(ex.getReportId())
                .build());
    }

    static ResponseEntity<Object> unavailable(StoreUnavailableException ex) {
        return of(HttpStatus.SERVICE_UNAVAILABLE, ApiError.of("service_unavailable", ex.getMessage()));
    }

    static ResponseEntity<Object> generationFailed(ReportOutcome outcome) {
        return of(HttpStatus.INTERNAL_SERVER_ERROR, ApiError.builder()
                .error("generation_failed")
                .message(outcome.failureReason())
                .dataPreserved(true)
                .reportId(outcome.report().id())
                .build());
    }

    static ResponseEntity<Object> unexpected(Throwable ex) {
        String detail = ex.getMessage();
        String message = (detail == null || detail.isBlank())
                ? "Unexpected error occurred."
                : "Unexpected error: " + detail;
        return of(HttpStatus.INTERNAL_SERVER_ERROR, ApiError.of("internal_error", message));
    }
}
