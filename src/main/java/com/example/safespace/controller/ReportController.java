package com.example.safespace.controller;

import com.example.safespace.error.ReportConflictException;
import com.example.safespace.error.ReportNotFoundException;
import com.example.safespace.error.SessionNotFoundException;
import com.example.safespace.error.StoreUnavailableException;
import com.example.safespace.model.ReportOutcome;
import com.example.safespace.request.ReportRequest;
import com.example.safespace.response.ReportResponse;
import com.example.safespace.service.ReportPipeline;
import com.example.safespace.validation.IncidentDetailsValidator;
import com.example.safespace.error.ValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/sessions/{sessionId}/report")
@Tag(name = "Report", description = "Structured incident report and generated narrative")
@RequiredArgsConstructor
public class ReportController {

    private final ReportPipeline reportPipeline;
    private final IncidentDetailsValidator validator;

    @PostMapping
    @Operation(
            summary = "Submit an incident report",
            description = "Saves the structured fields first, then generates the narrative. "
                    + "When generation fails the saved report is kept and the response says so."
    )
    public Mono<ResponseEntity<Object>> submit(@PathVariable UUID sessionId,
                                               @RequestBody(required = false) ReportRequest request) {
        return Mono.fromCallable(() -> validator.validate(request))
                .flatMap(details -> reportPipeline.submit(sessionId, details))
                .map(outcome -> toResponse(outcome, HttpStatus.CREATED))
                .onErrorResume(ValidationException.class, ex -> Mono.just(ApiResponses.validation(ex)))
                .onErrorResume(SessionNotFoundException.class, ex -> Mono.just(ApiResponses.notFound(ex)))
                .onErrorResume(ReportConflictException.class, ex -> Mono.just(ApiResponses.conflict(ex)))
                .onErrorResume(StoreUnavailableException.class, ex -> Mono.just(ApiResponses.unavailable(ex)))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while submitting report for session {}", sessionId, ex);
                    return Mono.just(ApiResponses.unexpected(ex));
                });
    }

    @GetMapping
    @Operation(summary = "Get the report of a session")
    public Mono<ResponseEntity<Object>> get(@PathVariable UUID sessionId) {
        return reportPipeline.get(sessionId)
                .map(report -> ApiResponses.of(HttpStatus.OK, ReportResponse.from(report)))
                .onErrorResume(SessionNotFoundException.class, ex -> Mono.just(ApiResponses.notFound(ex)))
                .onErrorResume(ReportNotFoundException.class, ex -> Mono.just(ApiResponses.notFound(ex)))
                .onErrorResume(StoreUnavailableException.class, ex -> Mono.just(ApiResponses.unavailable(ex)))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while reading report for session {}", sessionId, ex);
                    return Mono.just(ApiResponses.unexpected(ex));
                });
    }

    @PostMapping("/generate")
    @Operation(
            summary = "Retry narrative generation",
            description = "Generates the narrative for a saved report that does not have one yet."
    )
    public Mono<ResponseEntity<Object>> regenerate(@PathVariable UUID sessionId) {
        return reportPipeline.regenerate(sessionId)
                .map(outcome -> toResponse(outcome, HttpStatus.OK))
                .onErrorResume(SessionNotFoundException.class, ex -> Mono.just(ApiResponses.notFound(ex)))
                .onErrorResume(ReportNotFoundException.class, ex -> Mono.just(ApiResponses.notFound(ex)))
                .onErrorResume(ReportConflictException.class, ex -> Mono.just(ApiResponses.conflict(ex)))
                .onErrorResume(StoreUnavailableException.class, ex -> Mono.just(ApiResponses.unavailable(ex)))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while regenerating report for session {}", sessionId, ex);
                    return Mono.just(ApiResponses.unexpected(ex));
                });
    }

    private ResponseEntity<Object> toResponse(ReportOutcome outcome, HttpStatus success) {
        if (!outcome.generated()) {
            return ApiResponses.generationFailed(outcome);
        }
        return ApiResponses.of(success, ReportResponse.from(outcome.report()));
    }
}
