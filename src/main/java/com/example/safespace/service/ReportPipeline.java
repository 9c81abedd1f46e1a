package com.example.safespace.service;

import com.example.safespace.dao.ReportStore;
import com.example.safespace.dao.StoreGateway;
import com.example.safespace.error.ReportConflictException;
import com.example.safespace.error.ReportNotFoundException;
import com.example.safespace.error.SessionNotFoundException;
import com.example.safespace.generation.GenerationClient;
import com.example.safespace.generation.GenerationNotConfiguredException;
import com.example.safespace.model.IncidentDetails;
import com.example.safespace.model.Report;
import com.example.safespace.model.ReportOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Two-phase report flow. Phase 1 commits the structured fields on their own; phase 2 generates
 * the narrative and writes it in a separate transaction. A failed phase 2 never undoes phase 1.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportPipeline {

    private final SessionRegistry sessionRegistry;
    private final ReportStore reportStore;
    private final StoreGateway gateway;
    private final GenerationClient generationClient;
    private final RetryExecutor retryExecutor;

    public Mono<ReportOutcome> submit(UUID sessionId, IncidentDetails details) {
        return sessionRegistry.requireExists(sessionId)
                .then(gateway.call(
                        "save report",
                        () -> reportStore.insertPending(sessionId, details),
                        () -> reportStore.existingFor(sessionId)))
                .map(result -> {
                    if (result.isConflict()) {
                        UUID existingId = result.getValue() == null ? null : result.getValue().id();
                        throw new ReportConflictException("A report already exists for session " + sessionId, existingId);
                    }
                    return result.orElseThrow(() -> new SessionNotFoundException(sessionId));
                })
                .doOnNext(report -> log.info("Report record created: {}", report.id()))
                .flatMap(this::generate);
    }

    public Mono<Report> get(UUID sessionId) {
        return gateway.call("find report", () -> reportStore.findBySession(sessionId))
                .map(result -> result.orElseThrow(() -> new SessionNotFoundException(sessionId))
                        .orElseThrow(() -> new ReportNotFoundException(sessionId)));
    }

    /** Runs phase 2 again for a report that has no narrative yet. */
    public Mono<ReportOutcome> regenerate(UUID sessionId) {
        return get(sessionId).flatMap(report -> {
            if (report.isGenerated()) {
                return Mono.error(new ReportConflictException(
                        "Report " + report.id() + " already has a generated document", report.id()));
            }
            return generate(report);
        });
    }

    private Mono<ReportOutcome> generate(Report report) {
        Mono<String> narrative = generationClient.isConfigured()
                ? retryExecutor.retry("report generation", generationClient.generateNarrative(report.details()))
                : Mono.error(new GenerationNotConfiguredException());
        return narrative
                .map(NarrativeAttempt::succeeded)
                .onErrorResume(ex -> Mono.just(NarrativeAttempt.failed(ex)))
                .flatMap(attempt -> attempt.text() != null
                        ? storeNarrative(report, attempt.text())
                        : markFailed(report, attempt.error()));
    }

    private Mono<ReportOutcome> storeNarrative(Report report, String text) {
        return gateway.call("store narrative", () -> reportStore.markGenerated(report.id(), text))
                .map(result -> {
                    if (result.isUnavailable()) {
                        log.error("Narrative for report {} generated but not stored: {}", report.id(), result.getCause().toString());
                        return ReportOutcome.generationFailed(report,
                                "Report saved but the generated narrative could not be stored: " + result.getCause().getMessage());
                    }
                    if (result.isConflict()) {
                        log.warn("Report {} was generated concurrently, keeping the stored document", report.id());
                        return ReportOutcome.generated(result.getValue());
                    }
                    Report stored = result.orElseThrow(() -> new SessionNotFoundException(report.sessionId()));
                    log.info("Report narrative generated and saved: {}", stored.id());
                    return ReportOutcome.generated(stored);
                });
    }

    private Mono<ReportOutcome> markFailed(Report report, Throwable error) {
        log.error("Narrative generation failed for report {}: {}", report.id(), error.toString());
        String reason = "Report created but narrative generation failed: " + error.getMessage();
        return gateway.call("mark report failed", () -> reportStore.markFailed(report.id()))
                .map(result -> {
                    if (result.isConflict()) {
                        return ReportOutcome.generated(result.getValue());
                    }
                    if (result.isUnavailable()) {
                        // the pending row is still there, only its status could not be updated
                        return ReportOutcome.generationFailed(report, reason);
                    }
                    Report failed = result.orElseThrow(() -> new SessionNotFoundException(report.sessionId()));
                    return ReportOutcome.generationFailed(failed, reason);
                });
    }

    private record NarrativeAttempt(String text, Throwable error) {

        static NarrativeAttempt succeeded(String text) {
            return new NarrativeAttempt(text, null);
        }

        static NarrativeAttempt failed(Throwable error) {
            return new NarrativeAttempt(null, error);
        }
    }
}
