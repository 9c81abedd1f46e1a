package com.example.safespace.dao;

import com.example.safespace.entity.ReportEntity;
import com.example.safespace.entity.SessionEntity;
import com.example.safespace.model.IncidentDetails;
import com.example.safespace.model.Report;
import com.example.safespace.model.ReportStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class ReportStore {

    private final SessionRepository sessionRepository;
    private final ReportRepository reportRepository;

    /**
     * Saves the structured fields with no narrative. {@code CONFLICT} carries the report the
     * session already has.
     */
    @Transactional
    public StoreResult<Report> insertPending(UUID sessionId, IncidentDetails details) {
        Optional<SessionEntity> session = sessionRepository.findById(sessionId);
        if (session.isEmpty()) {
            return StoreResult.notFound();
        }
        Optional<ReportEntity> existing = reportRepository.findBySession(sessionId);
        if (existing.isPresent()) {
            return StoreResult.conflict(toReport(existing.get()));
        }
        ReportEntity entity = new ReportEntity()
                .setSession(session.get())
                .setLocation(details.location())
                .setPerpetrator(details.perpetrator())
                .setDescription(details.description())
                .setEvidence(details.evidence())
                .setUserGoal(details.userGoal())
                .setStatus(ReportStatus.PENDING_GENERATION);
        return StoreResult.found(toReport(reportRepository.saveAndFlush(entity)));
    }

    /**
     * Answers a failed {@link #insertPending} that hit a constraint: {@code CONFLICT} with the
     * report that won, or {@code NOT_FOUND} when the session is gone.
     */
    @Transactional(readOnly = true)
    public StoreResult<Report> existingFor(UUID sessionId) {
        if (!sessionRepository.existsById(sessionId)) {
            return StoreResult.notFound();
        }
        return StoreResult.conflict(reportRepository.findBySession(sessionId).map(ReportStore::toReport).orElse(null));
    }

    /**
     * Stores the narrative. Write-once: {@code CONFLICT} when the report was already generated,
     * {@code NOT_FOUND} when it disappeared together with its session.
     */
    @Transactional
    public StoreResult<Report> markGenerated(UUID reportId, String document) {
        return transition(reportId, ReportStatus.GENERATED, document);
    }

    @Transactional
    public StoreResult<Report> markFailed(UUID reportId) {
        return transition(reportId, ReportStatus.GENERATION_FAILED, null);
    }

    /**
     * {@code NOT_FOUND} means the session is gone; {@code FOUND(empty)} means the session exists
     * but has no report.
     */
    @Transactional(readOnly = true)
    public StoreResult<Optional<Report>> findBySession(UUID sessionId) {
        if (!sessionRepository.existsById(sessionId)) {
            return StoreResult.notFound();
        }
        return StoreResult.found(reportRepository.findBySession(sessionId).map(ReportStore::toReport));
    }

    private StoreResult<Report> transition(UUID reportId, ReportStatus target, String document) {
        int updated = reportRepository.transition(
                reportId, target, document, ReportStatus.GENERATED, Instant.now());
        Optional<Report> current = reportRepository.findById(reportId).map(ReportStore::toReport);
        if (current.isEmpty()) {
            return StoreResult.notFound();
        }
        return updated == 0 ? StoreResult.conflict(current.get()) : StoreResult.found(current.get());
    }

    static Report toReport(ReportEntity entity) {
        IncidentDetails details = new IncidentDetails(
                entity.getLocation(),
                entity.getPerpetrator(),
                entity.getDescription(),
                entity.getEvidence(),
                entity.getUserGoal());
        return new Report(
                entity.getId(),
                entity.getSession().getId(),
                details,
                entity.getStatus(),
                entity.getGeneratedDocument(),
                entity.getCreatedAt());
    }
}
