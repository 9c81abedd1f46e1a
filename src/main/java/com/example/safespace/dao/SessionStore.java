package com.example.safespace.dao;

import com.example.safespace.entity.SessionEntity;
import com.example.safespace.model.ChatSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Component
@RequiredArgsConstructor
public class SessionStore {

    private final SessionRepository sessionRepository;
    private final TurnRepository turnRepository;
    private final ReportRepository reportRepository;

    @Transactional
    public StoreResult<ChatSession> create() {
        SessionEntity saved = sessionRepository.saveAndFlush(new SessionEntity());
        return StoreResult.found(toSession(saved));
    }

    @Transactional(readOnly = true)
    public StoreResult<ChatSession> find(UUID sessionId) {
        return sessionRepository.findById(sessionId)
                .map(SessionStore::toSession)
                .map(StoreResult::found)
                .orElseGet(StoreResult::notFound);
    }

    /** Removes the session together with every turn and report it owns. */
    @Transactional
    public StoreResult<UUID> delete(UUID sessionId) {
        if (!sessionRepository.existsById(sessionId)) {
            return StoreResult.notFound();
        }
        turnRepository.deleteAllBySession(sessionId);
        reportRepository.deleteAllBySession(sessionId);
        sessionRepository.deleteById(sessionId);
        return StoreResult.found(sessionId);
    }

    static ChatSession toSession(SessionEntity entity) {
        return new ChatSession(entity.getId(), entity.getCreatedAt());
    }
}
