package com.example.safespace.dao;

import com.example.safespace.entity.SessionEntity;
import com.example.safespace.entity.TurnEntity;
import com.example.safespace.model.Turn;
import com.example.safespace.model.TurnRole;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class TurnStore {

    private final SessionRepository sessionRepository;
    private final TurnRepository turnRepository;

    /**
     * Appends at {@code max(position) + 1}. The session row stays locked until commit, so appends
     * to one session are numbered one after another.
     */
    @Transactional
    public StoreResult<Turn> append(UUID sessionId, TurnRole role, String content) {
        Optional<SessionEntity> session = sessionRepository.findForUpdate(sessionId);
        if (session.isEmpty()) {
            return StoreResult.notFound();
        }
        int position = turnRepository.findLastPosition(sessionId) + 1;
        TurnEntity entity = new TurnEntity()
                .setSession(session.get())
                .setRole(role)
                .setContent(content)
                .setPosition(position);
        return StoreResult.found(toTurn(turnRepository.saveAndFlush(entity)));
    }

    @Transactional(readOnly = true)
    public StoreResult<List<Turn>> history(UUID sessionId) {
        if (!sessionRepository.existsById(sessionId)) {
            return StoreResult.notFound();
        }
        List<Turn> turns = turnRepository.findHistory(sessionId).stream()
                .map(TurnStore::toTurn)
                .toList();
        return StoreResult.found(turns);
    }

    @Transactional(readOnly = true)
    public boolean sessionExists(UUID sessionId) {
        return sessionRepository.existsById(sessionId);
    }

    static Turn toTurn(TurnEntity entity) {
        return new Turn(
                entity.getId(),
                entity.getSession().getId(),
                entity.getRole(),
                entity.getContent(),
                entity.getPosition(),
                entity.getCreatedAt());
    }
}
