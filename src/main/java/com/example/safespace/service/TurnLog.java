package com.example.safespace.service;

import com.example.safespace.dao.StoreGateway;
import com.example.safespace.dao.StoreResult;
import com.example.safespace.dao.TurnStore;
import com.example.safespace.error.SessionNotFoundException;
import com.example.safespace.error.StoreUnavailableException;
import com.example.safespace.model.Turn;
import com.example.safespace.model.TurnRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/** Append-only turn history of a session. */
@Slf4j
@Service
@RequiredArgsConstructor
public class TurnLog {

    private final TurnStore turnStore;
    private final StoreGateway gateway;

    /**
     * Fails with {@link SessionNotFoundException} only when the session is gone. A position
     * collision with a concurrent writer is retried once.
     */
    public Mono<Turn> append(UUID sessionId, TurnRole role, String content) {
        return appendOnce(sessionId, role, content)
                .flatMap(result -> {
                    if (!result.isConflict()) {
                        return Mono.just(result);
                    }
                    log.warn("Turn position taken concurrently in session {}, appending again", sessionId);
                    return appendOnce(sessionId, role, content);
                })
                .map(result -> {
                    if (result.isConflict()) {
                        throw new StoreUnavailableException("Could not append turn to session " + sessionId, null);
                    }
                    return result.orElseThrow(() -> new SessionNotFoundException(sessionId));
                });
    }

    private Mono<StoreResult<Turn>> appendOnce(UUID sessionId, TurnRole role, String content) {
        return gateway.call(
                "append " + role.value() + " turn",
                () -> turnStore.append(sessionId, role, content),
                () -> turnStore.sessionExists(sessionId) ? StoreResult.<Turn>conflict(null) : StoreResult.<Turn>notFound());
    }

    /** Oldest first. Every subscription reads the store again. */
    public Flux<Turn> history(UUID sessionId) {
        return gateway.call("read history", () -> turnStore.history(sessionId))
                .flatMapMany(result -> Flux.fromIterable(
                        result.orElseThrow(() -> new SessionNotFoundException(sessionId))));
    }
}
