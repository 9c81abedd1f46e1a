package com.example.safespace.service;

import com.example.safespace.dao.SessionStore;
import com.example.safespace.dao.StoreGateway;
import com.example.safespace.dao.StoreResult;
import com.example.safespace.error.SessionNotFoundException;
import com.example.safespace.model.ChatSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class SessionRegistry {

    private final SessionStore sessionStore;
    private final StoreGateway gateway;

    public Mono<ChatSession> create() {
        return gateway.call("create session", sessionStore::create)
                .map(result -> result.orElseThrow(IllegalStateException::new))
                .doOnNext(session -> log.info("Session created: {}", session.id()));
    }

    /** Hard delete of the session and everything it owns. */
    public Mono<Void> delete(UUID sessionId) {
        return gateway.call("delete session", () -> sessionStore.delete(sessionId))
                .map(result -> result.orElseThrow(() -> new SessionNotFoundException(sessionId)))
                .doOnNext(id -> log.info("Session deleted: {}", id))
                .then();
    }

    public Mono<Boolean> exists(UUID sessionId) {
        return gateway.call("find session", () -> sessionStore.find(sessionId))
                .map(StoreResult::isPresent);
    }

    /** Completes empty when the session exists, errors with {@link SessionNotFoundException} otherwise. */
    public Mono<Void> requireExists(UUID sessionId) {
        return exists(sessionId)
                .flatMap(found -> found ? Mono.<Void>empty() : Mono.error(new SessionNotFoundException(sessionId)));
    }
}
