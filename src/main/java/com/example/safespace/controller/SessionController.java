package com.example.safespace.controller;

import com.example.safespace.error.SessionNotFoundException;
import com.example.safespace.error.StoreUnavailableException;
import com.example.safespace.response.SessionResponse;
import com.example.safespace.service.SessionRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/sessions")
@Tag(name = "Sessions", description = "Anonymous session lifecycle")
@RequiredArgsConstructor
public class SessionController {

    private final SessionRegistry sessionRegistry;

    @PostMapping
    @Operation(
            summary = "Create an anonymous session",
            description = "Creates a session without any identifying data and returns its id."
    )
    public Mono<ResponseEntity<Object>> create() {
        return sessionRegistry.create()
                .map(session -> ApiResponses.of(HttpStatus.CREATED, SessionResponse.from(session)))
                .onErrorResume(StoreUnavailableException.class, ex -> Mono.just(ApiResponses.unavailable(ex)))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while creating session", ex);
                    return Mono.just(ApiResponses.unexpected(ex));
                });
    }

    @DeleteMapping("/{sessionId}")
    @Operation(
            summary = "Delete a session",
            description = "Removes the session together with its chat history and report."
    )
    public Mono<ResponseEntity<Object>> delete(@PathVariable UUID sessionId) {
        return sessionRegistry.delete(sessionId)
                .then(Mono.fromSupplier(() -> ResponseEntity.noContent().<Object>build()))
                .onErrorResume(SessionNotFoundException.class, ex -> Mono.just(ApiResponses.notFound(ex)))
                .onErrorResume(StoreUnavailableException.class, ex -> Mono.just(ApiResponses.unavailable(ex)))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while deleting session {}", sessionId, ex);
                    return Mono.just(ApiResponses.unexpected(ex));
                });
    }
}
