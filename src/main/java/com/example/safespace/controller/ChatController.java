package com.example.safespace.controller;

import com.example.safespace.error.SessionNotFoundException;
import com.example.safespace.error.StoreUnavailableException;
import com.example.safespace.request.ChatMessageRequest;
import com.example.safespace.response.ChatHistoryResponse;
import com.example.safespace.response.TurnResponse;
import com.example.safespace.service.ConversationOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
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
@RequestMapping("/api/v1/sessions/{sessionId}/chat")
@Tag(name = "Chat", description = "Turn-based conversation within a session")
@RequiredArgsConstructor
public class ChatController {

    private final ConversationOrchestrator orchestrator;

    @PostMapping
    @Operation(
            summary = "Send a chat message",
            description = "Stores the message, generates a reply with the session history as context and returns the stored reply."
    )
    public Mono<ResponseEntity<Object>> send(@PathVariable UUID sessionId,
                                             @Valid @RequestBody ChatMessageRequest request) {
        return orchestrator.sendTurn(sessionId, request.message().trim())
                .map(turn -> ApiResponses.of(HttpStatus.CREATED, TurnResponse.from(turn)))
                .onErrorResume(SessionNotFoundException.class, ex -> Mono.just(ApiResponses.notFound(ex)))
                .onErrorResume(StoreUnavailableException.class, ex -> Mono.just(ApiResponses.unavailable(ex)))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while processing chat for session {}", sessionId, ex);
                    return Mono.just(ApiResponses.unexpected(ex));
                });
    }

    @GetMapping
    @Operation(summary = "Get the chat history of a session, oldest first")
    public Mono<ResponseEntity<Object>> history(@PathVariable UUID sessionId) {
        return orchestrator.getHistory(sessionId)
                .map(turns -> ApiResponses.of(HttpStatus.OK, ChatHistoryResponse.of(sessionId, turns)))
                .onErrorResume(SessionNotFoundException.class, ex -> Mono.just(ApiResponses.notFound(ex)))
                .onErrorResume(StoreUnavailableException.class, ex -> Mono.just(ApiResponses.unavailable(ex)))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while reading chat history for session {}", sessionId, ex);
                    return Mono.just(ApiResponses.unexpected(ex));
                });
    }
}
