package com.example.safespace.service;

import com.example.safespace.config.PromptProperties;
import com.example.safespace.generation.GenerationClient;
import com.example.safespace.model.Turn;
import com.example.safespace.model.TurnRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationOrchestrator {

    private final SessionRegistry sessionRegistry;
    private final TurnLog turnLog;
    private final GenerationClient generationClient;
    private final RetryExecutor retryExecutor;
    private final SessionTaskQueue taskQueue;
    private final PromptProperties prompts;

    /**
     * Stores the user message, asks the collaborator for a reply with every earlier turn as
     * context and stores the reply. Calls for one session run one at a time.
     *
     * <p>Generation problems never fail the call: the stored reply is then a fixed apology.
     *
     * @return the stored assistant turn
     */
    public Mono<Turn> sendTurn(UUID sessionId, String message) {
        return taskQueue.enqueue(sessionId, () -> sessionRegistry.requireExists(sessionId)
                .then(turnLog.history(sessionId).collectList())
                .flatMap(history -> turnLog.append(sessionId, TurnRole.USER, message)
                        .then(reply(sessionId, message, history)))
                .flatMap(reply -> turnLog.append(sessionId, TurnRole.ASSISTANT, reply)));
    }

    public Mono<List<Turn>> getHistory(UUID sessionId) {
        return turnLog.history(sessionId).collectList();
    }

    private Mono<String> reply(UUID sessionId, String message, List<Turn> history) {
        if (!generationClient.isConfigured()) {
            log.warn("Generation not configured, session {} gets the fallback reply", sessionId);
            return Mono.just(prompts.getNotConfiguredReply());
        }
        return retryExecutor.retry("chat reply", generationClient.generateReply(message, history))
                .onErrorResume(ex -> {
                    log.error("Chat reply failed for session {}, using fallback reply: {}", sessionId, ex.toString());
                    return Mono.just(prompts.getFailureReply());
                });
    }
}
