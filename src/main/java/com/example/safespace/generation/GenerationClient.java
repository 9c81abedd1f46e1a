package com.example.safespace.generation;

import com.example.safespace.model.IncidentDetails;
import com.example.safespace.model.Turn;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * External text-generation collaborator. Each returned {@link Mono} performs one call per
 * subscription, so callers can resubscribe to retry.
 */
public interface GenerationClient {

    /** {@code false} when no credential is set; calls then fail with {@link GenerationNotConfiguredException}. */
    boolean isConfigured();

    /**
     * @param message the new user message
     * @param history every earlier turn of the session, oldest first, not including {@code message}
     */
    Mono<String> generateReply(String message, List<Turn> history);

    Mono<String> generateNarrative(IncidentDetails details);
}
