package com.example.safespace.response;

import com.example.safespace.model.ChatSession;

import java.time.Instant;
import java.util.UUID;

public record SessionResponse(UUID sessionId, Instant createdAt) {

    public static SessionResponse from(ChatSession session) {
        return new SessionResponse(session.id(), session.createdAt());
    }
}
