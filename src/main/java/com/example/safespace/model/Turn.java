package com.example.safespace.model;

import java.time.Instant;
import java.util.UUID;

public record Turn(
        UUID id,
        UUID sessionId,
        TurnRole role,
        String content,
        int position,
        Instant createdAt
) {

    public boolean isUser() {
        return role == TurnRole.USER;
    }
}
