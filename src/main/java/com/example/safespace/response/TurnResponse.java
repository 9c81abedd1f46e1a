package com.example.safespace.response;

import com.example.safespace.model.Turn;
import com.example.safespace.model.TurnRole;

import java.time.Instant;
import java.util.UUID;

public record TurnResponse(
        UUID id,
        UUID sessionId,
        TurnRole role,
        String content,
        Instant createdAt
) {

    public static TurnResponse from(Turn turn) {
        return new TurnResponse(turn.id(), turn.sessionId(), turn.role(), turn.content(), turn.createdAt());
    }
}
