package com.example.safespace.response;

import com.example.safespace.model.Turn;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ChatHistoryResponse {

    UUID sessionId;
    List<TurnResponse> messages;

    public static ChatHistoryResponse of(UUID sessionId, List<Turn> turns) {
        return ChatHistoryResponse.builder()
                .sessionId(sessionId)
                .messages(turns.stream().map(TurnResponse::from).toList())
                .build();
    }
}
