package com.example.safespace.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.safespace.error.SessionNotFoundException;
import com.example.safespace.model.Turn;
import com.example.safespace.model.TurnRole;
import com.example.safespace.request.ChatMessageRequest;
import com.example.safespace.response.ApiError;
import com.example.safespace.response.ChatHistoryResponse;
import com.example.safespace.response.TurnResponse;
import com.example.safespace.service.ConversationOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

class ChatControllerTest {

  private final ConversationOrchestrator orchestrator = mock(ConversationOrchestrator.class);
  private final ChatController controller = new ChatController(orchestrator);

  @Test
  void sendReturnsStoredReply() {
    UUID sessionId = UUID.randomUUID();
    Turn reply = new Turn(UUID.randomUUID(), sessionId, TurnRole.ASSISTANT, "Aku mendengarkan.", 2, Instant.now());
    when(orchestrator.sendTurn(sessionId, "halo")).thenReturn(Mono.just(reply));

    ResponseEntity<Object> response = controller.send(sessionId, new ChatMessageRequest("  halo  ")).block();

    assertThat(response.getStatusCode().value()).isEqualTo(201);
    TurnResponse body = (TurnResponse) response.getBody();
    assertThat(body.role()).isEqualTo(TurnRole.ASSISTANT);
    assertThat(body.content()).isEqualTo("Aku mendengarkan.");
    assertThat(body.sessionId()).isEqualTo(sessionId);
  }

  @Test
  void sendToUnknownSessionIsNotFound() {
    UUID sessionId = UUID.randomUUID();
    when(orchestrator.sendTurn(sessionId, "halo")).thenReturn(Mono.error(new SessionNotFoundException(sessionId)));

    ResponseEntity<Object> response = controller.send(sessionId, new ChatMessageRequest("halo")).block();

    assertThat(response.getStatusCode().value()).isEqualTo(404);
    assertThat(((ApiError) response.getBody()).getError()).isEqualTo("not_found");
  }

  @Test
  void historyListsTurnsInOrder() {
    UUID sessionId = UUID.randomUUID();
    Instant now = Instant.now();
    List<Turn> turns = List.of(
        new Turn(UUID.randomUUID(), sessionId, TurnRole.USER, "halo", 1, now),
        new Turn(UUID.randomUUID(), sessionId, TurnRole.ASSISTANT, "hai", 2, now));
    when(orchestrator.getHistory(sessionId)).thenReturn(Mono.just(turns));

    ResponseEntity<Object> response = controller.history(sessionId).block();

    assertThat(response.getStatusCode().value()).isEqualTo(200);
    ChatHistoryResponse body = (ChatHistoryResponse) response.getBody();
    assertThat(body.getSessionId()).isEqualTo(sessionId);
    assertThat(body.getMessages()).extracting(TurnResponse::content).containsExactly("halo", "hai");
  }

  @Test
  void historyReportsUnexpectedErrors() {
    UUID sessionId = UUID.randomUUID();
    when(orchestrator.getHistory(sessionId)).thenReturn(Mono.error(new IllegalStateException("boom")));

    ResponseEntity<Object> response = controller.history(sessionId).block();

    assertThat(response.getStatusCode().value()).isEqualTo(500);
    assertThat(((ApiError) response.getBody()).getMessage()).isEqualTo("Unexpected error: boom");
  }
}
