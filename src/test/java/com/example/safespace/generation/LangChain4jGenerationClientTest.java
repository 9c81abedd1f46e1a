package com.example.safespace.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.safespace.config.PromptProperties;
import com.example.safespace.model.EvidenceType;
import com.example.safespace.model.IncidentDetails;
import com.example.safespace.model.IncidentLocation;
import com.example.safespace.model.IncidentType;
import com.example.safespace.model.PerpetratorType;
import com.example.safespace.model.Turn;
import com.example.safespace.model.TurnRole;
import com.example.safespace.model.UserGoal;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

class LangChain4jGenerationClientTest {

  private static final UUID SESSION = UUID.randomUUID();

  private final PromptProperties prompts = new PromptProperties();

  @Test
  @SuppressWarnings("unchecked")
  void replyCarriesSystemPromptHistoryAndNewMessage() {
    ChatModel model = mock(ChatModel.class);
    when(model.chat(anyList())).thenReturn(response("Aku di sini untukmu."));
    LangChain4jGenerationClient client = new LangChain4jGenerationClient(model, model, prompts);

    List<Turn> history = List.of(
        turn(TurnRole.USER, "halo", 1),
        turn(TurnRole.ASSISTANT, "halo juga", 2));

    StepVerifier.create(client.generateReply("aku takut", history))
        .expectNext("Aku di sini untukmu.")
        .verifyComplete();

    ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
    verify(model).chat(captor.capture());
    List<ChatMessage> sent = captor.getValue();
    assertThat(sent).hasSize(4);
    assertThat(((SystemMessage) sent.get(0)).text()).isEqualTo(prompts.getChatSystemPrompt());
    assertThat(((UserMessage) sent.get(1)).singleText()).isEqualTo("halo");
    assertThat(((AiMessage) sent.get(2)).text()).isEqualTo("halo juga");
    assertThat(((UserMessage) sent.get(3)).singleText()).isEqualTo("aku takut");
  }

  @Test
  @SuppressWarnings("unchecked")
  void narrativeUsesReportPrompts() {
    ChatModel replyModel = mock(ChatModel.class);
    ChatModel reportModel = mock(ChatModel.class);
    when(reportModel.chat(anyList())).thenReturn(response("FORMULIR PENGADUAN"));
    LangChain4jGenerationClient client = new LangChain4jGenerationClient(replyModel, reportModel, prompts);

    StepVerifier.create(client.generateNarrative(details()))
        .expectNext("FORMULIR PENGADUAN")
        .verifyComplete();

    ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
    verify(reportModel).chat(captor.capture());
    List<ChatMessage> sent = captor.getValue();
    assertThat(((SystemMessage) sent.get(0)).text()).isEqualTo(prompts.getReportSystemPrompt());
    assertThat(((UserMessage) sent.get(1)).singleText()).contains("Lokasi Kejadian: kampus");
  }

  @Test
  void emptyResultIsAFailure() {
    ChatModel model = mock(ChatModel.class);
    when(model.chat(anyList())).thenReturn(response("   "));
    LangChain4jGenerationClient client = new LangChain4jGenerationClient(model, model, prompts);

    StepVerifier.create(client.generateNarrative(details()))
        .expectErrorSatisfies(ex -> assertThat(ex)
            .isInstanceOf(GenerationException.class)
            .hasMessage("Generation API returned an empty report narrative"))
        .verify();
  }

  @Test
  void missingModelsMeanNotConfigured() {
    LangChain4jGenerationClient client = new LangChain4jGenerationClient(null, null, prompts);

    assertThat(client.isConfigured()).isFalse();
    StepVerifier.create(client.generateReply("halo", List.of()))
        .expectError(GenerationNotConfiguredException.class)
        .verify();
  }

  private static ChatResponse response(String text) {
    return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
  }

  private static Turn turn(TurnRole role, String content, int position) {
    return new Turn(UUID.randomUUID(), SESSION, role, content, position, Instant.now());
  }

  private static IncidentDetails details() {
    return new IncidentDetails(
        IncidentLocation.KAMPUS,
        PerpetratorType.LECTURER,
        IncidentType.INAPPROPRIATE_COMMENTS,
        EvidenceType.WITNESS,
        UserGoal.DOCUMENT_SAFELY);
  }
}
