package com.example.safespace.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.safespace.error.SessionNotFoundException;
import com.example.safespace.generation.GenerationClient;
import com.example.safespace.model.Turn;
import com.example.safespace.model.TurnRole;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import reactor.core.publisher.Flux;

@SpringBootTest
@ActiveProfiles("test")
class TurnLogTest {

  @Autowired
  private TurnLog turnLog;

  @Autowired
  private SessionRegistry sessionRegistry;

  @MockBean
  private GenerationClient generationClient;

  @Test
  void concurrentAppendsOnALiveSessionAllSucceed() {
    UUID sessionId = sessionRegistry.create().block().id();

    List<Turn> appended = Flux.range(1, 20)
        .flatMap(i -> turnLog.append(sessionId, TurnRole.USER, "pesan " + i))
        .collectList()
        .block(Duration.ofSeconds(30));

    assertThat(appended).hasSize(20);
    assertThat(appended).extracting(Turn::position).doesNotHaveDuplicates();
    assertThat(turnLog.history(sessionId).collectList().block())
        .extracting(Turn::position)
        .containsExactlyElementsOf(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16, 17, 18, 19, 20));
  }

  @Test
  void appendToDeletedSessionIsNotFound() {
    UUID sessionId = sessionRegistry.create().block().id();
    sessionRegistry.delete(sessionId).block();

    assertThatThrownBy(() -> turnLog.append(sessionId, TurnRole.USER, "halo").block())
        .isInstanceOf(SessionNotFoundException.class);
  }
}
