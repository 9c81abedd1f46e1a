package com.example.safespace.dao;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.safespace.error.StoreUnavailableException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.CannotCreateTransactionException;
import reactor.test.StepVerifier;

class StoreGatewayTest {

  private final StoreGateway gateway = new StoreGateway();

  @Test
  void returnsTheResultOfTheCall() {
    StepVerifier.create(gateway.call("find", () -> StoreResult.found("row")))
        .assertNext(result -> {
          assertThat(result.isFound()).isTrue();
          assertThat(result.getValue()).isEqualTo("row");
        })
        .verifyComplete();
  }

  @Test
  void dataAccessFailureBecomesUnavailable() {
    DataAccessResourceFailureException failure = new DataAccessResourceFailureException("connection refused");

    StepVerifier.create(gateway.<String>call("find", () -> {
          throw failure;
        }))
        .assertNext(result -> {
          assertThat(result.isUnavailable()).isTrue();
          assertThat(result.getCause()).isSameAs(failure);
          assertThatThrownBy(() -> result.orElseThrow(IllegalStateException::new))
              .isInstanceOf(StoreUnavailableException.class)
              .hasCause(failure);
        })
        .verifyComplete();
  }

  @Test
  void transactionFailureBecomesUnavailable() {
    StepVerifier.create(gateway.<String>call("save", () -> {
          throw new CannotCreateTransactionException("pool exhausted");
        }))
        .assertNext(result -> assertThat(result.isUnavailable()).isTrue())
        .verifyComplete();
  }

  @Test
  void constraintViolationIsAnsweredByTheFallback() {
    StepVerifier.create(gateway.call("save",
            () -> {
              throw new DataIntegrityViolationException("uk_reports_session");
            },
            () -> StoreResult.conflict("existing")))
        .assertNext(result -> {
          assertThat(result.isConflict()).isTrue();
          assertThat(result.getValue()).isEqualTo("existing");
        })
        .verifyComplete();
  }

  @Test
  void constraintViolationWithoutFallbackIsUnavailable() {
    StepVerifier.create(gateway.<String>call("save", () -> {
          throw new DataIntegrityViolationException("uk_turns_position");
        }))
        .assertNext(result -> assertThat(result.isUnavailable()).isTrue())
        .verifyComplete();
  }

  @Test
  void fallbackIsNotUsedForOtherStoreFailures() {
    AtomicBoolean fallbackCalled = new AtomicBoolean();

    StepVerifier.create(gateway.<String>call("save",
            () -> {
              throw new DataAccessResourceFailureException("connection reset");
            },
            () -> {
              fallbackCalled.set(true);
              return StoreResult.notFound();
            }))
        .assertNext(result -> assertThat(result.isUnavailable()).isTrue())
        .verifyComplete();
    assertThat(fallbackCalled).isFalse();
  }

  @Test
  void failingFallbackIsUnavailable() {
    StepVerifier.create(gateway.<String>call("save",
            () -> {
              throw new DataIntegrityViolationException("uk_reports_session");
            },
            () -> {
              throw new DataAccessResourceFailureException("connection lost during lookup");
            }))
        .assertNext(result -> assertThat(result.isUnavailable()).isTrue())
        .verifyComplete();
  }

  @Test
  void programmingErrorsPropagate() {
    StepVerifier.create(gateway.<String>call("find", () -> {
          throw new IllegalArgumentException("bad id");
        }))
        .expectError(IllegalArgumentException.class)
        .verify();
  }

  @Test
  void unavailableIsNeitherPresentNorAbsent() {
    StoreResult<String> result = StoreResult.unavailable(new DataAccessResourceFailureException("down"));

    assertThatThrownBy(result::isPresent).isInstanceOf(StoreUnavailableException.class);
    assertThat(StoreResult.notFound().isPresent()).isFalse();
  }
}
