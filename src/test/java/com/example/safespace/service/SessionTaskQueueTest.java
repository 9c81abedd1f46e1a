package com.example.safespace.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

class SessionTaskQueueTest {

  private final SessionTaskQueue queue = new SessionTaskQueue();

  @Test
  void tasksOfOneSessionRunInOrder() {
    UUID session = UUID.randomUUID();
    Sinks.One<String> first = Sinks.one();
    AtomicBoolean secondStarted = new AtomicBoolean();
    List<String> results = new CopyOnWriteArrayList<>();

    queue.enqueue(session, first::asMono).subscribe(results::add);
    queue.enqueue(session, () -> {
      secondStarted.set(true);
      return Mono.just("second");
    }).subscribe(results::add);

    assertThat(secondStarted).isFalse();
    assertThat(queue.activeSessions()).isEqualTo(1);

    first.tryEmitValue("first");

    assertThat(secondStarted).isTrue();
    assertThat(results).containsExactly("first", "second");
    assertThat(queue.activeSessions()).isZero();
  }

  @Test
  void otherSessionsAreNotBlocked() {
    UUID busy = UUID.randomUUID();
    Sinks.One<String> pending = Sinks.one();
    List<String> results = new CopyOnWriteArrayList<>();

    queue.enqueue(busy, pending::asMono).subscribe(results::add);
    queue.enqueue(UUID.randomUUID(), () -> Mono.just("other")).subscribe(results::add);

    assertThat(results).containsExactly("other");

    pending.tryEmitValue("busy");
    assertThat(results).containsExactly("other", "busy");
  }

  @Test
  void failedTaskReleasesTheSlot() {
    UUID session = UUID.randomUUID();
    Sinks.One<String> first = Sinks.one();
    List<String> results = new CopyOnWriteArrayList<>();
    List<Throwable> errors = new CopyOnWriteArrayList<>();

    queue.enqueue(session, first::asMono).subscribe(results::add, errors::add);
    queue.enqueue(session, () -> Mono.just("after failure")).subscribe(results::add, errors::add);

    first.tryEmitError(new IllegalStateException("boom"));

    assertThat(errors).hasSize(1);
    assertThat(results).containsExactly("after failure");
    assertThat(queue.activeSessions()).isZero();
  }

  @Test
  void cancelledTaskReleasesTheSlot() {
    UUID session = UUID.randomUUID();
    List<String> results = new CopyOnWriteArrayList<>();

    var subscription = queue.enqueue(session, () -> Mono.<String>never()).subscribe(results::add);
    queue.enqueue(session, () -> Mono.just("next")).subscribe(results::add);

    assertThat(results).isEmpty();
    subscription.dispose();

    assertThat(results).containsExactly("next");
    assertThat(queue.activeSessions()).isZero();
  }

  @Test
  void cancelledWaiterDoesNotLetLaterTasksOvertake() {
    UUID session = UUID.randomUUID();
    Sinks.One<String> running = Sinks.one();
    AtomicBoolean waiterStarted = new AtomicBoolean();
    AtomicBoolean lastStarted = new AtomicBoolean();
    List<String> results = new CopyOnWriteArrayList<>();

    queue.enqueue(session, running::asMono).subscribe(results::add);
    var waiter = queue.enqueue(session, () -> {
      waiterStarted.set(true);
      return Mono.just("waiter");
    }).subscribe(results::add);
    queue.enqueue(session, () -> {
      lastStarted.set(true);
      return Mono.just("last");
    }).subscribe(results::add);

    waiter.dispose();

    assertThat(lastStarted).isFalse();
    assertThat(queue.activeSessions()).isEqualTo(1);

    running.tryEmitValue("running");

    assertThat(waiterStarted).isFalse();
    assertThat(lastStarted).isTrue();
    assertThat(results).containsExactly("running", "last");
    assertThat(queue.activeSessions()).isZero();
  }
}
