package com.example.safespace.service;

import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs tasks for the same session one after another, in subscription order. Tasks of different
 * sessions do not wait for each other. A slot is released when its task completes or fails. A
 * cancelled task releases its slot only once the task queued before it has finished.
 */
@Component
public class SessionTaskQueue {

    private final Map<UUID, Mono<Void>> tails = new ConcurrentHashMap<>();

    public <T> Mono<T> enqueue(UUID sessionId, Supplier<Mono<T>> task) {
        return Mono.defer(() -> {
            Sinks.Empty<Void> done = Sinks.empty();
            Mono<Void> doneSignal = done.asMono();
            AtomicReference<Mono<Void>> previous = new AtomicReference<>();
            tails.compute(sessionId, (id, tail) -> {
                previous.set(tail == null ? Mono.empty() : tail);
                return doneSignal;
            });
            return previous.get()
                    .then(Mono.defer(task))
                    .doFinally(signal -> {
                        if (signal == SignalType.CANCEL) {
                            // a cancelled waiter keeps its place until the task before it is done
                            previous.get().subscribe(
                                    null,
                                    error -> release(sessionId, done, doneSignal),
                                    () -> release(sessionId, done, doneSignal));
                        } else {
                            release(sessionId, done, doneSignal);
                        }
                    });
        });
    }

    private void release(UUID sessionId, Sinks.Empty<Void> done, Mono<Void> doneSignal) {
        done.tryEmitEmpty();
        tails.remove(sessionId, doneSignal);
    }

    /** Number of sessions with a running or queued task. */
    int activeSessions() {
        return tails.size();
    }
}
