package com.example.safespace.service;

import com.example.safespace.config.RetryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Bounded retry with exponential backoff around a fallible call.
 *
 * <p>The n-th retry waits {@code baseDelay * 2^(n-1)}, capped at {@code maxDelay}, without
 * jitter. Waits are timer-scheduled, so no thread sleeps. Once every attempt failed the last
 * failure is propagated as is.
 */
@Slf4j
@Component
public class RetryExecutor {

    private final RetryProperties defaults;
    private final Predicate<Throwable> retryable;

    @Autowired
    public RetryExecutor(RetryProperties defaults) {
        this(defaults, ex -> true);
    }

    public RetryExecutor(RetryProperties defaults, Predicate<Throwable> retryable) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
        this.retryable = Objects.requireNonNull(retryable, "retryable");
    }

    /** Retries with the configured attempts and delays. */
    public <T> Mono<T> retry(String operationName, Mono<T> operation) {
        return retry(operationName, operation, defaults.getMaxAttempts(), defaults.getBaseDelay());
    }

    /**
     * @param operation   resubscribed for every attempt, so it must be lazy
     * @param maxAttempts total attempts including the first one
     */
    public <T> Mono<T> retry(String operationName, Mono<T> operation, int maxAttempts, Duration baseDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        Objects.requireNonNull(baseDelay, "baseDelay");
        if (maxAttempts == 1) {
            return operation;
        }
        Duration maxDelay = defaults.getMaxDelay().compareTo(baseDelay) < 0 ? baseDelay : defaults.getMaxDelay();
        return operation.retryWhen(Retry.backoff(maxAttempts - 1, baseDelay)
                .maxBackoff(maxDelay)
                .jitter(0d)
                .filter(retryable)
                .doBeforeRetry(signal -> log.warn("{} attempt {}/{} failed, retrying: {}",
                        operationName,
                        signal.totalRetries() + 1,
                        maxAttempts,
                        signal.failure().toString()))
                .onRetryExhaustedThrow((spec, signal) -> {
                    log.error("{} failed after {} attempts: {}", operationName, maxAttempts, signal.failure().toString());
                    return signal.failure();
                }));
    }
}
