package com.example.safespace.dao;

import jakarta.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.sql.SQLException;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Runs blocking store calls off the request thread and turns storage failures into
 * {@link StoreResult#unavailable(Throwable)}. Each call is one transaction.
 */
@Slf4j
@Component
public class StoreGateway {

    public <T> Mono<StoreResult<T>> call(String operation, Callable<StoreResult<T>> work) {
        return call(operation, work, null);
    }

    /**
     * Same as {@link #call(String, Callable)}, but a constraint violation is answered by
     * {@code onIntegrityViolation} instead of being reported as unavailable. The fallback runs on
     * the same worker and may query the store; its own store failures become unavailable.
     */
    public <T> Mono<StoreResult<T>> call(String operation,
                                         Callable<StoreResult<T>> work,
                                         Supplier<StoreResult<T>> onIntegrityViolation) {
        return Mono.fromCallable(work)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(ex -> onIntegrityViolation != null && ex instanceof DataIntegrityViolationException, ex -> {
                    log.info("[store] {} hit a constraint: {}", operation, ex.getMessage());
                    return Mono.fromSupplier(onIntegrityViolation);
                })
                .onErrorResume(StoreGateway::isStoreFailure, ex -> {
                    log.error("[store] {} failed: {}", operation, ex.getMessage());
                    return Mono.just(StoreResult.unavailable(ex));
                });
    }

    static boolean isStoreFailure(Throwable ex) {
        return ex instanceof DataAccessException
                || ex instanceof TransactionException
                || ex instanceof PersistenceException
                || ex instanceof SQLException;
    }
}
