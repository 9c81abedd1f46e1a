package com.example.safespace.dao;

import com.example.safespace.error.StoreUnavailableException;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Outcome of a data-access call. Storage failures never escape the data-access layer as
 * exceptions; they arrive here as {@link Status#UNAVAILABLE}.
 *
 * @param <T> payload carried by {@link Status#FOUND} and {@link Status#CONFLICT}
 */
public final class StoreResult<T> {

    public enum Status {
        FOUND,
        NOT_FOUND,
        /** The write was refused because a conflicting row exists; the value is that row. */
        CONFLICT,
        UNAVAILABLE
    }

    private final Status status;
    private final T value;
    private final Throwable cause;

    private StoreResult(Status status, T value, Throwable cause) {
        this.status = status;
        this.value = value;
        this.cause = cause;
    }

    public static <T> StoreResult<T> found(T value) {
        return new StoreResult<>(Status.FOUND, Objects.requireNonNull(value, "value"), null);
    }

    public static <T> StoreResult<T> notFound() {
        return new StoreResult<>(Status.NOT_FOUND, null, null);
    }

    public static <T> StoreResult<T> conflict(T existing) {
        return new StoreResult<>(Status.CONFLICT, existing, null);
    }

    public static <T> StoreResult<T> unavailable(Throwable cause) {
        return new StoreResult<>(Status.UNAVAILABLE, null, cause);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public boolean isConflict() {
        return status == Status.CONFLICT;
    }

    public boolean isUnavailable() {
        return status == Status.UNAVAILABLE;
    }

    public T getValue() {
        return value;
    }

    public Throwable getCause() {
        return cause;
    }

    public <R> StoreResult<R> map(Function<? super T, ? extends R> mapper) {
        if (status == Status.FOUND) {
            return found(mapper.apply(value));
        }
        if (status == Status.CONFLICT) {
            return conflict(value == null ? null : mapper.apply(value));
        }
        return new StoreResult<>(status, null, cause);
    }

    /**
     * Returns the value of a {@link Status#FOUND} result. {@link Status#UNAVAILABLE} becomes a
     * {@link StoreUnavailableException}; any other status throws the exception from {@code missing}.
     */
    public T orElseThrow(Supplier<? extends RuntimeException> missing) {
        if (status == Status.FOUND) {
            return value;
        }
        if (status == Status.UNAVAILABLE) {
            throw new StoreUnavailableException("Database service unavailable", cause);
        }
        throw missing.get();
    }

    /**
     * {@code true} for {@link Status#FOUND}, {@code false} for {@link Status#NOT_FOUND}.
     * {@link Status#UNAVAILABLE} becomes a {@link StoreUnavailableException}.
     */
    public boolean isPresent() {
        if (status == Status.UNAVAILABLE) {
            throw new StoreUnavailableException("Database service unavailable", cause);
        }
        return status == Status.FOUND;
    }

    @Override
    public String toString() {
        return "StoreResult{" + status + (cause == null ? "" : ", cause=" + cause.getMessage()) + "}";
    }
}
