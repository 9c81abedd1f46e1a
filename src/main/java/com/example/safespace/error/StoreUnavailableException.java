package com.example.safespace.error;

/** The persistence backend could not complete the operation. Safe to retry the whole request. */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
