package com.example.safespace.error;

import java.util.List;

/** Request input was rejected before anything was stored. Carries one reason per invalid field. */
public class ValidationException extends RuntimeException {

    private final List<String> reasons;

    public ValidationException(String reason) {
        this(List.of(reason));
    }

    public ValidationException(List<String> reasons) {
        super(String.join("; ", requireReasons(reasons)));
        this.reasons = List.copyOf(reasons);
    }

    public List<String> getReasons() {
        return reasons;
    }

    private static List<String> requireReasons(List<String> reasons) {
        if (reasons == null || reasons.isEmpty()) {
            throw new IllegalArgumentException("at least one reason is required");
        }
        return reasons;
    }
}
