package com.example.safespace.model;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A closed set of values for one structured incident field. Wire values are matched exactly.
 */
public interface IncidentCategory {

    String value();

    static <E extends Enum<E> & IncidentCategory> Optional<E> fromValue(Class<E> type, String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Arrays.stream(type.getEnumConstants())
                .filter(candidate -> candidate.value().equals(raw))
                .findFirst();
    }

    static <E extends Enum<E> & IncidentCategory> String allowedValues(Class<E> type) {
        return Arrays.stream(type.getEnumConstants())
                .map(IncidentCategory::value)
                .map(v -> "'" + v + "'")
                .collect(Collectors.joining(", "));
    }
}
