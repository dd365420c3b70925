package com.volunteermedia.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle status of an animal.
 * Serialized with its lowercase API value ("available", "bite_quarantine", ...).
 */
public enum AnimalStatus {
    AVAILABLE("available"),
    FOSTER("foster"),
    BITE_QUARANTINE("bite_quarantine"),
    ARCHIVED("archived");

    private final String value;

    AnimalStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<AnimalStatus> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(s -> s.value.equals(normalized))
                .findFirst();
    }

    @JsonCreator
    public static AnimalStatus fromValue(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Invalid status: " + raw));
    }
}
