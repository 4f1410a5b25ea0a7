package com.pathway.hierarchy.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Traversal order policy for the children of a container node.
 * Unrecognized values map to {@link #UNKNOWN}; the resolver treats that as {@link #SEQUENTIAL}.
 */
public enum OrderingMode {
    SEQUENTIAL("sequential"),
    RANDOMIZED("randomized"),
    BALANCED("balanced"),
    WEIGHTED("weighted"),
    LATIN_SQUARE("latin_square"),
    UNKNOWN("unknown");

    private final String value;

    OrderingMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    @JsonCreator
    public static OrderingMode fromValue(String value) {
        if (value == null || value.isBlank()) return SEQUENTIAL;
        String normalized = value.trim().toLowerCase().replace('-', '_');
        if ("random".equals(normalized)) return RANDOMIZED;
        for (OrderingMode m : values()) {
            if (m != UNKNOWN && m.value.equals(normalized)) return m;
        }
        return UNKNOWN;
    }

    /** True for modes whose outcome depends on population-level state rather than only the participant seed. */
    public boolean isPopulationLevel() {
        return this == BALANCED || this == LATIN_SQUARE;
    }
}
