package com.pathway.hierarchy.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PickStrategy {
    RANDOM("random"),
    ROUND_ROBIN("round_robin"),
    WEIGHTED_RANDOM("weighted_random"),
    UNKNOWN("unknown");

    private final String value;

    PickStrategy(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    @JsonCreator
    public static PickStrategy fromValue(String value) {
        if (value == null || value.isBlank()) return RANDOM;
        String normalized = value.trim().toLowerCase().replace('-', '_');
        for (PickStrategy s : values()) {
            if (s != UNKNOWN && s.value.equals(normalized)) return s;
        }
        return UNKNOWN;
    }
}
