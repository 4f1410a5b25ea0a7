package com.pathway.distribution;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** The three population counters kept per (level, child). */
public enum CounterKind {
    STARTED,
    COMPLETED,
    ACTIVE;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parses a counter name; null or unknown values read as {@link #STARTED}. */
    @JsonCreator
    public static CounterKind fromValue(String value) {
        if (value == null || value.isBlank()) return STARTED;
        for (CounterKind kind : values()) {
            if (kind.name().equalsIgnoreCase(value.trim())) return kind;
        }
        return STARTED;
    }
}
