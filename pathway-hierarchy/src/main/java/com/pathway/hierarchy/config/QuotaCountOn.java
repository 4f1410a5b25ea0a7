package com.pathway.hierarchy.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Counter a quota limit is compared against. */
public enum QuotaCountOn {
    /** Every participant ever admitted counts (default). */
    STARTED,
    /** Only participants currently inside the node count; completions and abandons free slots. */
    ACTIVE;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static QuotaCountOn fromValue(String value) {
        if (value == null || value.isBlank()) return STARTED;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return STARTED;
        }
    }
}
