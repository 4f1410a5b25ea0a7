package com.pathway.hierarchy.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Counter that balanced ordering equalizes. Defaults to {@link #STARTED}. */
public enum BalanceOn {
    STARTED,
    COMPLETED;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static BalanceOn fromValue(String value) {
        if (value == null || value.isBlank()) return STARTED;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return STARTED;
        }
    }
}
