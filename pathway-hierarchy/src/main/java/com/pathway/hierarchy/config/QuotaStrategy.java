package com.pathway.hierarchy.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What happens when a participant reaches a node whose quota is full.
 */
public enum QuotaStrategy {
    /** Redirect to the fallback node, or the next sibling when no fallback is configured. */
    SKIP_IF_FULL("skip_if_full"),
    /** Suspend the participant until a slot frees up (bounded wait). */
    WAIT_FOR_SLOT("wait_for_slot"),
    /** Redirect to the fallback node; the fallback is mandatory. */
    SHOW_ALTERNATIVE("show_alternative"),
    UNKNOWN("unknown");

    private final String value;

    QuotaStrategy(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    @JsonCreator
    public static QuotaStrategy fromValue(String value) {
        if (value == null || value.isBlank()) return SKIP_IF_FULL;
        String normalized = value.trim().toLowerCase();
        for (QuotaStrategy s : values()) {
            if (s != UNKNOWN && s.value.equals(normalized)) return s;
        }
        return UNKNOWN;
    }
}
