package com.pathway.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** What kind of routing decision an assignment record describes. */
public enum DecisionType {
    /** Order (or single child) chosen for a container. */
    ORDERING,
    /** Subset chosen by a pick group. */
    PICK,
    /** Quota admission or redirect. */
    QUOTA,
    UNKNOWN;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DecisionType fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        for (DecisionType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) return type;
        }
        return UNKNOWN;
    }
}
