package com.pathway.hierarchy.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operator of a pick condition. {@code ==} is an alias of {@code in}, {@code !=} of {@code not_in}.
 */
public enum PickConditionOperator {
    IN("in"),
    NOT_IN("not_in"),
    EQUAL("=="),
    NOT_EQUAL("!="),
    UNKNOWN("unknown");

    private final String value;

    PickConditionOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    @JsonCreator
    public static PickConditionOperator fromValue(String value) {
        if (value == null || value.isBlank()) return NOT_IN;
        String normalized = value.trim().toLowerCase();
        for (PickConditionOperator o : values()) {
            if (o != UNKNOWN && o.value.equals(normalized)) return o;
        }
        return UNKNOWN;
    }

    /** True when the candidate's value must already have been accumulated. */
    public boolean requiresMembership() {
        return this == IN || this == EQUAL;
    }
}
