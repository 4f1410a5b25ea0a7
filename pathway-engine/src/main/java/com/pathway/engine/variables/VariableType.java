package com.pathway.engine.variables;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Inferred type of a variable referenced by rules.
 */
public enum VariableType {
    NUMERIC,
    BOOLEAN,
    CATEGORICAL,
    UNKNOWN;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static VariableType fromValue(String value) {
        if (value == null) return UNKNOWN;
        for (VariableType t : values()) {
            if (t.name().equalsIgnoreCase(value.trim())) return t;
        }
        return UNKNOWN;
    }
}
