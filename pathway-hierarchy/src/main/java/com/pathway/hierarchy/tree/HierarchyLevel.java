package com.pathway.hierarchy.tree;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Level of a node in the experiment hierarchy. JSON uses the lower-case name;
 * unknown values deserialize as {@link #UNKNOWN} and are inferred from depth when the arena is built.
 */
public enum HierarchyLevel {
    /** Synthetic root holding the top-level phase sequence. Never appears in experiment JSON. */
    EXPERIMENT,
    PHASE,
    STAGE,
    BLOCK,
    TASK,
    UNKNOWN;

    private static final HierarchyLevel[] BY_DEPTH = {PHASE, STAGE, BLOCK, TASK};

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static HierarchyLevel fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        String normalized = value.trim().toUpperCase();
        for (HierarchyLevel l : values()) {
            if (l != UNKNOWN && l != EXPERIMENT && l.name().equals(normalized)) return l;
        }
        return UNKNOWN;
    }

    /**
     * Level implied by depth below the experiment root (0 = phase). Depths past the task level stay {@link #TASK}.
     */
    public static HierarchyLevel forDepth(int depth) {
        if (depth < 0) return EXPERIMENT;
        return BY_DEPTH[Math.min(depth, BY_DEPTH.length - 1)];
    }

    /** Nesting rank: experiment 0, phase 1 ... task 4; unknown -1. */
    public int rank() {
        return switch (this) {
            case EXPERIMENT -> 0;
            case PHASE -> 1;
            case STAGE -> 2;
            case BLOCK -> 3;
            case TASK -> 4;
            default -> -1;
        };
    }
}
