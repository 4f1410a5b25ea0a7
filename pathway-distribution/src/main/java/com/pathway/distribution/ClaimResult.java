package com.pathway.distribution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome of an atomic least-filled claim: the chosen child and the counts observed for every candidate at
 * decision time (before the increment).
 */
public final class ClaimResult {

    private final String childId;
    private final Map<String, Long> observed;

    public ClaimResult(String childId, Map<String, Long> observed) {
        this.childId = childId;
        this.observed = Collections.unmodifiableMap(new LinkedHashMap<>(observed));
    }

    public String getChildId() {
        return childId;
    }

    /** Candidate id to counter value, in candidate order. */
    public Map<String, Long> getObserved() {
        return observed;
    }

    /** {@code {a:4,b:6}} form used in assignment reasons. */
    public String observedText() {
        return observed.entrySet().stream()
                .map(e -> e.getKey() + ":" + e.getValue())
                .collect(Collectors.joining(",", "{", "}"));
    }

    @Override
    public String toString() {
        return "ClaimResult{" + childId + ", observed=" + observedText() + "}";
    }
}
