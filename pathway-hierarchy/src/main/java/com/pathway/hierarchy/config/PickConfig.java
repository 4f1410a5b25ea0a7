package com.pathway.hierarchy.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pick K of N configuration of a container. Children without an entry in {@code weights}
 * weigh 1 under {@link PickStrategy#WEIGHTED_RANDOM}.
 */
public final class PickConfig {

    private final int count;
    private final PickStrategy strategy;
    private final List<PickCondition> conditions;
    private final Map<String, Double> weights;

    @JsonCreator
    public PickConfig(
            @JsonProperty("count") Integer count,
            @JsonProperty("strategy") PickStrategy strategy,
            @JsonProperty("conditions") List<PickCondition> conditions,
            @JsonProperty("weights") Map<String, Double> weights) {
        this.count = count != null ? count : 0;
        this.strategy = strategy != null ? strategy : PickStrategy.RANDOM;
        this.conditions = conditions != null ? List.copyOf(conditions) : List.of();
        this.weights = weights != null ? Collections.unmodifiableMap(new LinkedHashMap<>(weights)) : Map.of();
    }

    public int getCount() {
        return count;
    }

    public PickStrategy getStrategy() {
        return strategy;
    }

    public List<PickCondition> getConditions() {
        return conditions;
    }

    public Map<String, Double> getWeights() {
        return weights;
    }

    /** Weight of a child for weighted picks (1 when unset). */
    public double weightOf(String childId) {
        Double w = weights.get(childId);
        return w != null ? w : 1.0;
    }
}
