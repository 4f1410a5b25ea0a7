package com.pathway.hierarchy.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-container rules: ordering policy, balancing counter, weights, quota, pick and traversal.
 * <p>
 * The flat pick keys {@code pick_count}, {@code pick_strategy}, {@code pick_conditions} and {@code pick_weights}
 * are accepted as an alternative to the nested {@code pick} object; the nested object wins when both are present.
 * A {@code visibility} expression here is used when the node has no {@code visibility_rule} of its own.
 */
public final class RulesConfig {

    private final String ordering;
    private final OrderingMode orderingMode;
    private final BalanceOn balanceOn;
    private final Map<String, Double> weights;
    private final QuotaConfig quota;
    private final PickConfig pick;
    private final Traversal traversal;
    private final String visibility;

    @JsonCreator
    public RulesConfig(
            @JsonProperty("ordering") String ordering,
            @JsonProperty("balance_on") @JsonAlias("balanceOn") BalanceOn balanceOn,
            @JsonProperty("weights") Map<String, Double> weights,
            @JsonProperty("quota") QuotaConfig quota,
            @JsonProperty("pick") PickConfig pick,
            @JsonProperty("traversal") Traversal traversal,
            @JsonProperty("visibility") String visibility,
            @JsonProperty("pick_count") @JsonAlias("pickCount") Integer pickCount,
            @JsonProperty("pick_strategy") @JsonAlias("pickStrategy") PickStrategy pickStrategy,
            @JsonProperty("pick_conditions") @JsonAlias("pickConditions") List<PickCondition> pickConditions,
            @JsonProperty("pick_weights") @JsonAlias("pickWeights") Map<String, Double> pickWeights) {
        this.ordering = ordering;
        this.orderingMode = OrderingMode.fromValue(ordering);
        this.balanceOn = balanceOn != null ? balanceOn : BalanceOn.STARTED;
        this.weights = weights != null ? Collections.unmodifiableMap(new LinkedHashMap<>(weights)) : Map.of();
        this.quota = quota;
        if (pick != null) {
            this.pick = pick;
        } else if (pickCount != null && pickCount > 0) {
            this.pick = new PickConfig(pickCount, pickStrategy, pickConditions, pickWeights);
        } else {
            this.pick = null;
        }
        this.traversal = traversal;
        this.visibility = visibility != null && !visibility.isBlank() ? visibility : null;
    }

    public RulesConfig(String ordering, BalanceOn balanceOn, Map<String, Double> weights,
                       QuotaConfig quota, PickConfig pick, Traversal traversal) {
        this(ordering, balanceOn, weights, quota, pick, traversal, null, null, null, null, null);
    }

    public static RulesConfig ordering(String ordering) {
        return new RulesConfig(ordering, null, null, null, null, null);
    }

    /** Ordering string as authored (may be null or unrecognized). */
    @JsonProperty("ordering")
    public String getOrdering() {
        return ordering;
    }

    @JsonIgnore
    public OrderingMode getOrderingMode() {
        return orderingMode;
    }

    @JsonProperty("balance_on")
    public BalanceOn getBalanceOn() {
        return balanceOn;
    }

    public Map<String, Double> getWeights() {
        return weights;
    }

    public QuotaConfig getQuota() {
        return quota;
    }

    public PickConfig getPick() {
        return pick;
    }

    /** Explicit traversal, or null to derive it from ordering and pick. */
    public Traversal getTraversal() {
        return traversal;
    }

    public String getVisibility() {
        return visibility;
    }

    /**
     * Traversal in effect: the explicit value, else {@link Traversal#FIRST} for balanced and weighted
     * containers without a pick (the participant is routed into one child), else {@link Traversal#ALL}.
     */
    @JsonIgnore
    public Traversal effectiveTraversal() {
        if (traversal != null) return traversal;
        if (pick == null && (orderingMode == OrderingMode.BALANCED || orderingMode == OrderingMode.WEIGHTED)) {
            return Traversal.FIRST;
        }
        return Traversal.ALL;
    }
}
