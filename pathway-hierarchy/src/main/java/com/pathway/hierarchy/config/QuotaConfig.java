package com.pathway.hierarchy.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Capacity limit on how many participants may enter a node.
 */
public final class QuotaConfig {

    private final int limit;
    private final QuotaStrategy strategy;
    private final String fallbackNodeId;
    private final QuotaCountOn countOn;

    @JsonCreator
    public QuotaConfig(
            @JsonProperty("limit") Integer limit,
            @JsonProperty("strategy") QuotaStrategy strategy,
            @JsonProperty("fallback_node_id") @JsonAlias({"fallbackNodeId", "fallback_stage_id", "fallback"}) String fallbackNodeId,
            @JsonProperty("count_on") @JsonAlias("countOn") QuotaCountOn countOn) {
        this.limit = limit != null ? limit : -1;
        this.strategy = strategy != null ? strategy : QuotaStrategy.SKIP_IF_FULL;
        this.fallbackNodeId = fallbackNodeId != null && !fallbackNodeId.isBlank() ? fallbackNodeId.trim() : null;
        this.countOn = countOn != null ? countOn : QuotaCountOn.STARTED;
    }

    /** Configured limit; negative when absent (validation rejects that). */
    public int getLimit() {
        return limit;
    }

    public QuotaStrategy getStrategy() {
        return strategy;
    }

    @JsonProperty("fallback_node_id")
    public String getFallbackNodeId() {
        return fallbackNodeId;
    }

    @JsonProperty("count_on")
    public QuotaCountOn getCountOn() {
        return countOn;
    }
}
