package com.pathway.engine.pick;

import com.pathway.hierarchy.config.PickStrategy;

import java.util.List;

/** Children chosen by a pick group, in declared order, with the explanation recorded for it. */
public final class PickResult {

    private final String nodeId;
    private final PickStrategy strategy;
    private final List<String> chosen;
    private final int excludedByConditions;
    private final boolean relaxed;
    private final String reason;
    private final boolean restored;

    public PickResult(String nodeId, PickStrategy strategy, List<String> chosen, int excludedByConditions,
                      boolean relaxed, String reason, boolean restored) {
        this.nodeId = nodeId;
        this.strategy = strategy;
        this.chosen = List.copyOf(chosen);
        this.excludedByConditions = excludedByConditions;
        this.relaxed = relaxed;
        this.reason = reason;
        this.restored = restored;
    }

    public String getNodeId() {
        return nodeId;
    }

    public PickStrategy getStrategy() {
        return strategy;
    }

    public List<String> getChosen() {
        return chosen;
    }

    public int getExcludedByConditions() {
        return excludedByConditions;
    }

    /** True when fewer candidates than the pick count remained and all of them were taken. */
    public boolean isRelaxed() {
        return relaxed;
    }

    public String getReason() {
        return reason;
    }

    public boolean isRestored() {
        return restored;
    }
}
