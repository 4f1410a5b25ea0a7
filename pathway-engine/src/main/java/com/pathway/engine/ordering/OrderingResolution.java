package com.pathway.engine.ordering;

import com.pathway.hierarchy.config.OrderingMode;

import java.util.List;

/**
 * Ordered children of a container plus the explanation recorded for the decision.
 */
public final class OrderingResolution {

    private final String nodeId;
    private final OrderingMode mode;
    private final List<String> order;
    private final String reason;
    private final boolean restored;

    public OrderingResolution(String nodeId, OrderingMode mode, List<String> order, String reason, boolean restored) {
        this.nodeId = nodeId;
        this.mode = mode;
        this.order = List.copyOf(order);
        this.reason = reason;
        this.restored = restored;
    }

    public String getNodeId() {
        return nodeId;
    }

    /** Mode actually applied (unknown modes resolve as sequential). */
    public OrderingMode getMode() {
        return mode;
    }

    public List<String> getOrder() {
        return order;
    }

    public String getReason() {
        return reason;
    }

    /** True when the order was taken from the participant's earlier assignment. */
    public boolean isRestored() {
        return restored;
    }

    @Override
    public String toString() {
        return nodeId + " " + mode.toValue() + " " + order + (restored ? " (restored)" : "");
    }
}
