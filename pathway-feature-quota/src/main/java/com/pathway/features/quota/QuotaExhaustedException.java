package com.pathway.features.quota;

/**
 * Thrown when a node's quota is full and no redirect target can be resolved. The path resolver turns it into a
 * "currently full" terminal state for that participant.
 */
public final class QuotaExhaustedException extends RuntimeException {

    private final String nodeId;
    private final long currentUsage;
    private final long limit;

    public QuotaExhaustedException(String nodeId, long currentUsage, long limit) {
        super(String.format("Quota exhausted for node=%s: usage=%d limit=%d and no fallback", nodeId, currentUsage, limit));
        this.nodeId = nodeId;
        this.currentUsage = currentUsage;
        this.limit = limit;
    }

    public String getNodeId() {
        return nodeId;
    }

    public long getCurrentUsage() {
        return currentUsage;
    }

    public long getLimit() {
        return limit;
    }
}
