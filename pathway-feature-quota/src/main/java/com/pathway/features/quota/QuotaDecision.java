package com.pathway.features.quota;

import java.util.Locale;
import java.util.Objects;

/**
 * Outcome of a quota check: admit the participant, redirect them to another node, or make them wait for a slot.
 */
public final class QuotaDecision {

    public enum Kind { ADMIT, REDIRECT, WAIT }

    private final Kind kind;
    private final String nodeId;
    private final String targetNodeId;
    private final long observed;
    private final long limit;
    private final boolean restored;

    private QuotaDecision(Kind kind, String nodeId, String targetNodeId, long observed, long limit, boolean restored) {
        this.kind = kind;
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        this.targetNodeId = targetNodeId;
        this.observed = observed;
        this.limit = limit;
        this.restored = restored;
    }

    public static QuotaDecision admit(String nodeId, long observed, long limit) {
        return new QuotaDecision(Kind.ADMIT, nodeId, null, observed, limit, false);
    }

    public static QuotaDecision redirect(String nodeId, String targetNodeId, long observed, long limit) {
        return new QuotaDecision(Kind.REDIRECT, nodeId, Objects.requireNonNull(targetNodeId, "targetNodeId"), observed, limit, false);
    }

    public static QuotaDecision waitForSlot(String nodeId, long observed, long limit) {
        return new QuotaDecision(Kind.WAIT, nodeId, null, observed, limit, false);
    }

    /** A decision taken earlier in the session, reused without touching counters. */
    static QuotaDecision restored(String nodeId, String targetNodeId) {
        Kind kind = targetNodeId == null || targetNodeId.equals(nodeId) ? Kind.ADMIT : Kind.REDIRECT;
        return new QuotaDecision(kind, nodeId, kind == Kind.REDIRECT ? targetNodeId : null, -1, -1, true);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isAdmitted() {
        return kind == Kind.ADMIT;
    }

    public String getNodeId() {
        return nodeId;
    }

    /** Redirect target; null unless {@link Kind#REDIRECT}. */
    public String getTargetNodeId() {
        return targetNodeId;
    }

    /** Counter value seen at decision time; -1 for restored decisions. */
    public long getObserved() {
        return observed;
    }

    public long getLimit() {
        return limit;
    }

    public boolean isRestored() {
        return restored;
    }

    /** Human-readable explanation for assignment records. */
    public String reason() {
        if (restored) return "restored " + kind.name().toLowerCase(Locale.ROOT) + (targetNodeId != null ? " → " + targetNodeId : "");
        switch (kind) {
            case ADMIT:
                return "quota " + observed + "/" + limit + " → admitted";
            case REDIRECT:
                return "quota full " + observed + "/" + limit + " → redirected to " + targetNodeId;
            default:
                return "quota full " + observed + "/" + limit + " → waiting for slot";
        }
    }

    @Override
    public String toString() {
        return "QuotaDecision{" + nodeId + " " + kind + (targetNodeId != null ? " → " + targetNodeId : "") + "}";
    }
}
