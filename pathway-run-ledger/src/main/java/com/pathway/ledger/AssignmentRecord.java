package com.pathway.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Immutable audit entry for one routing decision.
 * <p>
 * {@code assignmentKey} is the key the decision is stored under in the participant's assignments (normally the
 * level id; {@code <id>#order} for the order of a pick group, {@code quota:<id>} for admissions).
 * {@code sequence} and {@code timestamp} are assigned on write by the ledger, never by the caller.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AssignmentRecord {

    private final String sessionId;
    private final long sequence;
    private final String assignmentKey;
    private final String levelId;
    private final List<String> assignedChildIds;
    private final DecisionType decisionType;
    private final String orderingMode;
    private final String reason;
    private final long timestamp;

    @JsonCreator
    public AssignmentRecord(
            @JsonProperty("session_id") String sessionId,
            @JsonProperty("sequence") long sequence,
            @JsonProperty("assignment_key") String assignmentKey,
            @JsonProperty("level_id") String levelId,
            @JsonProperty("assigned_child_ids") List<String> assignedChildIds,
            @JsonProperty("decision_type") DecisionType decisionType,
            @JsonProperty("ordering_mode") String orderingMode,
            @JsonProperty("reason") String reason,
            @JsonProperty("timestamp") long timestamp) {
        this.sessionId = sessionId;
        this.sequence = sequence;
        this.levelId = Objects.requireNonNull(levelId, "levelId");
        this.assignmentKey = assignmentKey != null ? assignmentKey : levelId;
        this.assignedChildIds = assignedChildIds != null ? List.copyOf(assignedChildIds) : List.of();
        this.decisionType = decisionType != null ? decisionType : DecisionType.ORDERING;
        this.orderingMode = orderingMode;
        this.reason = reason != null ? reason : "";
        this.timestamp = timestamp;
    }

    /** Unstamped decision as produced by the resolver. */
    public static AssignmentRecord decision(String assignmentKey, String levelId, List<String> assignedChildIds,
                                            DecisionType decisionType, String orderingMode, String reason) {
        return new AssignmentRecord(null, 0, assignmentKey, levelId, assignedChildIds, decisionType, orderingMode, reason, 0L);
    }

    /** Copy carrying the ledger-assigned session, sequence and server time. */
    public AssignmentRecord stamped(String sessionId, long sequence, long timestamp) {
        return new AssignmentRecord(sessionId, sequence, assignmentKey, levelId, assignedChildIds, decisionType,
                orderingMode, reason, timestamp);
    }

    @JsonProperty("session_id")
    public String getSessionId() {
        return sessionId;
    }

    @JsonProperty("sequence")
    public long getSequence() {
        return sequence;
    }

    @JsonProperty("assignment_key")
    public String getAssignmentKey() {
        return assignmentKey;
    }

    @JsonProperty("level_id")
    public String getLevelId() {
        return levelId;
    }

    @JsonProperty("assigned_child_ids")
    public List<String> getAssignedChildIds() {
        return assignedChildIds;
    }

    @JsonProperty("decision_type")
    public DecisionType getDecisionType() {
        return decisionType;
    }

    @JsonProperty("ordering_mode")
    public String getOrderingMode() {
        return orderingMode;
    }

    @JsonProperty("reason")
    public String getReason() {
        return reason;
    }

    /** Server time of the write, epoch millis. */
    @JsonProperty("timestamp")
    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "AssignmentRecord{" + sessionId + "#" + sequence + " " + assignmentKey + " -> " + assignedChildIds
                + " (" + decisionType.toValue() + "): " + reason + "}";
    }
}
