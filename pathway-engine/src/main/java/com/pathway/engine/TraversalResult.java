package com.pathway.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Where a participant stands after a traversal: the next task to present, the end of the experiment, a pending
 * {@code wait_for_slot} quota, or a full quota without fallback. {@code path} lists the task ids reached so far,
 * in presentation order, including the next task.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TraversalResult {

    public enum Status { TASK, COMPLETE, WAITING, QUOTA_FULL }

    private final Status status;
    private final String taskId;
    private final String blockedNodeId;
    private final List<String> path;

    private TraversalResult(Status status, String taskId, String blockedNodeId, List<String> path) {
        this.status = status;
        this.taskId = taskId;
        this.blockedNodeId = blockedNodeId;
        this.path = List.copyOf(path);
    }

    static TraversalResult task(String taskId, List<String> path) {
        return new TraversalResult(Status.TASK, taskId, null, path);
    }

    static TraversalResult complete(List<String> path) {
        return new TraversalResult(Status.COMPLETE, null, null, path);
    }

    static TraversalResult waiting(String nodeId, List<String> path) {
        return new TraversalResult(Status.WAITING, null, nodeId, path);
    }

    static TraversalResult quotaFull(String nodeId, List<String> path) {
        return new TraversalResult(Status.QUOTA_FULL, null, nodeId, path);
    }

    @JsonProperty("status")
    public Status getStatus() {
        return status;
    }

    /** Next task; null unless {@link Status#TASK}. */
    @JsonProperty("task_id")
    public String getTaskId() {
        return taskId;
    }

    /** Node whose quota stopped the traversal; null unless waiting or quota-full. */
    @JsonProperty("blocked_node_id")
    public String getBlockedNodeId() {
        return blockedNodeId;
    }

    @JsonProperty("path")
    public List<String> getPath() {
        return path;
    }

    /** True once no further task will be presented (complete or quota-full). */
    public boolean isTerminal() {
        return status == Status.COMPLETE || status == Status.QUOTA_FULL;
    }

    @Override
    public String toString() {
        return status + (taskId != null ? " " + taskId : "") + (blockedNodeId != null ? " @" + blockedNodeId : "") + " " + path;
    }
}
