package com.pathway.simulator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pathway.engine.TraversalResult;

import java.util.List;
import java.util.Map;

/**
 * One bucket of identical simulated paths: same outcome, same ordered task ids.
 */
public final class PathDistribution {

    private final List<String> path;
    private final TraversalResult.Status status;
    private final long count;
    private final double percentage;
    private final Map<String, List<String>> sampleAssignments;

    @JsonCreator
    public PathDistribution(
            @JsonProperty("path") List<String> path,
            @JsonProperty("status") TraversalResult.Status status,
            @JsonProperty("count") long count,
            @JsonProperty("percentage") double percentage,
            @JsonProperty("sampleAssignments") Map<String, List<String>> sampleAssignments) {
        this.path = path != null ? List.copyOf(path) : List.of();
        this.status = status;
        this.count = count;
        this.percentage = percentage;
        this.sampleAssignments = sampleAssignments != null ? Map.copyOf(sampleAssignments) : Map.of();
    }

    @JsonProperty("path")
    public List<String> getPath() {
        return path;
    }

    @JsonProperty("pathDisplay")
    public String getPathDisplay() {
        String tasks = String.join(" → ", path);
        return status == TraversalResult.Status.COMPLETE ? tasks : tasks + " [" + status + "]";
    }

    @JsonProperty("status")
    public TraversalResult.Status getStatus() {
        return status;
    }

    @JsonProperty("count")
    public long getCount() {
        return count;
    }

    /** Share of all simulated participants, 0 to 100, two decimals. */
    @JsonProperty("percentage")
    public double getPercentage() {
        return percentage;
    }

    /** Assignments of the first participant that took this path. */
    @JsonProperty("sampleAssignments")
    public Map<String, List<String>> getSampleAssignments() {
        return sampleAssignments;
    }

    @Override
    public String toString() {
        return getPathDisplay() + " x" + count + " (" + percentage + "%)";
    }
}
