package com.pathway.simulator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pathway.distribution.DistributionCounts;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a simulation run: path buckets (most frequent first), realized variable values and the final
 * simulation-local counters.
 */
public final class SimulationResult {

    private final String experimentId;
    private final int totalParticipants;
    private final List<PathDistribution> pathDistributions;
    private final Map<String, Map<String, Long>> variableSummary;
    private final Map<String, Map<String, DistributionCounts>> simulatedCounts;

    @JsonCreator
    public SimulationResult(
            @JsonProperty("experimentId") String experimentId,
            @JsonProperty("totalParticipants") int totalParticipants,
            @JsonProperty("pathDistributions") List<PathDistribution> pathDistributions,
            @JsonProperty("variableSummary") Map<String, Map<String, Long>> variableSummary,
            @JsonProperty("simulatedCounts") Map<String, Map<String, DistributionCounts>> simulatedCounts) {
        this.experimentId = experimentId;
        this.totalParticipants = totalParticipants;
        this.pathDistributions = pathDistributions != null ? List.copyOf(pathDistributions) : List.of();
        this.variableSummary = variableSummary != null ? variableSummary : Map.of();
        this.simulatedCounts = simulatedCounts != null ? simulatedCounts : Map.of();
    }

    @JsonProperty("experimentId")
    public String getExperimentId() {
        return experimentId;
    }

    @JsonProperty("totalParticipants")
    public int getTotalParticipants() {
        return totalParticipants;
    }

    @JsonProperty("pathDistributions")
    public List<PathDistribution> getPathDistributions() {
        return pathDistributions;
    }

    /** Per variable path, count of each realized value (numeric values by bin). */
    @JsonProperty("variableSummary")
    public Map<String, Map<String, Long>> getVariableSummary() {
        return variableSummary;
    }

    @JsonProperty("simulatedCounts")
    public Map<String, Map<String, DistributionCounts>> getSimulatedCounts() {
        return simulatedCounts;
    }
}
