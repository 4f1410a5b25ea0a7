package com.pathway.hierarchy.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pathway.hierarchy.tree.HierarchyNode;

import java.util.List;

/**
 * Root of an experiment version: id, version and the top-level phase sequence.
 * Optional {@code rules} apply to the phase sequence itself (the synthetic experiment root).
 */
public final class ExperimentDefinition {

    private final String experimentId;
    private final String version;
    private final String title;
    private final RulesConfig rules;
    private final List<HierarchyNode> phases;

    @JsonCreator
    public ExperimentDefinition(
            @JsonProperty("experiment_id") @JsonAlias({"experimentId", "id"}) String experimentId,
            @JsonProperty("version") String version,
            @JsonProperty("title") @JsonAlias({"name", "label"}) String title,
            @JsonProperty("rules") RulesConfig rules,
            @JsonProperty("phases") List<HierarchyNode> phases) {
        this.experimentId = experimentId;
        this.version = version != null && !version.isBlank() ? version.trim() : "1";
        this.title = title;
        this.rules = rules;
        this.phases = phases != null ? List.copyOf(phases) : List.of();
    }

    @JsonProperty("experiment_id")
    public String getExperimentId() {
        return experimentId;
    }

    public String getVersion() {
        return version;
    }

    public String getTitle() {
        return title;
    }

    public RulesConfig getRules() {
        return rules;
    }

    public List<HierarchyNode> getPhases() {
        return phases;
    }
}
