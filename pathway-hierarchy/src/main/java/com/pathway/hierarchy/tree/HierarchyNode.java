package com.pathway.hierarchy.tree;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pathway.hierarchy.config.RulesConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Node of the experiment hierarchy: a phase, stage, block or task. Containers hold an ordered list of children;
 * tasks are leaves. Children may be authored under {@code children} or under the level-specific keys
 * {@code stages}, {@code blocks} and {@code tasks}.
 * <p>
 * {@code pick_assigns} maps pick variables to the value this node contributes when it is picked
 * (e.g. {@code {"topic": "climate"}}).
 */
public final class HierarchyNode {

    private final String id;
    private final String label;
    private final HierarchyLevel level;
    private final List<HierarchyNode> children;
    private final RulesConfig rules;
    private final String visibilityRule;
    private final Map<String, Object> pickAssigns;

    public HierarchyNode(String id, String label, HierarchyLevel level, List<HierarchyNode> children,
                         RulesConfig rules, String visibilityRule, Map<String, Object> pickAssigns) {
        this.id = id;
        this.label = label;
        this.level = level != null ? level : HierarchyLevel.UNKNOWN;
        this.children = children != null ? List.copyOf(children) : List.of();
        this.rules = rules;
        this.visibilityRule = visibilityRule != null && !visibilityRule.isBlank() ? visibilityRule : null;
        this.pickAssigns = pickAssigns != null ? Collections.unmodifiableMap(new LinkedHashMap<>(pickAssigns)) : Map.of();
    }

    /**
     * JSON factory. Children listed under {@code stages}, {@code blocks} or {@code tasks} take that level unless
     * they declare one, so a stage may hold tasks directly.
     */
    @JsonCreator
    static HierarchyNode fromJson(
            @JsonProperty("id") String id,
            @JsonProperty("label") @JsonAlias("title") String label,
            @JsonProperty("level") HierarchyLevel level,
            @JsonProperty("children") List<HierarchyNode> children,
            @JsonProperty("stages") List<HierarchyNode> stages,
            @JsonProperty("blocks") List<HierarchyNode> blocks,
            @JsonProperty("tasks") List<HierarchyNode> tasks,
            @JsonProperty("rules") RulesConfig rules,
            @JsonProperty("visibility_rule") @JsonAlias("visibilityRule") String visibilityRule,
            @JsonProperty("pick_assigns") @JsonAlias("pickAssigns") Map<String, Object> pickAssigns) {
        List<HierarchyNode> all = new ArrayList<>();
        if (children != null) all.addAll(children);
        addWithLevel(all, stages, HierarchyLevel.STAGE);
        addWithLevel(all, blocks, HierarchyLevel.BLOCK);
        addWithLevel(all, tasks, HierarchyLevel.TASK);
        return new HierarchyNode(id, label, level, all, rules, visibilityRule, pickAssigns);
    }

    private static void addWithLevel(List<HierarchyNode> out, List<HierarchyNode> nodes, HierarchyLevel level) {
        if (nodes == null) return;
        for (HierarchyNode node : nodes) {
            out.add(node.getLevel() == HierarchyLevel.UNKNOWN ? node.withLevel(level) : node);
        }
    }

    public static HierarchyNode task(String id) {
        return new HierarchyNode(id, id, HierarchyLevel.TASK, null, null, null, null);
    }

    public String getId() {
        return id;
    }

    /** Display label; falls back to the id. */
    public String getLabel() {
        return label != null && !label.isBlank() ? label : id;
    }

    public HierarchyLevel getLevel() {
        return level;
    }

    public List<HierarchyNode> getChildren() {
        return children;
    }

    public RulesConfig getRules() {
        return rules;
    }

    @JsonProperty("visibility_rule")
    public String getVisibilityRule() {
        return visibilityRule;
    }

    @JsonProperty("pick_assigns")
    public Map<String, Object> getPickAssigns() {
        return pickAssigns;
    }

    /** Visibility expression in effect: the node's own rule, else {@code rules.visibility}. */
    @JsonIgnore
    public String effectiveVisibilityRule() {
        if (visibilityRule != null) return visibilityRule;
        return rules != null ? rules.getVisibility() : null;
    }

    /** Returns a copy with the given level (used when the level is inferred from depth). */
    public HierarchyNode withLevel(HierarchyLevel newLevel) {
        return new HierarchyNode(id, label, newLevel, children, rules, visibilityRule, pickAssigns);
    }

    @Override
    public String toString() {
        return level.toValue() + ":" + id;
    }
}
