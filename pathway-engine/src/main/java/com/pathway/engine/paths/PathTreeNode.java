package com.pathway.engine.paths;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.pathway.hierarchy.config.PickCondition;
import com.pathway.hierarchy.config.QuotaConfig;

import java.util.List;
import java.util.Map;

/**
 * Node of the editor path tree. Besides hierarchy nodes ({@code experiment}, {@code phase}, {@code stage},
 * {@code block}, {@code task}) the tree has synthetic {@code pickGroup} and {@code orderGroup} nodes wrapping the
 * children a pick or a non-sequential ordering applies to.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "type", "label", "visibility", "isConditional", "ordering", "strategy", "count",
        "conditions", "weights", "quota", "pickAssigns", "children"})
public final class PathTreeNode {

    public static final String PICK_GROUP = "pickGroup";
    public static final String ORDER_GROUP = "orderGroup";

    private final String id;
    private final String type;
    private final String label;
    private final String visibility;
    private final String ordering;
    private final String strategy;
    private final Integer count;
    private final List<PickCondition> conditions;
    private final Map<String, Double> weights;
    private final QuotaConfig quota;
    private final Map<String, Object> pickAssigns;
    private final List<PathTreeNode> children;

    private PathTreeNode(Builder b) {
        this.id = b.id;
        this.type = b.type;
        this.label = b.label;
        this.visibility = b.visibility;
        this.ordering = b.ordering;
        this.strategy = b.strategy;
        this.count = b.count;
        this.conditions = b.conditions;
        this.weights = b.weights != null && !b.weights.isEmpty() ? Map.copyOf(b.weights) : null;
        this.quota = b.quota;
        this.pickAssigns = b.pickAssigns != null && !b.pickAssigns.isEmpty() ? Map.copyOf(b.pickAssigns) : null;
        this.children = b.children != null && !b.children.isEmpty() ? List.copyOf(b.children) : null;
    }

    static Builder builder(String id, String type, String label) {
        return new Builder(id, type, label);
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("type")
    public String getType() {
        return type;
    }

    @JsonProperty("label")
    public String getLabel() {
        return label;
    }

    @JsonProperty("visibility")
    public String getVisibility() {
        return visibility;
    }

    /** Null (omitted) for unconditional nodes. */
    @JsonProperty("isConditional")
    public Boolean getConditional() {
        return visibility != null ? Boolean.TRUE : null;
    }

    @JsonProperty("ordering")
    public String getOrdering() {
        return ordering;
    }

    @JsonProperty("strategy")
    public String getStrategy() {
        return strategy;
    }

    @JsonProperty("count")
    public Integer getCount() {
        return count;
    }

    @JsonProperty("conditions")
    public List<PickCondition> getConditions() {
        return conditions;
    }

    @JsonProperty("weights")
    public Map<String, Double> getWeights() {
        return weights;
    }

    @JsonProperty("quota")
    public QuotaConfig getQuota() {
        return quota;
    }

    @JsonProperty("pickAssigns")
    public Map<String, Object> getPickAssigns() {
        return pickAssigns;
    }

    /** Children; empty for tasks. */
    @JsonProperty("children")
    public List<PathTreeNode> getChildren() {
        return children;
    }

    public List<PathTreeNode> childList() {
        return children != null ? children : List.of();
    }

    @Override
    public String toString() {
        return type + "(" + id + ")";
    }

    static final class Builder {
        private final String id;
        private final String type;
        private final String label;
        private String visibility;
        private String ordering;
        private String strategy;
        private Integer count;
        private List<PickCondition> conditions;
        private Map<String, Double> weights;
        private QuotaConfig quota;
        private Map<String, Object> pickAssigns;
        private List<PathTreeNode> children;

        private Builder(String id, String type, String label) {
            this.id = id;
            this.type = type;
            this.label = label;
        }

        Builder visibility(String visibility) {
            this.visibility = visibility;
            return this;
        }

        Builder ordering(String ordering) {
            this.ordering = ordering;
            return this;
        }

        Builder strategy(String strategy) {
            this.strategy = strategy;
            return this;
        }

        Builder count(Integer count) {
            this.count = count;
            return this;
        }

        Builder conditions(List<PickCondition> conditions) {
            this.conditions = conditions != null && !conditions.isEmpty() ? List.copyOf(conditions) : null;
            return this;
        }

        Builder weights(Map<String, Double> weights) {
            this.weights = weights;
            return this;
        }

        Builder quota(QuotaConfig quota) {
            this.quota = quota;
            return this;
        }

        Builder pickAssigns(Map<String, Object> pickAssigns) {
            this.pickAssigns = pickAssigns;
            return this;
        }

        Builder children(List<PathTreeNode> children) {
            this.children = children;
            return this;
        }

        PathTreeNode build() {
            return new PathTreeNode(this);
        }
    }
}
