package com.pathway.hierarchy.validation;

import com.pathway.hierarchy.config.ExperimentDefinition;
import com.pathway.hierarchy.config.OrderingMode;
import com.pathway.hierarchy.config.PickCondition;
import com.pathway.hierarchy.config.PickConditionOperator;
import com.pathway.hierarchy.config.PickConfig;
import com.pathway.hierarchy.config.PickStrategy;
import com.pathway.hierarchy.config.QuotaConfig;
import com.pathway.hierarchy.config.QuotaStrategy;
import com.pathway.hierarchy.config.RulesConfig;
import com.pathway.hierarchy.tree.HierarchyLevel;
import com.pathway.hierarchy.tree.HierarchyNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Publish-time validation of an experiment definition. Checks id uniqueness, level nesting and the
 * ordering, weight, pick and quota rules of every container, including quota fallback references.
 */
public final class HierarchyValidator {

    /** Counter level that holds quota admissions; node ids share its namespace. */
    static final String RESERVED_QUOTA_ID = "quota";
    /** Separators used in derived counter and assignment keys. */
    private static final String RESERVED_CHARACTERS = "#:/";

    private final ExpressionCheck expressionCheck;

    public HierarchyValidator() {
        this(ExpressionCheck.NONE);
    }

    public HierarchyValidator(ExpressionCheck expressionCheck) {
        this.expressionCheck = Objects.requireNonNull(expressionCheck, "expressionCheck");
    }

    public ValidationResult validate(ExperimentDefinition definition) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (definition == null) {
            return ValidationResult.of(List.of("Experiment definition is missing"), List.of());
        }
        String experimentId = definition.getExperimentId();
        if (experimentId == null || experimentId.isBlank()) {
            errors.add("Experiment id is required");
        }
        if (definition.getPhases().isEmpty()) {
            warnings.add("Experiment has no phases");
        }

        Map<String, HierarchyNode> byId = new HashMap<>();
        Map<String, String> parentOf = new HashMap<>();
        Set<String> duplicates = new HashSet<>();
        for (HierarchyNode phase : definition.getPhases()) {
            index(phase, experimentId, byId, parentOf, duplicates, errors);
        }
        if (experimentId != null && byId.containsKey(experimentId)) {
            errors.add("Node id '" + experimentId + "' collides with the experiment id");
        }
        for (String dup : duplicates) {
            errors.add("Duplicate node id: " + dup);
        }

        checkRules("experiment " + experimentId, definition.getRules(), definition.getPhases(), errors, warnings);
        for (HierarchyNode phase : definition.getPhases()) {
            checkNode(phase, HierarchyLevel.EXPERIMENT, byId, parentOf, errors, warnings);
        }
        return ValidationResult.of(errors, warnings);
    }

    private static void index(HierarchyNode node, String parentId, Map<String, HierarchyNode> byId,
                              Map<String, String> parentOf, Set<String> duplicates, List<String> errors) {
        String id = node.getId();
        if (id == null || id.isBlank()) {
            errors.add("Node without id under " + parentId);
        } else {
            if (RESERVED_QUOTA_ID.equals(id)) {
                errors.add("Node id '" + id + "' is reserved");
            } else if (containsReservedCharacter(id)) {
                errors.add("Node id '" + id + "' must not contain any of '" + RESERVED_CHARACTERS + "'");
            }
            if (byId.putIfAbsent(id, node) != null) {
                duplicates.add(id);
            } else {
                parentOf.put(id, parentId);
            }
        }
        for (HierarchyNode child : node.getChildren()) {
            index(child, id, byId, parentOf, duplicates, errors);
        }
    }

    private static boolean containsReservedCharacter(String id) {
        for (int i = 0; i < id.length(); i++) {
            if (RESERVED_CHARACTERS.indexOf(id.charAt(i)) >= 0) return true;
        }
        return false;
    }

    private void checkNode(HierarchyNode node, HierarchyLevel parentLevel, Map<String, HierarchyNode> byId,
                           Map<String, String> parentOf, List<String> errors, List<String> warnings) {
        HierarchyLevel level = node.getLevel();
        HierarchyLevel effective = level != HierarchyLevel.UNKNOWN ? level : HierarchyLevel.forDepth(parentLevel.rank());
        String where = effective.toValue() + " " + node.getId();
        if (level != HierarchyLevel.UNKNOWN && parentLevel.rank() >= 0 && level.rank() <= parentLevel.rank()) {
            errors.add(where + ": level " + level.toValue() + " cannot be nested under " + parentLevel.toValue());
        }
        if (level == HierarchyLevel.TASK && !node.getChildren().isEmpty()) {
            errors.add(where + ": tasks cannot have children");
        }
        String visibility = node.effectiveVisibilityRule();
        if (visibility != null) {
            String problem = expressionCheck.check(visibility);
            if (problem != null) {
                warnings.add(where + ": visibility rule '" + visibility + "' is malformed (" + problem + ")");
            }
        }
        checkRules(where, node.getRules(), node.getChildren(), errors, warnings);
        checkQuota(node, where, byId, parentOf, errors, warnings);
        for (HierarchyNode child : node.getChildren()) {
            checkNode(child, effective, byId, parentOf, errors, warnings);
        }
    }

    private static void checkRules(String where, RulesConfig rules, List<HierarchyNode> children,
                                   List<String> errors, List<String> warnings) {
        if (rules == null) return;
        if (rules.getOrderingMode() == OrderingMode.UNKNOWN) {
            warnings.add(where + ": unknown ordering '" + rules.getOrdering() + "', sequential will be used");
        }
        Set<String> childIds = new HashSet<>();
        for (HierarchyNode child : children) {
            if (child.getId() != null) childIds.add(child.getId());
        }
        Map<String, Double> weights = rules.getWeights();
        if (!weights.isEmpty() || rules.getOrderingMode() == OrderingMode.WEIGHTED) {
            for (String childId : childIds) {
                Double w = weights.get(childId);
                if (w == null) {
                    errors.add(where + ": weights must cover child " + childId);
                } else if (!(w > 0) || w.isInfinite()) {
                    errors.add(where + ": weight of child " + childId + " must be positive");
                }
            }
            for (String key : weights.keySet()) {
                if (!childIds.contains(key)) {
                    warnings.add(where + ": weight for unknown child " + key);
                }
            }
        }
        PickConfig pick = rules.getPick();
        if (pick != null) {
            if (pick.getCount() < 1 || pick.getCount() > children.size()) {
                errors.add(where + ": pick count " + pick.getCount() + " must be between 1 and " + children.size());
            }
            if (pick.getStrategy() == PickStrategy.UNKNOWN) {
                errors.add(where + ": unknown pick strategy");
            }
            for (PickCondition condition : pick.getConditions()) {
                if (condition.getVariable() == null || condition.getVariable().isBlank()) {
                    errors.add(where + ": pick condition without variable");
                }
                if (condition.getOperator() == PickConditionOperator.UNKNOWN) {
                    errors.add(where + ": unknown pick condition operator for " + condition.getVariable());
                }
            }
            pick.getWeights().forEach((childId, w) -> {
                if (w == null || !(w > 0) || w.isInfinite()) {
                    errors.add(where + ": pick weight of child " + childId + " must be positive");
                }
            });
        }
    }

    private static void checkQuota(HierarchyNode node, String where, Map<String, HierarchyNode> byId,
                                   Map<String, String> parentOf, List<String> errors, List<String> warnings) {
        RulesConfig rules = node.getRules();
        QuotaConfig quota = rules != null ? rules.getQuota() : null;
        if (quota == null) return;
        if (quota.getLimit() < 0) {
            errors.add(where + ": quota limit must be zero or positive");
        }
        if (quota.getStrategy() == QuotaStrategy.UNKNOWN) {
            errors.add(where + ": unknown quota strategy");
        }
        String fallback = quota.getFallbackNodeId();
        if (quota.getStrategy() == QuotaStrategy.SHOW_ALTERNATIVE && fallback == null) {
            errors.add(where + ": show_alternative requires fallback_node_id");
        }
        if (fallback != null) {
            if (!byId.containsKey(fallback)) {
                errors.add(where + ": fallback node " + fallback + " does not exist");
            } else if (fallback.equals(node.getId()) || isDescendant(fallback, node.getId(), parentOf)) {
                errors.add(where + ": fallback node " + fallback + " must lie outside the node's own subtree");
            }
        } else if (quota.getStrategy() == QuotaStrategy.SKIP_IF_FULL && isLastSibling(node.getId(), parentOf, byId)) {
            warnings.add(where + ": skip_if_full without fallback on the last sibling; full quota ends the participant's path");
        }
    }

    private static boolean isDescendant(String candidate, String ancestor, Map<String, String> parentOf) {
        for (String cur = parentOf.get(candidate); cur != null; cur = parentOf.get(cur)) {
            if (cur.equals(ancestor)) return true;
        }
        return false;
    }

    private static boolean isLastSibling(String id, Map<String, String> parentOf, Map<String, HierarchyNode> byId) {
        String parent = parentOf.get(id);
        HierarchyNode parentNode = parent != null ? byId.get(parent) : null;
        if (parentNode == null) return false;
        List<HierarchyNode> siblings = parentNode.getChildren();
        return !siblings.isEmpty() && id.equals(siblings.get(siblings.size() - 1).getId());
    }
}
