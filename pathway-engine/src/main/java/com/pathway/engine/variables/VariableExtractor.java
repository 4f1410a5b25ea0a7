package com.pathway.engine.variables;

import com.pathway.hierarchy.config.PickCondition;
import com.pathway.hierarchy.config.PickConfig;
import com.pathway.hierarchy.tree.Hierarchy;
import com.pathway.hierarchy.tree.HierarchyNode;
import com.pathway.rules.RuleEvaluator;
import com.pathway.rules.ast.VariableUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Collects the variables a simulation needs values for.
 * <p>
 * Visibility rules contribute every variable path they reference. The type is inferred from how the variable is
 * used: ordering comparisons or numeric literals make it numeric, boolean literals or bare truthiness tests make it
 * boolean, string literals make it categorical (the literals become its options). Pick conditions contribute
 * {@code pick_assigns.<variable>} as categorical, with the values assigned anywhere in the tree as options.
 */
public final class VariableExtractor {

    private static final Logger log = LoggerFactory.getLogger(VariableExtractor.class);

    public static final String PICK_ASSIGNS_PREFIX = "pick_assigns.";

    private static final Set<String> ORDERING_OPERATORS = Set.of("<", ">", "<=", ">=");

    private final RuleEvaluator evaluator;

    public VariableExtractor(RuleEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    public List<ExtractedVariable> extract(Hierarchy hierarchy) {
        Map<String, Accumulator> byPath = new LinkedHashMap<>();
        for (String nodeId : hierarchy.nodeIds()) {
            HierarchyNode node = hierarchy.requireNode(nodeId);
            String rule = node.effectiveVisibilityRule();
            for (VariableUsage usage : evaluator.usages(rule)) {
                byPath.computeIfAbsent(usage.getPath().getText(), Accumulator::new).add(nodeId, usage);
            }
        }
        for (String nodeId : hierarchy.nodeIds()) {
            HierarchyNode node = hierarchy.requireNode(nodeId);
            PickConfig pick = node.getRules() != null ? node.getRules().getPick() : null;
            if (pick == null) continue;
            for (PickCondition condition : pick.getConditions()) {
                String path = PICK_ASSIGNS_PREFIX + condition.getVariable();
                Accumulator acc = byPath.computeIfAbsent(path, Accumulator::new);
                acc.pickVariable = true;
                acc.sources.add(nodeId);
                acc.strings.addAll(assignedValues(hierarchy, condition.getVariable()));
            }
        }
        List<ExtractedVariable> out = new ArrayList<>(byPath.size());
        byPath.values().forEach(acc -> out.add(acc.toVariable()));
        log.debug("Variables extracted | experimentId={} | count={}", hierarchy.getExperimentId(), out.size());
        return out;
    }

    private static Set<String> assignedValues(Hierarchy hierarchy, String variable) {
        Set<String> values = new LinkedHashSet<>();
        for (String nodeId : hierarchy.nodeIds()) {
            Object value = hierarchy.requireNode(nodeId).getPickAssigns().get(variable);
            if (value != null) values.add(String.valueOf(value));
        }
        return values;
    }

    private static final class Accumulator {
        final String path;
        final Set<String> sources = new LinkedHashSet<>();
        final Set<String> strings = new LinkedHashSet<>();
        boolean numeric;
        boolean bool;
        boolean truthiness;
        boolean pickVariable;
        Double min;
        Double max;

        Accumulator(String path) {
            this.path = path;
        }

        void add(String nodeId, VariableUsage usage) {
            sources.add(nodeId);
            String operator = usage.getOperator();
            if (operator == null) truthiness = true;
            else if (ORDERING_OPERATORS.contains(operator)) numeric = true;
            for (Object value : usage.getComparedValues()) {
                if (value instanceof Number) {
                    numeric = true;
                    double d = ((Number) value).doubleValue();
                    min = min == null ? d : Math.min(min, d);
                    max = max == null ? d : Math.max(max, d);
                } else if (value instanceof Boolean) {
                    bool = true;
                } else if (value != null) {
                    strings.add(String.valueOf(value));
                }
            }
        }

        ExtractedVariable toVariable() {
            VariableType type;
            if (pickVariable || !strings.isEmpty()) type = VariableType.CATEGORICAL;
            else if (numeric) type = VariableType.NUMERIC;
            else if (bool || truthiness) type = VariableType.BOOLEAN;
            else type = VariableType.UNKNOWN;
            List<String> options = type == VariableType.CATEGORICAL ? new ArrayList<>(strings) : null;
            boolean withBounds = type == VariableType.NUMERIC;
            return new ExtractedVariable(path, type, options, withBounds ? min : null, withBounds ? max : null,
                    new ArrayList<>(sources));
        }
    }
}
