package com.pathway.engine.paths;

import com.pathway.engine.ordering.OrderingResolver;
import com.pathway.hierarchy.config.OrderingMode;
import com.pathway.hierarchy.config.PickConfig;
import com.pathway.hierarchy.config.RulesConfig;
import com.pathway.hierarchy.tree.Hierarchy;
import com.pathway.hierarchy.tree.HierarchyNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the reachable-path tree shown in the editor. Pure function of the hierarchy: no participant state,
 * no counters.
 * <p>
 * A pick wraps the container's children in a {@code pickGroup}; a non-sequential ordering wraps the (picked)
 * children in an {@code orderGroup} inside it.
 */
public final class PathTreeBuilder {

    private PathTreeBuilder() {
    }

    public static PathTreeNode build(Hierarchy hierarchy) {
        return toTree(hierarchy, hierarchy.root());
    }

    private static PathTreeNode toTree(Hierarchy hierarchy, HierarchyNode node) {
        List<PathTreeNode> children = new ArrayList<>();
        for (String childId : hierarchy.childIds(node.getId())) {
            children.add(toTree(hierarchy, hierarchy.requireNode(childId)));
        }
        RulesConfig rules = node.getRules();
        if (!children.isEmpty() && rules != null) {
            OrderingMode mode = OrderingResolver.modeOf(node);
            if (mode != OrderingMode.SEQUENTIAL) {
                children = List.of(PathTreeNode.builder(node.getId() + "#order", PathTreeNode.ORDER_GROUP, orderLabel(mode))
                        .ordering(mode.toValue())
                        .weights(mode == OrderingMode.WEIGHTED ? rules.getWeights() : null)
                        .children(children)
                        .build());
            }
            PickConfig pick = rules.getPick();
            if (pick != null) {
                int candidates = hierarchy.childIds(node.getId()).size();
                children = List.of(PathTreeNode.builder(node.getId() + "#pick", PathTreeNode.PICK_GROUP,
                                "Pick " + pick.getCount() + " of " + candidates)
                        .strategy(pick.getStrategy().toValue())
                        .count(pick.getCount())
                        .conditions(pick.getConditions())
                        .weights(pick.getWeights())
                        .children(children)
                        .build());
            }
        }
        return PathTreeNode.builder(node.getId(), node.getLevel().toValue(), node.getLabel())
                .visibility(node.effectiveVisibilityRule())
                .quota(rules != null ? rules.getQuota() : null)
                .pickAssigns(node.getPickAssigns())
                .children(children)
                .build();
    }

    static String orderLabel(OrderingMode mode) {
        switch (mode) {
            case RANDOMIZED:
                return "Random Order";
            case BALANCED:
                return "Balanced Distribution";
            case WEIGHTED:
                return "Weighted Distribution";
            case LATIN_SQUARE:
                return "Latin Square";
            default:
                return "Sequential";
        }
    }
}
