package com.pathway.hierarchy.tree;

import com.pathway.hierarchy.ConfigurationException;
import com.pathway.hierarchy.config.ExperimentDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Flat arena of the nodes of one experiment version, keyed by id. Children are kept as id lists and
 * cross references (quota fallbacks, redirects) are plain lookups into the same map.
 * <p>
 * A synthetic root with the experiment id holds the top-level phases, so the phase sequence is resolved
 * like any other container. Levels missing from the JSON are inferred from depth. Immutable after
 * construction and safe to share across threads.
 */
public final class Hierarchy {

    private static final Logger log = LoggerFactory.getLogger(Hierarchy.class);

    private final String experimentId;
    private final String version;
    private final Map<String, HierarchyNode> nodesById;
    private final Map<String, List<String>> childIdsById;
    private final Map<String, String> parentIdById;
    private final Map<String, Map<String, List<String>>> effectivePickAssigns = new ConcurrentHashMap<>();

    private Hierarchy(String experimentId, String version, Map<String, HierarchyNode> nodesById,
                      Map<String, List<String>> childIdsById, Map<String, String> parentIdById) {
        this.experimentId = experimentId;
        this.version = version;
        this.nodesById = Collections.unmodifiableMap(nodesById);
        this.childIdsById = Collections.unmodifiableMap(childIdsById);
        this.parentIdById = Collections.unmodifiableMap(parentIdById);
    }

    /**
     * Builds the arena from a definition.
     *
     * @throws ConfigurationException when the experiment id is blank or a node id is blank or duplicated
     */
    public static Hierarchy from(ExperimentDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        String experimentId = definition.getExperimentId();
        if (experimentId == null || experimentId.isBlank()) {
            throw new ConfigurationException("Experiment id is required");
        }
        Map<String, HierarchyNode> nodes = new LinkedHashMap<>();
        Map<String, List<String>> childIds = new LinkedHashMap<>();
        Map<String, String> parents = new LinkedHashMap<>();

        HierarchyNode root = new HierarchyNode(experimentId, definition.getTitle(), HierarchyLevel.EXPERIMENT,
                definition.getPhases(), definition.getRules(), null, null);
        nodes.put(experimentId, root);
        List<String> rootChildren = new ArrayList<>();
        for (HierarchyNode phase : definition.getPhases()) {
            rootChildren.add(addNode(phase, experimentId, 0, nodes, childIds, parents));
        }
        childIds.put(experimentId, List.copyOf(rootChildren));
        log.debug("Hierarchy built | experimentId={} | version={} | nodes={}", experimentId, definition.getVersion(), nodes.size() - 1);
        return new Hierarchy(experimentId, definition.getVersion(), nodes, childIds, parents);
    }

    private static String addNode(HierarchyNode node, String parentId, int depth,
                                  Map<String, HierarchyNode> nodes, Map<String, List<String>> childIds,
                                  Map<String, String> parents) {
        String id = node.getId();
        if (id == null || id.isBlank()) {
            throw new ConfigurationException("Node without id under " + parentId);
        }
        if (nodes.containsKey(id)) {
            throw new ConfigurationException("Duplicate node id: " + id);
        }
        HierarchyNode stored = node.getLevel() == HierarchyLevel.UNKNOWN
                ? node.withLevel(HierarchyLevel.forDepth(depth))
                : node;
        nodes.put(id, stored);
        parents.put(id, parentId);
        List<String> ids = new ArrayList<>(node.getChildren().size());
        for (HierarchyNode child : node.getChildren()) {
            ids.add(addNode(child, id, depth + 1, nodes, childIds, parents));
        }
        childIds.put(id, List.copyOf(ids));
        return id;
    }

    public String getExperimentId() {
        return experimentId;
    }

    public String getVersion() {
        return version;
    }

    /** Id of the synthetic root (the experiment id). */
    public String getRootId() {
        return experimentId;
    }

    public HierarchyNode root() {
        return nodesById.get(experimentId);
    }

    /** Node by id, or null. */
    public HierarchyNode node(String id) {
        return id != null ? nodesById.get(id) : null;
    }

    /**
     * Node by id.
     *
     * @throws ConfigurationException when the id is not part of this experiment
     */
    public HierarchyNode requireNode(String id) {
        HierarchyNode node = node(id);
        if (node == null) {
            throw new ConfigurationException("Unknown node id '" + id + "' in experiment " + experimentId);
        }
        return node;
    }

    public boolean contains(String id) {
        return id != null && nodesById.containsKey(id);
    }

    /** Child ids in declared order; empty for tasks and unknown ids. */
    public List<String> childIds(String id) {
        List<String> ids = childIdsById.get(id);
        return ids != null ? ids : List.of();
    }

    /** Parent id, or null for the root and unknown ids. */
    public String parentId(String id) {
        return parentIdById.get(id);
    }

    public HierarchyLevel level(String id) {
        HierarchyNode node = node(id);
        return node != null ? node.getLevel() : HierarchyLevel.UNKNOWN;
    }

    public boolean isTask(String id) {
        HierarchyNode node = node(id);
        return node != null && node.getLevel() == HierarchyLevel.TASK;
    }

    /** Sibling declared right after {@code id}, or null when it is the last child. */
    public String nextSiblingId(String id) {
        String parent = parentId(id);
        if (parent == null) return null;
        List<String> siblings = childIds(parent);
        int idx = siblings.indexOf(id);
        return idx >= 0 && idx + 1 < siblings.size() ? siblings.get(idx + 1) : null;
    }

    /** Ids from the root down to {@code id}, root first. Empty for unknown ids. */
    public List<String> ancestry(String id) {
        if (!contains(id)) return List.of();
        List<String> chain = new ArrayList<>();
        for (String cur = id; cur != null; cur = parentId(cur)) {
            chain.add(0, cur);
        }
        return chain;
    }

    /** Every node id (root included) in depth-first declared order. */
    public Set<String> nodeIds() {
        return nodesById.keySet();
    }

    public int size() {
        return nodesById.size();
    }

    /**
     * Pick-assign values a node contributes: its own {@code pick_assigns} when it has any, otherwise the union
     * of its descendants' effective values. Values are compared as strings.
     */
    public Map<String, List<String>> effectivePickAssigns(String id) {
        if (!contains(id)) return Map.of();
        Map<String, List<String>> cached = effectivePickAssigns.get(id);
        if (cached != null) return cached;
        // not computeIfAbsent: the computation recurses into this map
        Map<String, List<String>> computed = computeEffectivePickAssigns(id);
        Map<String, List<String>> prior = effectivePickAssigns.putIfAbsent(id, computed);
        return prior != null ? prior : computed;
    }

    private Map<String, List<String>> computeEffectivePickAssigns(String id) {
        HierarchyNode node = nodesById.get(id);
        Map<String, List<String>> result = new LinkedHashMap<>();
        if (!node.getPickAssigns().isEmpty()) {
            node.getPickAssigns().forEach((k, v) -> result.put(k, List.of(String.valueOf(v))));
            return Collections.unmodifiableMap(result);
        }
        Map<String, Set<String>> merged = new LinkedHashMap<>();
        for (String childId : childIds(id)) {
            effectivePickAssigns(childId).forEach((k, values) ->
                    merged.computeIfAbsent(k, x -> new LinkedHashSet<>()).addAll(values));
        }
        merged.forEach((k, values) -> result.put(k, List.copyOf(values)));
        return Collections.unmodifiableMap(result);
    }
}
