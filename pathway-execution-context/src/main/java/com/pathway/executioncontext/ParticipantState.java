package com.pathway.executioncontext;

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
 * Per-session participant state read by rules and written by the path resolver and by completion events.
 * <p>
 * {@code responses} maps a stage id (or any response path root) to collected values, usually a nested map.
 * {@code environment} holds participant attributes, URL parameters and environment info.
 * {@code assignments} maps a decision key (normally a level id) to the child id(s) assigned there.
 * {@code pickAssignments} accumulates the pick-assign values of every child picked so far.
 * <p>
 * Top-level maps are concurrent; putting a null value removes the key.
 */
public final class ParticipantState {

    private final String sessionId;
    private final long seed;
    private final Map<String, Object> responses = new ConcurrentHashMap<>();
    private final Map<String, Object> scores = new ConcurrentHashMap<>();
    private final Map<String, Object> environment = new ConcurrentHashMap<>();
    private final Map<String, List<String>> assignments = new ConcurrentHashMap<>();
    private final Map<String, List<String>> pickAssignments = new ConcurrentHashMap<>();
    private final Set<String> completedTaskIds = Collections.synchronizedSet(new LinkedHashSet<>());
    private final Set<String> closedRoutes = ConcurrentHashMap.newKeySet();
    private final SessionCancellation cancellation = new SessionCancellation();

    public ParticipantState(String sessionId, long seed) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.seed = seed;
    }

    /** State for a session with the seed derived from its id. */
    public static ParticipantState forSession(String sessionId) {
        return new ParticipantState(sessionId, Seeds.fromSessionId(sessionId));
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getSeed() {
        return seed;
    }

    public Map<String, Object> getResponses() {
        return Collections.unmodifiableMap(responses);
    }

    public Map<String, Object> getScores() {
        return Collections.unmodifiableMap(scores);
    }

    public Map<String, Object> getEnvironment() {
        return Collections.unmodifiableMap(environment);
    }

    public ParticipantState putResponse(String key, Object value) {
        put(responses, key, value);
        return this;
    }

    public ParticipantState putScore(String name, Object value) {
        put(scores, name, value);
        return this;
    }

    public ParticipantState putEnvironment(String key, Object value) {
        put(environment, key, value);
        return this;
    }

    private static void put(Map<String, Object> map, String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (value == null) {
            map.remove(key);
        } else {
            map.put(key, value);
        }
    }

    /** Assignment snapshot ordered by key. */
    public Map<String, List<String>> getAssignments() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        assignments.keySet().stream().sorted().forEach(k -> copy.put(k, assignments.get(k)));
        return Collections.unmodifiableMap(copy);
    }

    /** Child ids assigned under {@code key}, or null when no decision was made yet. */
    public List<String> getAssignment(String key) {
        return assignments.get(key);
    }

    public boolean hasAssignment(String key) {
        return assignments.containsKey(key);
    }

    public void assign(String key, List<String> childIds) {
        assignments.put(Objects.requireNonNull(key, "key"), List.copyOf(childIds));
    }

    /** Stores the assignment only when none exists; returns the assignment in effect. */
    public List<String> assignIfAbsent(String key, List<String> childIds) {
        List<String> prior = assignments.putIfAbsent(Objects.requireNonNull(key, "key"), List.copyOf(childIds));
        return prior != null ? prior : assignments.get(key);
    }

    public Map<String, List<String>> getPickAssignments() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(pickAssignments));
    }

    /** Values accumulated so far for a pick variable; empty when none. */
    public List<String> pickValues(String variable) {
        List<String> values = pickAssignments.get(variable);
        return values != null ? values : List.of();
    }

    /** Adds values to the accumulated pick assignments, keeping insertion order and skipping duplicates. */
    public void accumulatePickAssigns(Map<String, List<String>> values) {
        if (values == null) return;
        values.forEach((variable, vals) -> pickAssignments.merge(variable, List.copyOf(vals), (old, add) -> {
            Set<String> merged = new LinkedHashSet<>(old);
            merged.addAll(add);
            return List.copyOf(merged);
        }));
    }

    public void markCompleted(String taskId) {
        completedTaskIds.add(taskId);
    }

    public boolean isCompleted(String taskId) {
        return completedTaskIds.contains(taskId);
    }

    public List<String> getCompletedTaskIds() {
        synchronized (completedTaskIds) {
            return List.copyOf(new ArrayList<>(completedTaskIds));
        }
    }

    /**
     * Marks a counted route (a level/child pair whose counters this session holds) as settled by completion or
     * abandonment.
     *
     * @return true when the route was open until now
     */
    public boolean closeRoute(String routeKey) {
        return closedRoutes.add(Objects.requireNonNull(routeKey, "routeKey"));
    }

    public boolean isRouteClosed(String routeKey) {
        return closedRoutes.contains(routeKey);
    }

    public SessionCancellation getCancellation() {
        return cancellation;
    }

    /**
     * Copy with the same id, seed, responses, scores and environment but no assignments, pick values, completions or closed routes.
     * Used to re-run decisions from a clean slate (replay, previews).
     */
    public ParticipantState freshCopy() {
        ParticipantState copy = new ParticipantState(sessionId, seed);
        copy.responses.putAll(responses);
        copy.scores.putAll(scores);
        copy.environment.putAll(environment);
        return copy;
    }
}
