package com.pathway.service;

import com.pathway.config.PathwayConfig;
import com.pathway.distribution.DistributionCounts;
import com.pathway.engine.TraversalResult;
import com.pathway.engine.paths.PathTreeBuilder;
import com.pathway.engine.paths.PathTreeNode;
import com.pathway.engine.replay.AssignmentReplayer;
import com.pathway.engine.variables.ExtractedVariable;
import com.pathway.engine.variables.VariableExtractor;
import com.pathway.executioncontext.ParticipantState;
import com.pathway.features.quota.QuotaArbiter;
import com.pathway.hierarchy.config.ExperimentDefinition;
import com.pathway.hierarchy.load.ExperimentLoader;
import com.pathway.hierarchy.load.ExperimentSource;
import com.pathway.hierarchy.tree.Hierarchy;
import com.pathway.hierarchy.tree.HierarchyLevel;
import com.pathway.hierarchy.tree.HierarchyNode;
import com.pathway.ledger.AssignmentRecord;
import com.pathway.simulator.SimulationResult;
import com.pathway.simulator.VariableDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Transport-agnostic facade over published experiments and participant sessions.
 * <p>
 * Calls for one session are serialized on that session; different sessions run concurrently and only meet in the
 * experiment's distribution store.
 */
public final class ExperimentService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExperimentService.class);

    private final PathwayConfig config;
    private final ExperimentRegistry registry;
    private final SessionRepository sessions;
    private final ExperimentLoader loader;

    public ExperimentService(PathwayConfig config) {
        this(config, new ExperimentRegistry(config), new InMemorySessionRepository(), null);
    }

    /**
     * @param source optional definition source consulted before {@link PathwayConfig#getExperimentDir()}
     */
    public ExperimentService(PathwayConfig config, ExperimentRegistry registry, SessionRepository sessions,
                             ExperimentSource source) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        String dir = config.getExperimentDir();
        this.loader = new ExperimentLoader(source, dir != null && !dir.isBlank() ? Path.of(dir) : null);
    }

    public ExperimentScope publish(ExperimentDefinition definition) {
        ExperimentScope scope = registry.publish(definition);
        int dropped = sessions.removeExperiment(scope.getHierarchy().getExperimentId());
        if (dropped > 0) {
            log.info("Sessions of replaced experiment dropped | experimentId={} | sessions={}",
                    scope.getHierarchy().getExperimentId(), dropped);
        }
        return scope;
    }

    /** Loads a definition through the source and experiment directory, then publishes it. */
    public ExperimentScope loadAndPublish(String experimentId, String version) {
        return publish(loader.load(experimentId, version));
    }

    /**
     * Opens a session, or returns the existing one with that id (its environment is left as it was).
     *
     * @param environment participant attributes and URL parameters readable by visibility rules; may be null
     */
    public Session startSession(String experimentId, String sessionId, Map<String, Object> environment) {
        Objects.requireNonNull(sessionId, "sessionId");
        registry.get(experimentId);
        ParticipantState state = ParticipantState.forSession(sessionId);
        if (environment != null) {
            environment.forEach(state::putEnvironment);
        }
        Session session = sessions.putIfAbsent(new Session(experimentId, state));
        if (!session.getExperimentId().equals(experimentId)) {
            throw new IllegalArgumentException("Session " + sessionId + " belongs to experiment " + session.getExperimentId());
        }
        log.info("Session started | experimentId={} | sessionId={}", experimentId, sessionId);
        return session;
    }

    public TraversalResult nextTask(String sessionId) {
        Session session = session(sessionId);
        ExperimentScope scope = registry.get(session.getExperimentId());
        synchronized (session) {
            return scope.getResolver().nextTask(session.getState());
        }
    }

    /**
     * Stores the task's responses under its stage id (or the task id when it has no stage), marks it completed and
     * returns the next position.
     */
    public TraversalResult completeTask(String sessionId, String taskId, Map<String, Object> responses) {
        Session session = session(sessionId);
        ExperimentScope scope = registry.get(session.getExperimentId());
        synchronized (session) {
            if (responses != null && !responses.isEmpty()) {
                mergeResponses(session.getState(), responseKey(scope.getHierarchy(), taskId), responses);
            }
            TraversalResult next = scope.getResolver().recordCompletion(session.getState(), taskId);
            log.debug("Task completed | sessionId={} | taskId={} | next={}", sessionId, taskId, next);
            return next;
        }
    }

    public void abandonSession(String sessionId) {
        Session session = session(sessionId);
        ExperimentScope scope = registry.get(session.getExperimentId());
        synchronized (session) {
            if (session.isAbandoned()) return;
            scope.getResolver().abandon(session.getState());
            session.markAbandoned();
        }
        sessions.remove(sessionId);
    }

    /**
     * Assignments and decision records of a session. A session no longer held in memory is rebuilt from its
     * records.
     *
     * @throws UnknownSessionException when neither a live session nor records exist
     */
    public AssignmentHistory assignmentHistory(String sessionId) {
        List<AssignmentRecord> records = registry.getRecorder().history(sessionId);
        Session session = sessions.find(sessionId).orElse(null);
        if (session != null) {
            synchronized (session) {
                return new AssignmentHistory(sessionId, session.getState().getAssignments(), records);
            }
        }
        if (records.isEmpty()) throw new UnknownSessionException(sessionId);
        Map<String, List<String>> assignments = new LinkedHashMap<>();
        for (AssignmentRecord record : records) {
            if (record.getAssignmentKey() != null) {
                assignments.putIfAbsent(record.getAssignmentKey(), record.getAssignedChildIds());
            }
        }
        return new AssignmentHistory(sessionId, assignments, records);
    }

    /**
     * Rebuilds a session's state from its records against the currently published hierarchy.
     */
    public ParticipantState replaySession(String experimentId, String sessionId) {
        ExperimentScope scope = registry.get(experimentId);
        List<AssignmentRecord> records = registry.getRecorder().history(sessionId);
        return new AssignmentReplayer(scope.getHierarchy()).replay(ParticipantState.forSession(sessionId), records);
    }

    public Map<String, Map<String, DistributionCounts>> distribution(String experimentId) {
        return registry.get(experimentId).getStore().snapshotAll();
    }

    /**
     * Clears the counters of one level, or of every level when {@code levelId} is null. Sequence counters of the
     * cleared nodes restart too, as do the quota admissions of the level and of its direct children.
     */
    public void resetCounters(String experimentId, String levelId) {
        ExperimentScope scope = registry.get(experimentId);
        if (levelId == null || levelId.isBlank()) {
            scope.getStore().resetAll();
            scope.getSequences().resetAll();
            log.info("Counters reset | experimentId={} | level=all", experimentId);
            return;
        }
        HierarchyNode node = scope.getHierarchy().requireNode(levelId);
        scope.getStore().reset(levelId);
        scope.getStore().resetChild(QuotaArbiter.QUOTA_LEVEL, levelId);
        for (HierarchyNode child : node.getChildren()) {
            scope.getStore().resetChild(QuotaArbiter.QUOTA_LEVEL, child.getId());
        }
        scope.getSequences().reset(levelId + "#order");
        scope.getSequences().reset(levelId + "#pick");
        log.info("Counters reset | experimentId={} | levelId={}", experimentId, levelId);
    }

    public PathTreeNode paths(String experimentId) {
        return PathTreeBuilder.build(registry.get(experimentId).getHierarchy());
    }

    public List<ExtractedVariable> simulateVariables(String experimentId) {
        ExperimentScope scope = registry.get(experimentId);
        return new VariableExtractor(scope.getEvaluator()).extract(scope.getHierarchy());
    }

    /**
     * Simulates synthetic participants against a private copy of the counters; live counters are never touched.
     *
     * @param seedFromLive start the simulation from a snapshot of the live counts instead of empty counters
     */
    public SimulationResult simulate(String experimentId, int participantCount,
                                     Map<String, VariableDistribution> distributions, boolean seedFromLive) {
        ExperimentScope scope = registry.get(experimentId);
        Map<String, Map<String, DistributionCounts>> seed = seedFromLive ? scope.getStore().snapshotAll() : null;
        return scope.getSimulator().simulate(participantCount, distributions, seed);
    }

    public ExperimentRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }

    private Session session(String sessionId) {
        Session session = sessions.find(sessionId).orElseThrow(() -> new UnknownSessionException(sessionId));
        if (!registry.contains(session.getExperimentId())) {
            throw new UnknownExperimentException(session.getExperimentId());
        }
        return session;
    }

    static String responseKey(Hierarchy hierarchy, String taskId) {
        if (!hierarchy.contains(taskId)) return taskId;
        for (String ancestor : hierarchy.ancestry(taskId)) {
            if (hierarchy.level(ancestor) == HierarchyLevel.STAGE) return ancestor;
        }
        return taskId;
    }

    @SuppressWarnings("unchecked")
    private static void mergeResponses(ParticipantState state, String key, Map<String, Object> responses) {
        Object existing = state.getResponses().get(key);
        Map<String, Object> merged = new LinkedHashMap<>();
        if (existing instanceof Map) {
            merged.putAll((Map<String, Object>) existing);
        }
        merged.putAll(responses);
        state.putResponse(key, merged);
    }
}
