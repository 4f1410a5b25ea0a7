package com.pathway.engine;

import com.pathway.distribution.ConflictRetry;
import com.pathway.distribution.DistributionStore;
import com.pathway.distribution.InMemoryDistributionStore;
import com.pathway.distribution.InMemorySequenceCounters;
import com.pathway.distribution.SequenceCounters;
import com.pathway.engine.ordering.OrderingResolution;
import com.pathway.engine.ordering.OrderingResolver;
import com.pathway.engine.pick.PickSelector;
import com.pathway.executioncontext.ParticipantState;
import com.pathway.features.quota.QuotaArbiter;
import com.pathway.features.quota.QuotaDecision;
import com.pathway.features.quota.QuotaExhaustedException;
import com.pathway.features.quota.SlotWaiter;
import com.pathway.hierarchy.config.OrderingMode;
import com.pathway.hierarchy.config.PickConfig;
import com.pathway.hierarchy.config.RulesConfig;
import com.pathway.hierarchy.config.Traversal;
import com.pathway.hierarchy.tree.Hierarchy;
import com.pathway.hierarchy.tree.HierarchyNode;
import com.pathway.ledger.AssignmentRecord;
import com.pathway.ledger.AssignmentRecorder;
import com.pathway.ledger.DecisionType;
import com.pathway.rules.RuleEvaluationPolicy;
import com.pathway.rules.RuleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Walks the hierarchy for one participant and decides, lazily, which task comes next.
 * <p>
 * Per node, in order: the visibility rule (a hidden node and its subtree are skipped without touching counters),
 * the quota (a redirect restarts the visit at the target, a pending {@code wait_for_slot} stops the walk), the
 * pick group, then the ordering of the working children. Every new decision is stored in the participant's
 * assignments and written to the assignment ledger; stored decisions are reused on later walks, so a walk is
 * idempotent for a session and counters are only claimed once.
 * <p>
 * The walk stops at the first task the participant has not completed. Children of pick groups and of
 * balanced/weighted containers are filtered by visibility before the decision so hidden children are never
 * picked or claimed; other containers evaluate child visibility when the child is reached.
 * <p>
 * Counter claims held by the session (balanced/weighted first child, quota admissions) are settled as
 * completed once the walk has moved past them and released when the session is abandoned.
 */
public final class PathResolver {

    private static final Logger log = LoggerFactory.getLogger(PathResolver.class);

    private final Hierarchy hierarchy;
    private final RuleEvaluator evaluator;
    private final DistributionStore store;
    private final AssignmentRecorder recorder;
    private final ConflictRetry retry;
    private final OrderingResolver orderingResolver;
    private final PickSelector pickSelector;
    private final QuotaArbiter quotaArbiter;
    private final SlotWaiter slotWaiter;
    private final int maxRedirects;

    private PathResolver(Builder b) {
        this.hierarchy = Objects.requireNonNull(b.hierarchy, "hierarchy");
        this.evaluator = b.evaluator != null ? b.evaluator : new RuleEvaluator(RuleEvaluationPolicy.FAIL_OPEN);
        this.store = b.store != null ? b.store : new InMemoryDistributionStore();
        SequenceCounters sequences = b.sequences != null ? b.sequences : new InMemorySequenceCounters();
        this.recorder = b.recorder != null ? b.recorder : AssignmentRecorder.noOp();
        this.retry = b.retry != null ? b.retry : new ConflictRetry(3);
        this.orderingResolver = new OrderingResolver(store, sequences, retry);
        this.pickSelector = new PickSelector(hierarchy, evaluator, sequences, recorder);
        this.quotaArbiter = new QuotaArbiter(hierarchy, store, retry);
        this.slotWaiter = b.quotaWaitTimeoutMs > 0
                ? new SlotWaiter(quotaArbiter, store, b.quotaWaitTimeoutMs, b.quotaWaitInitialBackoffMs, b.quotaWaitMaxBackoffMs)
                : null;
        this.maxRedirects = Math.max(1, b.maxRedirects);
    }

    public static Builder builder(Hierarchy hierarchy) {
        return new Builder(hierarchy);
    }

    public Hierarchy getHierarchy() {
        return hierarchy;
    }

    public DistributionStore getStore() {
        return store;
    }

    public OrderingResolver getOrderingResolver() {
        return orderingResolver;
    }

    public PickSelector getPickSelector() {
        return pickSelector;
    }

    public QuotaArbiter getQuotaArbiter() {
        return quotaArbiter;
    }

    /**
     * Next task for the participant, making (and recording) the decisions needed to reach it.
     */
    public TraversalResult nextTask(ParticipantState state) {
        Walk walk = new Walk(state);
        if (visit(hierarchy.getRootId(), walk)) {
            walk.result = TraversalResult.complete(walk.path);
        }
        log.debug("Traversal | sessionId={} | result={}", state.getSessionId(), walk.result);
        return walk.result;
    }

    /**
     * Marks a task completed, moves the participant on and settles the counter claims the walk has left behind.
     * Completing an already completed task only recomputes the position.
     *
     * @throws IllegalArgumentException when {@code taskId} is not a task of this hierarchy
     */
    public TraversalResult recordCompletion(ParticipantState state, String taskId) {
        if (!hierarchy.isTask(taskId)) {
            throw new IllegalArgumentException("Unknown task " + taskId + " in experiment " + hierarchy.getExperimentId());
        }
        boolean first = !state.isCompleted(taskId);
        state.markCompleted(taskId);
        TraversalResult next = nextTask(state);
        if (first) settleRoutes(state, next);
        return next;
    }

    /**
     * Walks to the end, completing every task as it is reached. Used for simulation and previews.
     */
    public TraversalResult runToEnd(ParticipantState state) {
        TraversalResult result = nextTask(state);
        int guard = hierarchy.size() + 1;
        while (result.getStatus() == TraversalResult.Status.TASK && guard-- > 0) {
            result = recordCompletion(state, result.getTaskId());
        }
        return result;
    }

    /**
     * Ends a session early: cancels a pending quota wait and releases every counter claim not yet settled.
     */
    public void abandon(ParticipantState state) {
        state.getCancellation().cancel();
        for (Route route : heldRoutes(state)) {
            if (state.closeRoute(route.key())) {
                retry.run("release " + route.key(), () -> {
                    store.release(route.levelId, route.childId);
                    return null;
                });
                log.debug("Route released | sessionId={} | levelId={} | childId={}", state.getSessionId(), route.levelId, route.childId);
            }
        }
        log.info("Session abandoned | sessionId={} | completedTasks={}", state.getSessionId(), state.getCompletedTaskIds().size());
    }

    /** Returns true when the walk should go on after this node. */
    private boolean visit(String nodeId, Walk walk) {
        if (!walk.visited.add(nodeId)) return true;
        HierarchyNode node = hierarchy.requireNode(nodeId);
        ParticipantState state = walk.state;
        if (!evaluator.isVisible(node, state)) {
            log.debug("Node hidden | sessionId={} | nodeId={}", state.getSessionId(), nodeId);
            return true;
        }
        if (QuotaArbiter.hasQuota(node)) {
            QuotaDecision decision;
            try {
                decision = quotaArbiter.checkQuota(node, state);
                if (decision.getKind() == QuotaDecision.Kind.WAIT && slotWaiter != null) {
                    decision = slotWaiter.await(node, state, decision);
                }
            } catch (QuotaExhaustedException e) {
                walk.result = TraversalResult.quotaFull(nodeId, walk.path);
                return false;
            }
            if (decision.getKind() == QuotaDecision.Kind.WAIT) {
                walk.result = TraversalResult.waiting(nodeId, walk.path);
                return false;
            }
            recordQuota(node, decision, state);
            if (decision.getKind() == QuotaDecision.Kind.REDIRECT) {
                if (++walk.redirects > maxRedirects) {
                    log.warn("Redirect limit reached | sessionId={} | nodeId={} | maxRedirects={}", state.getSessionId(), nodeId, maxRedirects);
                    walk.result = TraversalResult.quotaFull(nodeId, walk.path);
                    return false;
                }
                return visit(decision.getTargetNodeId(), walk);
            }
        }
        if (hierarchy.isTask(nodeId)) {
            walk.path.add(nodeId);
            if (state.isCompleted(nodeId)) return true;
            walk.result = TraversalResult.task(nodeId, walk.path);
            return false;
        }
        for (String childId : decideChildren(node, state)) {
            if (!visit(childId, walk)) return false;
        }
        return true;
    }

    /** Pick, then order; returns the children to walk in order. */
    private List<String> decideChildren(HierarchyNode node, ParticipantState state) {
        List<String> children = hierarchy.childIds(node.getId());
        if (children.isEmpty()) return List.of();
        RulesConfig rules = node.getRules();
        PickConfig pick = rules != null ? rules.getPick() : null;
        OrderingMode mode = OrderingResolver.modeOf(node);

        List<String> working = children;
        if (pick != null || OrderingResolver.claimsCounter(mode)) {
            working = children.stream()
                    .filter(id -> evaluator.isVisible(hierarchy.requireNode(id), state))
                    .collect(Collectors.toList());
        }
        if (pick != null) {
            working = pickSelector.selectPick(node, working, state).getChosen();
        }
        OrderingResolution resolution = orderingResolver.resolveOrder(node, working, state);
        if (!resolution.isRestored()) {
            recorder.record(state.getSessionId(), AssignmentRecord.decision(OrderingResolver.assignmentKey(node),
                    node.getId(), resolution.getOrder(), DecisionType.ORDERING, resolution.getMode().toValue(),
                    resolution.getReason()));
        }
        List<String> order = resolution.getOrder();
        Traversal traversal = rules != null ? rules.effectiveTraversal() : Traversal.ALL;
        return traversal == Traversal.FIRST && order.size() > 1 ? order.subList(0, 1) : order;
    }

    private void recordQuota(HierarchyNode node, QuotaDecision decision, ParticipantState state) {
        if (decision.isRestored()) return;
        String target = decision.isAdmitted() ? node.getId() : decision.getTargetNodeId();
        String key = QuotaArbiter.assignmentKey(node.getId());
        state.assignIfAbsent(key, List.of(target));
        recorder.record(state.getSessionId(), AssignmentRecord.decision(key, node.getId(), List.of(target),
                DecisionType.QUOTA, node.getRules().getQuota().getStrategy().toValue(), decision.reason()));
    }

    private void settleRoutes(ParticipantState state, TraversalResult next) {
        String position = next.getStatus() == TraversalResult.Status.TASK ? next.getTaskId() : next.getBlockedNodeId();
        Set<String> ahead = position != null ? new HashSet<>(hierarchy.ancestry(position)) : Set.of();
        for (Route route : heldRoutes(state)) {
            if (ahead.contains(route.childId)) continue;
            if (state.closeRoute(route.key())) {
                retry.run("complete " + route.key(), () -> {
                    store.complete(route.levelId, route.childId);
                    return null;
                });
                log.debug("Route completed | sessionId={} | levelId={} | childId={}", state.getSessionId(), route.levelId, route.childId);
            }
        }
    }

    /** Counter claims the session holds that are not settled yet, derived from its assignments. */
    private List<Route> heldRoutes(ParticipantState state) {
        List<Route> routes = new ArrayList<>();
        String quotaPrefix = QuotaArbiter.assignmentKey("");
        for (Map.Entry<String, List<String>> e : state.getAssignments().entrySet()) {
            String key = e.getKey();
            List<String> value = e.getValue();
            if (value.isEmpty()) continue;
            Route route = null;
            if (key.startsWith(quotaPrefix)) {
                String nodeId = key.substring(quotaPrefix.length());
                if (nodeId.equals(value.get(0))) route = new Route(QuotaArbiter.QUOTA_LEVEL, nodeId);
            } else {
                String nodeId = key.endsWith("#order") ? key.substring(0, key.length() - "#order".length()) : key;
                HierarchyNode node = hierarchy.node(nodeId);
                if (node != null && key.equals(OrderingResolver.assignmentKey(node))
                        && OrderingResolver.claimsCounter(OrderingResolver.modeOf(node))) {
                    route = new Route(nodeId, value.get(0));
                }
            }
            if (route != null && !state.isRouteClosed(route.key())) routes.add(route);
        }
        return routes;
    }

    private static final class Route {
        final String levelId;
        final String childId;

        Route(String levelId, String childId) {
            this.levelId = levelId;
            this.childId = childId;
        }

        String key() {
            return levelId + "/" + childId;
        }
    }

    private static final class Walk {
        final ParticipantState state;
        final List<String> path = new ArrayList<>();
        final Set<String> visited = new HashSet<>();
        TraversalResult result;
        int redirects;

        Walk(ParticipantState state) {
            this.state = state;
        }
    }

    public static final class Builder {
        private final Hierarchy hierarchy;
        private RuleEvaluator evaluator;
        private DistributionStore store;
        private SequenceCounters sequences;
        private AssignmentRecorder recorder;
        private ConflictRetry retry;
        private long quotaWaitTimeoutMs;
        private long quotaWaitInitialBackoffMs = 100;
        private long quotaWaitMaxBackoffMs = 2_000;
        private int maxRedirects = 5;

        private Builder(Hierarchy hierarchy) {
            this.hierarchy = hierarchy;
        }

        public Builder evaluator(RuleEvaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        public Builder store(DistributionStore store) {
            this.store = store;
            return this;
        }

        public Builder sequences(SequenceCounters sequences) {
            this.sequences = sequences;
            return this;
        }

        public Builder recorder(AssignmentRecorder recorder) {
            this.recorder = recorder;
            return this;
        }

        public Builder retry(ConflictRetry retry) {
            this.retry = retry;
            return this;
        }

        /** Bounded in-call wait for {@code wait_for_slot} quotas; 0 returns WAITING immediately. */
        public Builder quotaWait(long timeoutMs, long initialBackoffMs, long maxBackoffMs) {
            this.quotaWaitTimeoutMs = timeoutMs;
            this.quotaWaitInitialBackoffMs = initialBackoffMs;
            this.quotaWaitMaxBackoffMs = maxBackoffMs;
            return this;
        }

        public Builder maxRedirects(int maxRedirects) {
            this.maxRedirects = maxRedirects;
            return this;
        }

        public PathResolver build() {
            return new PathResolver(this);
        }
    }
}
