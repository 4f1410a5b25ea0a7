package com.pathway.features.quota;

import com.pathway.distribution.Admission;
import com.pathway.distribution.ConflictRetry;
import com.pathway.distribution.CounterKind;
import com.pathway.distribution.DistributionStore;
import com.pathway.executioncontext.ParticipantState;
import com.pathway.hierarchy.config.QuotaConfig;
import com.pathway.hierarchy.config.QuotaCountOn;
import com.pathway.hierarchy.tree.Hierarchy;
import com.pathway.hierarchy.tree.HierarchyNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Enforces per-node capacity limits.
 * <p>
 * Admission counters live at the pseudo level {@link #QUOTA_LEVEL} keyed by node id, separate from the ordering
 * counters of the node's parent. Reading the count and incrementing it on admission is one atomic store operation.
 * When the node is full the configured strategy applies: {@code skip_if_full} redirects to the fallback (or the
 * next sibling), {@code show_alternative} redirects to the fallback, {@code wait_for_slot} asks the caller to wait.
 * <p>
 * A decision already stored for the session under {@link #assignmentKey(String)} is reused without touching
 * counters, so resumed sessions are not admitted twice.
 */
public final class QuotaArbiter {

    private static final Logger log = LoggerFactory.getLogger(QuotaArbiter.class);

    /** Pseudo level id under which admission counters are kept. */
    public static final String QUOTA_LEVEL = "quota";

    private final Hierarchy hierarchy;
    private final DistributionStore store;
    private final ConflictRetry retry;

    public QuotaArbiter(Hierarchy hierarchy, DistributionStore store, ConflictRetry retry) {
        this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy");
        this.store = Objects.requireNonNull(store, "store");
        this.retry = Objects.requireNonNull(retry, "retry");
    }

    /** Assignment key under which the quota decision for a node is stored. */
    public static String assignmentKey(String nodeId) {
        return "quota:" + nodeId;
    }

    public static boolean hasQuota(HierarchyNode node) {
        return node.getRules() != null && node.getRules().getQuota() != null && node.getRules().getQuota().getLimit() >= 0;
    }

    /**
     * Checks (and on admission claims) capacity for a node the participant is about to enter.
     *
     * @throws QuotaExhaustedException when the node is full and no redirect target exists
     */
    public QuotaDecision checkQuota(HierarchyNode node, ParticipantState state) {
        String nodeId = node.getId();
        if (!hasQuota(node)) {
            return QuotaDecision.admit(nodeId, 0, Long.MAX_VALUE);
        }
        List<String> prior = state.getAssignment(assignmentKey(nodeId));
        if (prior != null && !prior.isEmpty()) {
            return QuotaDecision.restored(nodeId, prior.get(0));
        }
        QuotaConfig quota = node.getRules().getQuota();
        long limit = quota.getLimit();
        CounterKind countOn = quota.getCountOn() == QuotaCountOn.ACTIVE ? CounterKind.ACTIVE : CounterKind.STARTED;
        Admission admission = retry.run("quota " + nodeId,
                () -> store.tryAdmit(QUOTA_LEVEL, nodeId, countOn, limit));
        if (admission.isAdmitted()) {
            log.debug("Quota admitted | sessionId={} | nodeId={} | count={} | limit={}", state.getSessionId(), nodeId, admission.getObserved(), limit);
            return QuotaDecision.admit(nodeId, admission.getObserved(), limit);
        }
        return whenFull(node, quota, admission.getObserved(), state);
    }

    private QuotaDecision whenFull(HierarchyNode node, QuotaConfig quota, long observed, ParticipantState state) {
        String nodeId = node.getId();
        long limit = quota.getLimit();
        switch (quota.getStrategy()) {
            case WAIT_FOR_SLOT:
                log.info("Quota full, waiting | sessionId={} | nodeId={} | count={} | limit={}", state.getSessionId(), nodeId, observed, limit);
                return QuotaDecision.waitForSlot(nodeId, observed, limit);
            case SHOW_ALTERNATIVE:
                return redirectOrExhaust(nodeId, quota.getFallbackNodeId(), observed, limit, state);
            case SKIP_IF_FULL:
                return redirectOrExhaust(nodeId, fallbackOrNextSibling(nodeId, quota), observed, limit, state);
            default:
                log.warn("Unknown quota strategy, skip_if_full will be used | nodeId={}", nodeId);
                return redirectOrExhaust(nodeId, fallbackOrNextSibling(nodeId, quota), observed, limit, state);
        }
    }

    private String fallbackOrNextSibling(String nodeId, QuotaConfig quota) {
        return quota.getFallbackNodeId() != null ? quota.getFallbackNodeId() : hierarchy.nextSiblingId(nodeId);
    }

    private QuotaDecision redirectOrExhaust(String nodeId, String target, long observed, long limit, ParticipantState state) {
        if (target == null || !hierarchy.contains(target)) {
            log.warn("Quota full, no redirect target | sessionId={} | nodeId={} | target={} | count={} | limit={}",
                    state.getSessionId(), nodeId, target, observed, limit);
            throw new QuotaExhaustedException(nodeId, observed, limit);
        }
        log.info("Quota full, redirecting | sessionId={} | nodeId={} | target={} | count={} | limit={}",
                state.getSessionId(), nodeId, target, observed, limit);
        return QuotaDecision.redirect(nodeId, target, observed, limit);
    }
}
