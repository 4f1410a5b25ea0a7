package com.pathway.features.quota;

import com.pathway.distribution.DistributionStore;
import com.pathway.executioncontext.ParticipantState;
import com.pathway.hierarchy.tree.HierarchyNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounded wait for a {@code wait_for_slot} quota. Re-checks admission with exponential backoff between
 * {@code initialBackoffMs} and {@code maxBackoffMs}; a counter decrement on the node (seen through the store's
 * listener) or the session's cancellation wakes the waiter early. Gives up after {@code timeoutMs} and then
 * returns the last {@link QuotaDecision.Kind#WAIT} decision.
 */
public final class SlotWaiter {

    private static final Logger log = LoggerFactory.getLogger(SlotWaiter.class);

    private final QuotaArbiter arbiter;
    private final DistributionStore store;
    private final long timeoutMs;
    private final long initialBackoffMs;
    private final long maxBackoffMs;

    public SlotWaiter(QuotaArbiter arbiter, DistributionStore store, long timeoutMs, long initialBackoffMs, long maxBackoffMs) {
        this.arbiter = Objects.requireNonNull(arbiter, "arbiter");
        this.store = Objects.requireNonNull(store, "store");
        this.timeoutMs = Math.max(0, timeoutMs);
        this.initialBackoffMs = Math.max(1, initialBackoffMs);
        this.maxBackoffMs = Math.max(this.initialBackoffMs, maxBackoffMs);
    }

    /**
     * Waits until the node admits the participant, redirects them, or the wait ends.
     *
     * @param pending the WAIT decision that triggered the wait
     */
    public QuotaDecision await(HierarchyNode node, ParticipantState state, QuotaDecision pending) {
        if (pending.getKind() != QuotaDecision.Kind.WAIT) return pending;
        String nodeId = node.getId();
        Semaphore wake = new Semaphore(0);
        Runnable unregisterListener = store.addListener((levelId, childId) -> {
            if (QuotaArbiter.QUOTA_LEVEL.equals(levelId) && nodeId.equals(childId)) wake.release();
        });
        Runnable unregisterCancel = state.getCancellation().onCancel(wake::release);
        long deadline = System.currentTimeMillis() + timeoutMs;
        long backoff = initialBackoffMs;
        QuotaDecision decision = pending;
        try {
            while (true) {
                if (state.getCancellation().isCancelled()) {
                    log.info("Quota wait cancelled | sessionId={} | nodeId={}", state.getSessionId(), nodeId);
                    return decision;
                }
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    log.info("Quota wait timed out | sessionId={} | nodeId={} | timeoutMs={}", state.getSessionId(), nodeId, timeoutMs);
                    return decision;
                }
                wake.tryAcquire(Math.min(backoff, remaining), TimeUnit.MILLISECONDS);
                wake.drainPermits();
                if (state.getCancellation().isCancelled()) continue;
                decision = arbiter.checkQuota(node, state);
                if (decision.getKind() != QuotaDecision.Kind.WAIT) {
                    log.debug("Quota wait ended | sessionId={} | nodeId={} | decision={}", state.getSessionId(), nodeId, decision.getKind());
                    return decision;
                }
                backoff = Math.min(maxBackoffMs, backoff * 2);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Quota wait interrupted | sessionId={} | nodeId={}", state.getSessionId(), nodeId);
            return decision;
        } finally {
            unregisterListener.run();
            unregisterCancel.run();
        }
    }
}
