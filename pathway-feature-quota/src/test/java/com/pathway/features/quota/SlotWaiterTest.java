package com.pathway.features.quota;

import com.pathway.distribution.ConflictRetry;
import com.pathway.distribution.InMemoryDistributionStore;
import com.pathway.executioncontext.ParticipantState;
import com.pathway.hierarchy.HierarchyConfig;
import com.pathway.hierarchy.tree.Hierarchy;
import com.pathway.hierarchy.tree.HierarchyNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SlotWaiterTest {

    private InMemoryDistributionStore store;
    private QuotaArbiter arbiter;
    private HierarchyNode waitingNode;

    @BeforeEach
    void setUp() {
        Hierarchy hierarchy = Hierarchy.from(HierarchyConfig.fromJson(QuotaArbiterTest.EXPERIMENT));
        store = new InMemoryDistributionStore();
        arbiter = new QuotaArbiter(hierarchy, store, new ConflictRetry(3));
        waitingNode = hierarchy.node("s2");
        assertTrue(arbiter.checkQuota(waitingNode, ParticipantState.forSession("holder")).isAdmitted());
    }

    @Test
    void await_admitsOnceSlotIsReleased() throws Exception {
        ParticipantState waiter = ParticipantState.forSession("waiter");
        QuotaDecision pending = arbiter.checkQuota(waitingNode, waiter);
        SlotWaiter slots = new SlotWaiter(arbiter, store, 10_000, 5, 50);

        CompletableFuture<QuotaDecision> result = CompletableFuture.supplyAsync(() -> slots.await(waitingNode, waiter, pending));
        Thread.sleep(30);
        store.complete(QuotaArbiter.QUOTA_LEVEL, "s2");

        assertTrue(result.get(5, TimeUnit.SECONDS).isAdmitted());
    }

    @Test
    void await_returnsWaitAfterTimeout() {
        ParticipantState waiter = ParticipantState.forSession("waiter");
        QuotaDecision pending = arbiter.checkQuota(waitingNode, waiter);

        QuotaDecision decision = new SlotWaiter(arbiter, store, 40, 5, 10).await(waitingNode, waiter, pending);

        assertEquals(QuotaDecision.Kind.WAIT, decision.getKind());
    }

    @Test
    void await_stopsWhenSessionIsCancelled() throws Exception {
        ParticipantState waiter = ParticipantState.forSession("waiter");
        QuotaDecision pending = arbiter.checkQuota(waitingNode, waiter);
        SlotWaiter slots = new SlotWaiter(arbiter, store, 60_000, 1_000, 1_000);

        CompletableFuture<QuotaDecision> result = CompletableFuture.supplyAsync(() -> slots.await(waitingNode, waiter, pending));
        Thread.sleep(30);
        waiter.getCancellation().cancel();

        assertEquals(QuotaDecision.Kind.WAIT, result.get(5, TimeUnit.SECONDS).getKind());
    }
}
