package com.pathway.engine;

import com.pathway.distribution.DistributionCounts;
import com.pathway.distribution.InMemoryDistributionStore;
import com.pathway.executioncontext.ParticipantState;
import com.pathway.features.quota.QuotaArbiter;
import com.pathway.hierarchy.HierarchyConfig;
import com.pathway.hierarchy.tree.Hierarchy;
import com.pathway.ledger.AssignmentRecord;
import com.pathway.ledger.AssignmentRecorder;
import com.pathway.ledger.DecisionType;
import com.pathway.ledger.InMemoryAssignmentLedgerStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PathResolverTest {

    static final String BALANCED = """
            {
              "experiment_id": "balanced-study",
              "phases": [
                {
                  "id": "p",
                  "rules": { "ordering": "balanced" },
                  "stages": [
                    { "id": "a", "tasks": [ { "id": "a1" }, { "id": "a2" } ] },
                    { "id": "b", "tasks": [ { "id": "b1" }, { "id": "b2" } ] },
                    { "id": "c", "tasks": [ { "id": "c1" }, { "id": "c2" } ] }
                  ]
                }
              ]
            }
            """;

    static final String QUOTA = """
            {
              "experiment_id": "quota-study",
              "phases": [
                {
                  "id": "p",
                  "stages": [
                    { "id": "s1", "rules": { "quota": { "limit": 5, "strategy": "skip_if_full", "fallback_node_id": "s3" } },
                      "tasks": [ { "id": "t1" } ] },
                    { "id": "s3", "tasks": [ { "id": "t3" } ] }
                  ]
                }
              ]
            }
            """;

    static final String WAITING = """
            {
              "experiment_id": "wait-study",
              "phases": [
                {
                  "id": "p",
                  "stages": [
                    { "id": "s2", "rules": { "quota": { "limit": 1, "strategy": "wait_for_slot", "count_on": "active" } },
                      "tasks": [ { "id": "t2" } ] }
                  ]
                }
              ]
            }
            """;

    static final String FULL = """
            {
              "experiment_id": "full-study",
              "phases": [
                { "id": "p", "stages": [
                    { "id": "s4", "rules": { "quota": { "limit": 0, "strategy": "skip_if_full" } }, "tasks": [ { "id": "t4" } ] }
                ] }
              ]
            }
            """;

    static final String CONDITIONAL = """
            {
              "experiment_id": "conditional-study",
              "phases": [
                {
                  "id": "p",
                  "stages": [
                    { "id": "intro", "tasks": [ { "id": "q1" } ] },
                    { "id": "followup", "visibility_rule": "intro.q1 == 'yes'",
                      "rules": { "ordering": "balanced" },
                      "blocks": [ { "id": "fa", "tasks": [ { "id": "f1" } ] }, { "id": "fb", "tasks": [ { "id": "f2" } ] } ] }
                  ]
                }
              ]
            }
            """;

    private static Hierarchy hierarchy(String json) {
        return Hierarchy.from(HierarchyConfig.fromJson(json));
    }

    @Test
    void nextTask_balancedCountsStayWithinOneAcrossConcurrentParticipants() throws Exception {
        InMemoryDistributionStore store = new InMemoryDistributionStore();
        PathResolver resolver = PathResolver.builder(hierarchy(BALANCED)).store(store).build();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<TraversalResult>> futures = new ArrayList<>();
        for (int i = 0; i < 9000; i++) {
            String sessionId = "participant-" + i;
            futures.add(pool.submit(() -> {
                start.await();
                return resolver.nextTask(ParticipantState.forSession(sessionId));
            }));
        }
        start.countDown();
        for (Future<TraversalResult> f : futures) {
            assertEquals(TraversalResult.Status.TASK, f.get(30, TimeUnit.SECONDS).getStatus());
        }
        pool.shutdown();

        Map<String, DistributionCounts> counts = store.snapshot("p");
        long max = counts.values().stream().mapToLong(DistributionCounts::getStarted).max().orElse(0);
        long min = counts.values().stream().mapToLong(DistributionCounts::getStarted).min().orElse(0);
        long total = counts.values().stream().mapToLong(DistributionCounts::getStarted).sum();
        assertEquals(3, counts.size());
        assertEquals(9000, total);
        assertTrue(max - min <= 1, "started counts " + counts);
    }

    @Test
    void nextTask_balancedRoutesIntoFirstChildOnly() {
        PathResolver resolver = PathResolver.builder(hierarchy(BALANCED)).build();
        ParticipantState state = ParticipantState.forSession("single");

        TraversalResult result = resolver.runToEnd(state);

        String chosen = state.getAssignment("p").get(0);
        assertEquals(TraversalResult.Status.COMPLETE, result.getStatus());
        assertEquals(List.of(chosen + "1", chosen + "2"), result.getPath());
    }

    @Test
    void nextTask_isIdempotentAndRecordsEachDecisionOnce() {
        InMemoryAssignmentLedgerStore ledger = new InMemoryAssignmentLedgerStore();
        InMemoryDistributionStore store = new InMemoryDistributionStore();
        PathResolver resolver = PathResolver.builder(hierarchy(BALANCED))
                .store(store)
                .recorder(new AssignmentRecorder(ledger))
                .build();
        ParticipantState state = ParticipantState.forSession("again");

        TraversalResult first = resolver.nextTask(state);
        TraversalResult second = resolver.nextTask(state);

        assertEquals(first.getTaskId(), second.getTaskId());
        assertEquals(1, store.snapshot("p").values().stream().mapToLong(DistributionCounts::getStarted).sum());
        List<AssignmentRecord> history = ledger.history("again");
        assertEquals(3, history.size());
        assertEquals("balanced-study", history.get(0).getAssignmentKey());
        assertEquals("p", history.get(1).getAssignmentKey());
        assertEquals(state.getAssignment("p").get(0), history.get(2).getAssignmentKey());
        AssignmentRecord balanced = history.get(1);
        assertEquals(DecisionType.ORDERING, balanced.getDecisionType());
        assertEquals("balanced", balanced.getOrderingMode());
        assertTrue(balanced.getReason().startsWith("least-filled: counts {"), balanced.getReason());
    }

    @Test
    void recordCompletion_settlesRouteOnceTheWalkLeavesIt() {
        InMemoryDistributionStore store = new InMemoryDistributionStore();
        PathResolver resolver = PathResolver.builder(hierarchy(BALANCED)).store(store).build();
        ParticipantState state = ParticipantState.forSession("one");

        resolver.nextTask(state);
        String chosen = state.getAssignment("p").get(0);
        assertEquals(new DistributionCounts(1, 0, 1), store.counts("p", chosen));

        TraversalResult next = resolver.recordCompletion(state, chosen + "1");
        assertEquals(chosen + "2", next.getTaskId());
        assertEquals(new DistributionCounts(1, 0, 1), store.counts("p", chosen));

        TraversalResult done = resolver.recordCompletion(state, chosen + "2");
        assertEquals(TraversalResult.Status.COMPLETE, done.getStatus());
        assertEquals(new DistributionCounts(1, 1, 0), store.counts("p", chosen));

        resolver.recordCompletion(state, chosen + "2");
        resolver.abandon(state);
        assertEquals(new DistributionCounts(1, 1, 0), store.counts("p", chosen));
    }

    @Test
    void abandon_releasesUnfinishedRoutesAndCancels() {
        InMemoryDistributionStore store = new InMemoryDistributionStore();
        PathResolver resolver = PathResolver.builder(hierarchy(BALANCED)).store(store).build();
        ParticipantState first = ParticipantState.forSession("first");
        resolver.nextTask(first);
        ParticipantState second = ParticipantState.forSession("second");
        resolver.nextTask(second);
        String firstChild = first.getAssignment("p").get(0);
        String secondChild = second.getAssignment("p").get(0);
        assertNotEquals(firstChild, secondChild);

        resolver.abandon(second);
        resolver.abandon(second);

        assertTrue(second.getCancellation().isCancelled());
        assertEquals(DistributionCounts.ZERO, store.counts("p", secondChild));
        assertEquals(new DistributionCounts(1, 0, 1), store.counts("p", firstChild));
    }

    @Test
    void recordCompletion_unknownTaskIsRejected() {
        PathResolver resolver = PathResolver.builder(hierarchy(BALANCED)).build();

        assertThrows(IllegalArgumentException.class,
                () -> resolver.recordCompletion(ParticipantState.forSession("x"), "p"));
    }

    @Test
    void nextTask_sixthParticipantIsRedirectedToFallback() {
        InMemoryAssignmentLedgerStore ledger = new InMemoryAssignmentLedgerStore();
        InMemoryDistributionStore store = new InMemoryDistributionStore();
        PathResolver resolver = PathResolver.builder(hierarchy(QUOTA))
                .store(store)
                .recorder(new AssignmentRecorder(ledger))
                .build();
        for (int i = 0; i < 5; i++) {
            assertEquals("t1", resolver.nextTask(ParticipantState.forSession("q-" + i)).getTaskId());
        }
        ParticipantState sixth = ParticipantState.forSession("q-5");

        TraversalResult result = resolver.nextTask(sixth);

        assertEquals("t3", result.getTaskId());
        assertEquals(5, store.counts(QuotaArbiter.QUOTA_LEVEL, "s1").getStarted());
        assertEquals(List.of("s3"), sixth.getAssignment("quota:s1"));
        AssignmentRecord quota = ledger.history("q-5").stream()
                .filter(r -> r.getDecisionType() == DecisionType.QUOTA)
                .findFirst().orElseThrow();
        assertEquals("skip_if_full", quota.getOrderingMode());
        assertEquals("quota full 5/5 → redirected to s3", quota.getReason());
    }

    @Test
    void nextTask_redirectedParticipantKeepsRedirectAfterSlotsFreeUp() {
        InMemoryDistributionStore store = new InMemoryDistributionStore();
        PathResolver resolver = PathResolver.builder(hierarchy(QUOTA)).store(store).build();
        for (int i = 0; i < 5; i++) {
            resolver.nextTask(ParticipantState.forSession("q-" + i));
        }
        ParticipantState sixth = ParticipantState.forSession("q-5");
        resolver.nextTask(sixth);

        store.resetAll();

        assertEquals("t3", resolver.nextTask(sixth).getTaskId());
        assertEquals(DistributionCounts.ZERO, store.counts(QuotaArbiter.QUOTA_LEVEL, "s1"));
    }

    @Test
    void nextTask_fullQuotaWithoutTargetEndsInQuotaFull() {
        PathResolver resolver = PathResolver.builder(hierarchy(FULL)).build();

        TraversalResult result = resolver.nextTask(ParticipantState.forSession("late"));

        assertEquals(TraversalResult.Status.QUOTA_FULL, result.getStatus());
        assertEquals("s4", result.getBlockedNodeId());
        assertTrue(result.isTerminal());
    }

    @Test
    void nextTask_waitForSlotAdmitsOnceActiveParticipantFinishes() {
        InMemoryDistributionStore store = new InMemoryDistributionStore();
        PathResolver resolver = PathResolver.builder(hierarchy(WAITING)).store(store).build();
        ParticipantState first = ParticipantState.forSession("first");
        ParticipantState second = ParticipantState.forSession("second");

        assertEquals("t2", resolver.nextTask(first).getTaskId());
        TraversalResult waiting = resolver.nextTask(second);
        assertEquals(TraversalResult.Status.WAITING, waiting.getStatus());
        assertEquals("s2", waiting.getBlockedNodeId());

        assertEquals(TraversalResult.Status.COMPLETE, resolver.recordCompletion(first, "t2").getStatus());

        assertEquals("t2", resolver.nextTask(second).getTaskId());
        assertEquals(new DistributionCounts(2, 1, 1), store.counts(QuotaArbiter.QUOTA_LEVEL, "s2"));
    }

    @Test
    void nextTask_hiddenSubtreeIsSkippedWithoutTouchingCounters() {
        InMemoryDistributionStore store = new InMemoryDistributionStore();
        PathResolver resolver = PathResolver.builder(hierarchy(CONDITIONAL)).store(store).build();
        ParticipantState state = ParticipantState.forSession("no");

        assertEquals("q1", resolver.nextTask(state).getTaskId());
        state.putResponse("intro", Map.of("q1", "no"));

        TraversalResult result = resolver.recordCompletion(state, "q1");

        assertEquals(TraversalResult.Status.COMPLETE, result.getStatus());
        assertEquals(List.of("q1"), result.getPath());
        assertTrue(store.snapshotAll().isEmpty());
    }

    @Test
    void nextTask_visibilityIsEvaluatedWhenTheNodeIsReached() {
        PathResolver resolver = PathResolver.builder(hierarchy(CONDITIONAL)).build();
        ParticipantState state = ParticipantState.forSession("yes");

        assertEquals("q1", resolver.nextTask(state).getTaskId());
        state.putResponse("intro", Map.of("q1", "yes"));

        TraversalResult result = resolver.recordCompletion(state, "q1");

        assertEquals(TraversalResult.Status.TASK, result.getStatus());
        assertTrue(List.of("f1", "f2").contains(result.getTaskId()));
        assertEquals(List.of("q1", result.getTaskId()), result.getPath());
    }
}
