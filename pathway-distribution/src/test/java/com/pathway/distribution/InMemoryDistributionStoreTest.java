package com.pathway.distribution;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryDistributionStoreTest {

    @Test
    void claimLeastFilled_picksLowestAndBreaksTiesByCandidateOrder() {
        InMemoryDistributionStore store = new InMemoryDistributionStore();
        store.claim("main", "a");
        store.claim("main", "a");
        store.claim("main", "b");

        ClaimResult first = store.claimLeastFilled("main", List.of("a", "b", "c"), CounterKind.STARTED);
        ClaimResult second = store.claimLeastFilled("main", List.of("c", "b", "a"), CounterKind.STARTED);

        assertEquals("c", first.getChildId());
        assertEquals("{a:2,b:1,c:0}", first.observedText());
        assertEquals("c", second.getChildId());
        assertEquals(new DistributionCounts(2, 0, 2), store.counts("main", "c"));
    }

    @Test
    void claimLeastFilled_canBalanceOnCompleted() {
        InMemoryDistributionStore store = new InMemoryDistributionStore();
        store.claim("main", "a");
        store.claim("main", "a");
        store.complete("main", "a");
        store.complete("main", "a");
        store.claim("main", "b");

        assertEquals("b", store.claimLeastFilled("main", List.of("a", "b"), CounterKind.STARTED).getChildId());
        assertEquals("b", store.claimLeastFilled("main", List.of("a", "b"), CounterKind.COMPLETED).getChildId());
    }

    @Test
    void claimLeastFilled_rejectsEmptyCandidates() {
        InMemoryDistributionStore store = new InMemoryDistributionStore();

        assertThrows(IllegalArgumentException.class, () -> store.claimLeastFilled("main", List.of(), CounterKind.STARTED));
    }

    @Test
    void claimLeastFilled_concurrentClaimsStayBalanced() throws Exception {
        InMemoryDistributionStore store = new InMemoryDistributionStore();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < 1125; i++) {
                    store.claimLeastFilled("main", List.of("a", "b", "c"), CounterKind.STARTED);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        pool.shutdown();

        Map<String, DistributionCounts> level = store.snapshot("main");
        long a = level.get("a").getStarted();
        long b = level.get("b").getStarted();
        long c = level.get("c").getStarted();
        assertEquals(9000, a + b + c);
        assertTrue(Math.max(a, Math.max(b, c)) - Math.min(a, Math.min(b, c)) <= 1);
    }

    @Test
    void tryAdmit_rejectsAtLimitWithoutWriting() {
        InMemoryDistributionStore store = new InMemoryDistributionStore();
        for (int i = 0; i < 5; i++) {
            assertTrue(store.tryAdmit("quota", "arm_b", CounterKind.STARTED, 5).isAdmitted());
        }

        Admission sixth = store.tryAdmit("quota", "arm_b", CounterKind.STARTED, 5);

        assertFalse(sixth.isAdmitted());
        assertEquals(5, sixth.getObserved());
        assertEquals(5, store.counts("quota", "arm_b").getStarted());
    }

    @Test
    void tryAdmit_concurrentCallersNeverOvershootLimit() throws Exception {
        InMemoryDistributionStore store = new InMemoryDistributionStore();
        ExecutorService pool = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Admission>> futures = new ArrayList<>();
        for (int t = 0; t < 50; t++) {
            futures.add(pool.submit(() -> {
                start.await();
                return store.tryAdmit("quota", "arm_b", CounterKind.STARTED, 5);
            }));
        }
        start.countDown();
        int admitted = 0;
        for (Future<Admission> f : futures) {
            if (f.get(30, TimeUnit.SECONDS).isAdmitted()) admitted++;
        }
        pool.shutdown();

        assertEquals(5, admitted);
        assertEquals(new DistributionCounts(5, 0, 5), store.counts("quota", "arm_b"));
    }

    @Test
    void tryAdmit_onActiveCountsFreedSlots() {
        InMemoryDistributionStore store = new InMemoryDistributionStore();
        store.tryAdmit("quota", "x", CounterKind.ACTIVE, 1);
        assertFalse(store.tryAdmit("quota", "x", CounterKind.ACTIVE, 1).isAdmitted());

        store.complete("quota", "x");

        assertTrue(store.tryAdmit("quota", "x", CounterKind.ACTIVE, 1).isAdmitted());
        assertEquals(new DistributionCounts(2, 1, 1), store.counts("quota", "x"));
    }

    @Test
    void releaseAndComplete_neverGoBelowZeroAndNotifyListeners() {
        InMemoryDistributionStore store = new InMemoryDistributionStore();
        AtomicInteger notified = new AtomicInteger();
        Runnable unregister = store.addListener((level, child) -> notified.incrementAndGet());

        store.release("main", "a");
        store.complete("main", "a");
        unregister.run();
        store.release("main", "a");

        assertEquals(new DistributionCounts(0, 1, 0), store.counts("main", "a"));
        assertEquals(2, notified.get());
    }

    @Test
    void copyOf_isIndependentOfSource() {
        InMemoryDistributionStore live = new InMemoryDistributionStore();
        live.claim("main", "a");

        InMemoryDistributionStore copy = InMemoryDistributionStore.copyOf(live.snapshotAll());
        copy.claim("main", "a");
        copy.claim("other", "x");

        assertEquals(1, live.counts("main", "a").getStarted());
        assertEquals(2, copy.counts("main", "a").getStarted());
        assertEquals(1, live.snapshotAll().size());
    }

    @Test
    void reset_clearsOneLevelOrAll() {
        InMemoryDistributionStore store = new InMemoryDistributionStore();
        store.claim("main", "a");
        store.claim("other", "b");

        store.reset("main");
        assertEquals(DistributionCounts.ZERO, store.counts("main", "a"));
        assertEquals(1, store.counts("other", "b").getStarted());

        store.resetAll();
        assertTrue(store.snapshotAll().isEmpty());
    }

    @Test
    void resetChild_clearsOnlyThatChild() {
        InMemoryDistributionStore store = new InMemoryDistributionStore();
        store.tryAdmit("quota", "a", CounterKind.STARTED, 1);
        store.tryAdmit("quota", "b", CounterKind.STARTED, 1);

        store.resetChild("quota", "a");
        store.resetChild("missing", "a");

        assertEquals(DistributionCounts.ZERO, store.counts("quota", "a"));
        assertEquals(1, store.counts("quota", "b").getStarted());
        assertTrue(store.tryAdmit("quota", "a", CounterKind.STARTED, 1).isAdmitted());
    }
}
