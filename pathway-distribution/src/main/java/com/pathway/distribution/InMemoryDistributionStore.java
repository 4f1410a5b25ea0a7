package com.pathway.distribution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process {@link DistributionStore}. Each level owns a lock that is held only while its counters are read and
 * written, so decisions at different levels never contend.
 */
public final class InMemoryDistributionStore implements DistributionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDistributionStore.class);

    private final Map<String, Level> levels = new ConcurrentHashMap<>();
    private final List<CounterListener> listeners = new CopyOnWriteArrayList<>();

    /** Independent store pre-filled with a snapshot; later writes never reach the snapshot's source. */
    public static InMemoryDistributionStore copyOf(Map<String, Map<String, DistributionCounts>> snapshot) {
        InMemoryDistributionStore store = new InMemoryDistributionStore();
        if (snapshot != null) {
            snapshot.forEach((levelId, children) -> store.level(levelId).counts.putAll(children));
        }
        return store;
    }

    private Level level(String levelId) {
        return levels.computeIfAbsent(Objects.requireNonNull(levelId, "levelId"), id -> new Level());
    }

    @Override
    public DistributionCounts counts(String levelId, String childId) {
        Level level = levels.get(levelId);
        if (level == null) return DistributionCounts.ZERO;
        level.lock.lock();
        try {
            return level.counts.getOrDefault(childId, DistributionCounts.ZERO);
        } finally {
            level.lock.unlock();
        }
    }

    @Override
    public Map<String, DistributionCounts> snapshot(String levelId) {
        Level level = levels.get(levelId);
        if (level == null) return Map.of();
        level.lock.lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(level.counts));
        } finally {
            level.lock.unlock();
        }
    }

    @Override
    public Map<String, Map<String, DistributionCounts>> snapshotAll() {
        Map<String, Map<String, DistributionCounts>> all = new TreeMap<>();
        for (String levelId : levels.keySet()) {
            Map<String, DistributionCounts> level = snapshot(levelId);
            if (!level.isEmpty()) all.put(levelId, level);
        }
        return Collections.unmodifiableMap(all);
    }

    @Override
    public ClaimResult claimLeastFilled(String levelId, List<String> candidates, CounterKind balanceOn) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("No candidates to claim at level " + levelId);
        }
        Level level = level(levelId);
        level.lock.lock();
        try {
            Map<String, Long> observed = new LinkedHashMap<>();
            String chosen = null;
            long min = Long.MAX_VALUE;
            for (String candidate : candidates) {
                long value = level.counts.getOrDefault(candidate, DistributionCounts.ZERO).get(balanceOn);
                observed.put(candidate, value);
                if (value < min) {
                    min = value;
                    chosen = candidate;
                }
            }
            level.increment(chosen);
            return new ClaimResult(chosen, observed);
        } finally {
            level.lock.unlock();
        }
    }

    @Override
    public void claim(String levelId, String childId) {
        Level level = level(levelId);
        level.lock.lock();
        try {
            level.increment(childId);
        } finally {
            level.lock.unlock();
        }
    }

    @Override
    public Admission tryAdmit(String levelId, String childId, CounterKind countOn, long limit) {
        Level level = level(levelId);
        level.lock.lock();
        try {
            long current = level.counts.getOrDefault(childId, DistributionCounts.ZERO).get(countOn);
            if (current >= limit) {
                return new Admission(false, current);
            }
            level.increment(childId);
            return new Admission(true, current);
        } finally {
            level.lock.unlock();
        }
    }

    @Override
    public void complete(String levelId, String childId) {
        Level level = level(levelId);
        level.lock.lock();
        try {
            DistributionCounts c = level.counts.getOrDefault(childId, DistributionCounts.ZERO);
            level.counts.put(childId, c.plus(CounterKind.COMPLETED, 1).plus(CounterKind.ACTIVE, -1));
        } finally {
            level.lock.unlock();
        }
        notifyReleased(levelId, childId);
    }

    @Override
    public void release(String levelId, String childId) {
        Level level = level(levelId);
        level.lock.lock();
        try {
            DistributionCounts c = level.counts.getOrDefault(childId, DistributionCounts.ZERO);
            level.counts.put(childId, c.plus(CounterKind.STARTED, -1).plus(CounterKind.ACTIVE, -1));
        } finally {
            level.lock.unlock();
        }
        notifyReleased(levelId, childId);
    }

    @Override
    public void reset(String levelId) {
        Level level = levels.get(levelId);
        if (level == null) return;
        level.lock.lock();
        try {
            level.counts.clear();
        } finally {
            level.lock.unlock();
        }
        log.info("Distribution counters reset | levelId={}", levelId);
    }

    @Override
    public void resetChild(String levelId, String childId) {
        Level level = levels.get(levelId);
        if (level == null) return;
        level.lock.lock();
        try {
            level.counts.remove(childId);
        } finally {
            level.lock.unlock();
        }
        log.info("Distribution counters reset | levelId={} | childId={}", levelId, childId);
    }

    @Override
    public void resetAll() {
        levels.keySet().forEach(this::reset);
    }

    @Override
    public Runnable addListener(CounterListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        return () -> listeners.remove(listener);
    }

    private void notifyReleased(String levelId, String childId) {
        for (CounterListener listener : listeners) {
            try {
                listener.countersReleased(levelId, childId);
            } catch (RuntimeException e) {
                log.warn("Counter listener failed | levelId={} | childId={}", levelId, childId, e);
            }
        }
    }

    private static final class Level {
        final ReentrantLock lock = new ReentrantLock();
        final Map<String, DistributionCounts> counts = new LinkedHashMap<>();

        void increment(String childId) {
            DistributionCounts c = counts.getOrDefault(childId, DistributionCounts.ZERO);
            counts.put(childId, c.plus(CounterKind.STARTED, 1).plus(CounterKind.ACTIVE, 1));
        }
    }
}
