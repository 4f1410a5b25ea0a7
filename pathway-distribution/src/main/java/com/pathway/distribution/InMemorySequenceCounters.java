package com.pathway.distribution;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public final class InMemorySequenceCounters implements SequenceCounters {

    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

    @Override
    public long next(String key) {
        return counters.computeIfAbsent(key, k -> new AtomicLong()).getAndIncrement();
    }

    @Override
    public long current(String key) {
        AtomicLong counter = counters.get(key);
        return counter != null ? counter.get() : 0L;
    }

    @Override
    public void reset(String key) {
        counters.remove(key);
    }

    @Override
    public void resetAll() {
        counters.clear();
    }
}
