package com.pathway.distribution;

/** Notified after a counter of a (level, child) went down, i.e. capacity may have been freed. */
@FunctionalInterface
public interface CounterListener {

    void countersReleased(String levelId, String childId);
}
