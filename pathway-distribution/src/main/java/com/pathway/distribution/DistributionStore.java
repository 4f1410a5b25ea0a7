package com.pathway.distribution;

import java.util.List;
import java.util.Map;

/**
 * Shared population counters {@code started / completed / active} per (level id, child id).
 * <p>
 * Every mutating operation is atomic with respect to the counters it reads: a claim reads the candidates'
 * counts and increments the chosen child in one step, so two concurrent participants never both observe the
 * same least-filled child. Implementations hold their lock (or transaction) only for that read-then-write and
 * never across rule evaluation or other I/O. Counters never go below zero.
 * <p>
 * A store is scoped to one experiment version (or one simulation run) and closed with it.
 */
public interface DistributionStore extends AutoCloseable {

    /** Counts of one child; {@link DistributionCounts#ZERO} when never touched. */
    DistributionCounts counts(String levelId, String childId);

    /** All children with counters at a level. */
    Map<String, DistributionCounts> snapshot(String levelId);

    /** Level id to child id to counts. */
    Map<String, Map<String, DistributionCounts>> snapshotAll();

    /**
     * Atomically picks the candidate with the lowest {@code balanceOn} counter, ties going to the earliest
     * candidate in the given order, and increments its {@code started} and {@code active} counters.
     *
     * @param candidates candidates in tie-break order; must not be empty
     * @throws ConcurrencyConflictException when an optimistic implementation lost a race (nothing was written)
     */
    ClaimResult claimLeastFilled(String levelId, List<String> candidates, CounterKind balanceOn);

    /** Increments {@code started} and {@code active} of a child chosen by some other policy. */
    void claim(String levelId, String childId);

    /**
     * Atomically admits into a capacity-limited child: when its {@code countOn} counter is below {@code limit},
     * {@code started} and {@code active} are incremented.
     *
     * @throws ConcurrencyConflictException when an optimistic implementation lost a race (nothing was written)
     */
    Admission tryAdmit(String levelId, String childId, CounterKind countOn, long limit);

    /** Route finished: {@code completed} up, {@code active} down. Notifies listeners. */
    void complete(String levelId, String childId);

    /** Route abandoned before completion: {@code started} and {@code active} down. Notifies listeners. */
    void release(String levelId, String childId);

    /** Clears one level. */
    void reset(String levelId);

    /** Clears the counters of one child, leaving its siblings untouched. */
    void resetChild(String levelId, String childId);

    void resetAll();

    /**
     * Registers a listener for decrements made through this store instance.
     *
     * @return handle that unregisters the listener
     */
    Runnable addListener(CounterListener listener);

    @Override
    default void close() {
    }
}
