package com.pathway.distribution;

/**
 * Monotonic, atomically dispensed sequence numbers per key (one key per node that needs a population-level
 * running index, e.g. latin-square rows or round-robin pick cursors). Independent of the distribution counters.
 */
public interface SequenceCounters extends AutoCloseable {

    /** Next index for the key, starting at 0. */
    long next(String key);

    /** How many indexes were dispensed for the key so far. */
    long current(String key);

    void reset(String key);

    void resetAll();

    @Override
    default void close() {
    }
}
