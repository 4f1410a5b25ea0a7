package com.pathway.distribution;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Immutable snapshot of the counters of one child at one level. All values are non-negative.
 */
public final class DistributionCounts {

    public static final DistributionCounts ZERO = new DistributionCounts(0, 0, 0);

    private final long started;
    private final long completed;
    private final long active;

    @JsonCreator
    public DistributionCounts(
            @JsonProperty("started") long started,
            @JsonProperty("completed") long completed,
            @JsonProperty("active") long active) {
        this.started = Math.max(0, started);
        this.completed = Math.max(0, completed);
        this.active = Math.max(0, active);
    }

    @JsonProperty("started")
    public long getStarted() {
        return started;
    }

    @JsonProperty("completed")
    public long getCompleted() {
        return completed;
    }

    @JsonProperty("active")
    public long getActive() {
        return active;
    }

    public long get(CounterKind kind) {
        switch (kind) {
            case COMPLETED:
                return completed;
            case ACTIVE:
                return active;
            default:
                return started;
        }
    }

    /** Copy with {@code delta} added to one counter, floored at zero. */
    public DistributionCounts plus(CounterKind kind, long delta) {
        switch (kind) {
            case COMPLETED:
                return new DistributionCounts(started, completed + delta, active);
            case ACTIVE:
                return new DistributionCounts(started, completed, active + delta);
            default:
                return new DistributionCounts(started + delta, completed, active);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DistributionCounts)) return false;
        DistributionCounts that = (DistributionCounts) o;
        return started == that.started && completed == that.completed && active == that.active;
    }

    @Override
    public int hashCode() {
        return Objects.hash(started, completed, active);
    }

    @Override
    public String toString() {
        return "{started=" + started + ", completed=" + completed + ", active=" + active + "}";
    }
}
