package com.pathway.distribution;

import com.pathway.hierarchy.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Re-runs a read-then-decide-then-write counter operation when it loses a race. Each attempt re-reads the
 * counters, so the decision is redone rather than replayed. Once the retry budget is spent the conflict is
 * escalated as a {@link ConfigurationException}.
 */
public final class ConflictRetry {

    private static final Logger log = LoggerFactory.getLogger(ConflictRetry.class);

    private final int maxRetries;

    public ConflictRetry(int maxRetries) {
        this.maxRetries = Math.max(0, maxRetries);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public <T> T run(String operation, Supplier<T> attempt) {
        ConcurrencyConflictException last = null;
        for (int i = 0; i <= maxRetries; i++) {
            try {
                return attempt.get();
            } catch (ConcurrencyConflictException e) {
                last = e;
                log.debug("Counter conflict | operation={} | levelId={} | attempt={}", operation, e.getLevelId(), i + 1);
            }
        }
        log.warn("Counter conflict retries exhausted | operation={} | levelId={} | retries={}",
                operation, last.getLevelId(), maxRetries);
        throw new ConfigurationException("Counter update for " + operation + " kept conflicting after "
                + maxRetries + " retries", last);
    }
}
