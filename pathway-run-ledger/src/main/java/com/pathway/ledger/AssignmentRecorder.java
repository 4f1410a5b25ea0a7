package com.pathway.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Fail-safe facade for the assignment ledger. Every record is stamped with the session id and the server clock at
 * write time (client-supplied timestamps are ignored). Any exception from the store is caught and logged, never
 * rethrown, so routing never fails because the audit trail is unavailable.
 */
public final class AssignmentRecorder {

    private static final Logger log = LoggerFactory.getLogger(AssignmentRecorder.class);

    private final AssignmentLedgerStore store;
    private final Clock clock;

    public AssignmentRecorder(AssignmentLedgerStore store) {
        this(store, Clock.systemUTC());
    }

    public AssignmentRecorder(AssignmentLedgerStore store, Clock clock) {
        this.store = store != null ? store : new NoOpAssignmentLedgerStore();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Recorder that keeps nothing. */
    public static AssignmentRecorder noOp() {
        return new AssignmentRecorder(new NoOpAssignmentLedgerStore());
    }

    public void record(String sessionId, AssignmentRecord record) {
        if (sessionId == null || record == null) {
            log.warn("Assignment record skipped | sessionId={} | record={}", sessionId, record);
            return;
        }
        try {
            store.append(record.stamped(sessionId, 0, clock.millis()));
            log.debug("Assignment recorded | sessionId={} | key={} | children={} | reason={}",
                    sessionId, record.getAssignmentKey(), record.getAssignedChildIds(), record.getReason());
        } catch (Throwable t) {
            log.warn("Assignment ledger write failed (sessionId={}, key={}); routing continues. Error: {}",
                    sessionId, record.getAssignmentKey(), t.getMessage(), t);
        }
    }

    /** Ordered records of a session. Read failures propagate. */
    public List<AssignmentRecord> history(String sessionId) {
        return store.history(sessionId);
    }
}
