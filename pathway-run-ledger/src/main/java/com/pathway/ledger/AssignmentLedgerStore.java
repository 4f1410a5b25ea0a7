package com.pathway.ledger;

import java.util.List;

/**
 * Persistence for assignment records. Append-only: records are never updated or deleted.
 * Implementations: {@link InMemoryAssignmentLedgerStore}, {@link NoOpAssignmentLedgerStore},
 * {@link com.pathway.ledger.store.JdbcAssignmentLedgerStore}.
 */
public interface AssignmentLedgerStore {

    /**
     * Appends a record that already carries session id and server timestamp. The store assigns the sequence.
     */
    void append(AssignmentRecord record);

    /** Records of a session in write order; empty for unknown sessions. */
    List<AssignmentRecord> history(String sessionId);
}
