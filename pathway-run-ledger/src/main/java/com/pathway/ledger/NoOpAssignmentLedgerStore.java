package com.pathway.ledger;

import java.util.List;

/** Discards records. Used when the ledger is disabled and for simulated participants. */
public final class NoOpAssignmentLedgerStore implements AssignmentLedgerStore {

    @Override
    public void append(AssignmentRecord record) {
        // no-op
    }

    @Override
    public List<AssignmentRecord> history(String sessionId) {
        return List.of();
    }
}
