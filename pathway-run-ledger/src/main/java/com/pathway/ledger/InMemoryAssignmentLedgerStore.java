package com.pathway.ledger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryAssignmentLedgerStore implements AssignmentLedgerStore {

    private final Map<String, List<AssignmentRecord>> bySession = new ConcurrentHashMap<>();

    @Override
    public void append(AssignmentRecord record) {
        List<AssignmentRecord> records = bySession.computeIfAbsent(record.getSessionId(), id -> new ArrayList<>());
        synchronized (records) {
            records.add(record.stamped(record.getSessionId(), records.size() + 1L, record.getTimestamp()));
        }
    }

    @Override
    public List<AssignmentRecord> history(String sessionId) {
        List<AssignmentRecord> records = bySession.get(sessionId);
        if (records == null) return List.of();
        synchronized (records) {
            return List.copyOf(records);
        }
    }
}
