package com.pathway.service;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pathway.ledger.AssignmentRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Current assignments of a session plus its ordered decision records.
 */
public final class AssignmentHistory {

    private final String sessionId;
    private final Map<String, List<String>> assignments;
    private final List<AssignmentRecord> records;

    @JsonCreator
    public AssignmentHistory(
            @JsonProperty("sessionId") String sessionId,
            @JsonProperty("assignments") Map<String, List<String>> assignments,
            @JsonProperty("records") List<AssignmentRecord> records) {
        this.sessionId = sessionId;
        this.assignments = assignments != null ? Collections.unmodifiableMap(new LinkedHashMap<>(assignments)) : Map.of();
        this.records = records != null ? List.copyOf(records) : List.of();
    }

    public String getSessionId() {
        return sessionId;
    }

    public Map<String, List<String>> getAssignments() {
        return assignments;
    }

    public List<AssignmentRecord> getRecords() {
        return records;
    }
}
