package com.pathway.engine.replay;

import com.pathway.executioncontext.ParticipantState;
import com.pathway.hierarchy.tree.Hierarchy;
import com.pathway.ledger.AssignmentRecord;
import com.pathway.ledger.DecisionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Rebuilds a session's assignments from its assignment records.
 * <p>
 * Records are applied in sequence order and the first record for a key wins, as during the live session.
 * Pick records also re-accumulate the pick assigns of the chosen children.
 */
public final class AssignmentReplayer {

    private static final Logger log = LoggerFactory.getLogger(AssignmentReplayer.class);

    private final Hierarchy hierarchy;

    public AssignmentReplayer(Hierarchy hierarchy) {
        this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy");
    }

    /**
     * Returns a fresh copy of {@code base} (same id, seed and collected values) carrying the replayed assignments.
     */
    public ParticipantState replay(ParticipantState base, List<AssignmentRecord> records) {
        ParticipantState state = base.freshCopy();
        List<AssignmentRecord> ordered = records.stream()
                .sorted(Comparator.comparingLong(AssignmentRecord::getSequence))
                .collect(Collectors.toList());
        int skipped = 0;
        for (AssignmentRecord record : ordered) {
            if (record.getDecisionType() == DecisionType.UNKNOWN || record.getAssignmentKey() == null) {
                skipped++;
                continue;
            }
            List<String> applied = state.assignIfAbsent(record.getAssignmentKey(), record.getAssignedChildIds());
            if (record.getDecisionType() == DecisionType.PICK) {
                applied.forEach(id -> state.accumulatePickAssigns(hierarchy.effectivePickAssigns(id)));
            }
        }
        if (skipped > 0) {
            log.warn("Replay skipped records | sessionId={} | skipped={}", base.getSessionId(), skipped);
        }
        return state;
    }
}
