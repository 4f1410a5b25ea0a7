package com.pathway.engine.pick;

import com.pathway.distribution.InMemorySequenceCounters;
import com.pathway.executioncontext.ParticipantState;
import com.pathway.hierarchy.HierarchyConfig;
import com.pathway.hierarchy.tree.Hierarchy;
import com.pathway.ledger.AssignmentRecord;
import com.pathway.ledger.AssignmentRecorder;
import com.pathway.ledger.DecisionType;
import com.pathway.ledger.InMemoryAssignmentLedgerStore;
import com.pathway.rules.RuleEvaluationPolicy;
import com.pathway.rules.RuleEvaluator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PickSelectorTest {

    static final String EXPERIMENT = """
            {
              "experiment_id": "pick-study",
              "phases": [
                {
                  "id": "topics",
                  "rules": { "pick": { "count": 2, "strategy": "random",
                                       "conditions": [ { "variable": "topic", "operator": "not_in" } ] } },
                  "stages": [
                    { "id": "c1", "pick_assigns": { "topic": "climate" }, "tasks": [ { "id": "c1_t" } ] },
                    { "id": "c2", "pick_assigns": { "topic": "climate" }, "tasks": [ { "id": "c2_t" } ] },
                    { "id": "c3", "pick_assigns": { "topic": "climate" }, "tasks": [ { "id": "c3_t" } ] },
                    { "id": "h1", "pick_assigns": { "topic": "health" }, "tasks": [ { "id": "h1_t" } ] }
                  ]
                },
                {
                  "id": "rotation",
                  "rules": { "pick_count": 2, "pick_strategy": "round_robin" },
                  "stages": [ { "id": "r1" }, { "id": "r2" }, { "id": "r3" }, { "id": "r4" } ]
                },
                {
                  "id": "weighted",
                  "rules": { "pick": { "count": 1, "strategy": "weighted_random", "weights": { "heavy": 9, "light": 1 } } },
                  "stages": [ { "id": "heavy" }, { "id": "light" } ]
                }
              ]
            }
            """;

    private Hierarchy hierarchy;
    private InMemoryAssignmentLedgerStore ledger;
    private PickSelector selector;

    @BeforeEach
    void setUp() {
        hierarchy = Hierarchy.from(HierarchyConfig.fromJson(EXPERIMENT));
        ledger = new InMemoryAssignmentLedgerStore();
        selector = new PickSelector(hierarchy, new RuleEvaluator(RuleEvaluationPolicy.FAIL_OPEN),
                new InMemorySequenceCounters(), new AssignmentRecorder(ledger));
    }

    @Test
    void selectPick_takesAllRemainingWhenConditionsLeaveTooFew() {
        ParticipantState state = ParticipantState.forSession("relaxed");
        state.accumulatePickAssigns(Map.of("topic", List.of("climate")));

        PickResult result = selector.selectPick(hierarchy.node("topics"), state);

        assertEquals(List.of("h1"), result.getChosen());
        assertEquals(3, result.getExcludedByConditions());
        assertTrue(result.isRelaxed());
        assertEquals(List.of("h1"), state.getAssignment("topics"));
        assertEquals(List.of("climate", "health"), state.pickValues("topic"));
    }

    @Test
    void selectPick_recordsDecisionWithStrategy() {
        ParticipantState state = ParticipantState.forSession("recorded");
        state.accumulatePickAssigns(Map.of("topic", List.of("climate")));

        selector.selectPick(hierarchy.node("topics"), state);

        AssignmentRecord record = ledger.history("recorded").get(0);
        assertEquals(DecisionType.PICK, record.getDecisionType());
        assertEquals("random", record.getOrderingMode());
        assertEquals("topics", record.getAssignmentKey());
        assertEquals("pick 2 of 4 (random): 3 excluded by conditions, only 1 candidate(s) left, selected all → [h1]",
                record.getReason());
    }

    @Test
    void selectPick_randomKeepsDeclaredOrderAndIsDeterministic() {
        PickResult first = selector.selectPick(hierarchy.node("topics"), new ParticipantState("a", 7L));
        PickResult second = selector.selectPick(hierarchy.node("topics"), new ParticipantState("b", 7L));

        assertEquals(first.getChosen(), second.getChosen());
        assertEquals(2, first.getChosen().size());
        List<String> declared = hierarchy.childIds("topics");
        assertTrue(declared.indexOf(first.getChosen().get(0)) < declared.indexOf(first.getChosen().get(1)));
    }

    @Test
    void selectPick_roundRobinRotatesThroughEverySubset() {
        Set<List<String>> seen = new HashSet<>();
        for (int i = 0; i < 6; i++) {
            seen.add(selector.selectPick(hierarchy.node("rotation"), ParticipantState.forSession("rr-" + i)).getChosen());
        }

        assertEquals(6, seen.size());
        assertEquals(List.of("r1", "r2"),
                selector.selectPick(hierarchy.node("rotation"), ParticipantState.forSession("rr-6")).getChosen());
    }

    @Test
    void selectPick_weightedRandomFavoursHeavierChild() {
        int heavy = 0;
        for (int i = 0; i < 1000; i++) {
            List<String> chosen = selector.selectPick(hierarchy.node("weighted"), ParticipantState.forSession("w-" + i)).getChosen();
            if (chosen.equals(List.of("heavy"))) heavy++;
        }

        assertTrue(heavy > 850 && heavy < 950, "heavy picked " + heavy);
    }

    @Test
    void selectPick_restoredSelectionReaccumulatesPickAssigns() {
        ParticipantState state = ParticipantState.forSession("resume");
        state.assign("topics", List.of("c1", "h1"));

        PickResult result = selector.selectPick(hierarchy.node("topics"), state);

        assertTrue(result.isRestored());
        assertEquals(List.of("c1", "h1"), result.getChosen());
        assertEquals(List.of("climate", "health"), state.pickValues("topic"));
        assertTrue(ledger.history("resume").isEmpty());
    }

    @Test
    void selectPick_nodeWithoutPickIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> selector.selectPick(hierarchy.node("c1"), ParticipantState.forSession("x")));
    }
}
