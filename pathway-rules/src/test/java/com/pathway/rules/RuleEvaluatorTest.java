package com.pathway.rules;

import com.pathway.executioncontext.ParticipantState;
import com.pathway.hierarchy.config.PickCondition;
import com.pathway.hierarchy.config.PickConditionOperator;
import com.pathway.rules.ast.VariableUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuleEvaluatorTest {

    private final RuleEvaluator evaluator = new RuleEvaluator(RuleEvaluationPolicy.FAIL_OPEN);
    private ParticipantState state;

    @BeforeEach
    void setUp() {
        state = ParticipantState.forSession("s-1")
                .putEnvironment("age", 34)
                .putEnvironment("gender", "Female")
                .putEnvironment("url_params", Map.of("condition", "B"))
                .putResponse("intro", Map.of("smoker", "yes", "cigarettes", "12", "tags", List.of("a", "b")))
                .putScore("phq9", 14.5);
        state.assign("main", List.of("arm_a"));
    }

    @Test
    void evaluate_comparisonsWithNumericCoercion() {
        assertTrue(evaluator.evaluate("participant.age >= 18", state));
        assertFalse(evaluator.evaluate("participant.age < 18", state));
        assertTrue(evaluator.evaluate("intro.cigarettes > 10", state));
        assertTrue(evaluator.evaluate("scores.phq9 == 14.5", state));
        assertTrue(evaluator.evaluate("participant.age == '34'", state));
    }

    @Test
    void evaluate_stringEqualityIsCaseInsensitive() {
        assertTrue(evaluator.evaluate("participant.gender == 'female'", state));
        assertTrue(evaluator.evaluate("responses.intro.smoker != 'NO'", state));
    }

    @Test
    void evaluate_logicalOperatorsAndParentheses() {
        assertTrue(evaluator.evaluate("participant.age > 18 AND (intro.smoker == 'no' OR scores.phq9 > 10)", state));
        assertTrue(evaluator.evaluate("participant.age > 60 || participant.gender == 'female'", state));
        assertFalse(evaluator.evaluate("participant.age > 18 && NOT intro.smoker == 'yes'", state));
        assertTrue(evaluator.evaluate("!(participant.age < 18)", state));
    }

    @Test
    void evaluate_membershipOperators() {
        assertTrue(evaluator.evaluate("url.condition in ['A', 'B']", state));
        assertTrue(evaluator.evaluate("url_params.condition not_in ['C']", state));
        assertTrue(evaluator.evaluate("participant.gender not in ['male']", state));
        assertTrue(evaluator.evaluate("intro.tags contains 'b'", state));
        assertTrue(evaluator.evaluate("assignments.main == 'arm_a'", state));
        assertTrue(evaluator.evaluate("assignments.main in ['arm_a', 'arm_b']", state));
    }

    @Test
    void evaluate_missingVariablesAreFalseForComparisonsAndTrueForNotEqual() {
        assertFalse(evaluator.evaluate("participant.height > 150", state));
        assertFalse(evaluator.evaluate("participant.height == 150", state));
        assertTrue(evaluator.evaluate("participant.height != 150", state));
        assertTrue(evaluator.evaluate("participant.height == null", state));
        assertFalse(evaluator.evaluate("participant.height", state));
    }

    @Test
    void evaluate_blankRuleIsVisible() {
        assertTrue(evaluator.evaluate(null, state));
        assertTrue(evaluator.evaluate("   ", state));
    }

    @Test
    void evaluate_failOpenPolicyShowsNodeOnMalformedRule() {
        assertTrue(evaluator.evaluate("participant.age >>= 3", state));
        assertTrue(evaluator.evaluate("(participant.age > 3", state));
    }

    @Test
    void evaluate_failClosedPolicyHidesNodeOnMalformedRule() {
        RuleEvaluator closed = new RuleEvaluator(RuleEvaluationPolicy.FAIL_CLOSED);

        assertFalse(closed.evaluate("participant.age >>= 3", state));
        assertFalse(closed.evaluate("participant.age = 3", state));
        assertTrue(closed.evaluate("participant.age > 3", state));
    }

    @Test
    void evaluate_evaluationErrorFollowsPolicy() {
        RuleEvaluator closed = new RuleEvaluator(RuleEvaluationPolicy.FAIL_CLOSED);

        assertTrue(evaluator.evaluate("intro.tags > 3", state));
        assertFalse(closed.evaluate("intro.tags > 3", state));
    }

    @Test
    void compile_cachesParsedRule() {
        CompiledRule first = evaluator.compile("participant.age > 3");

        assertTrue(first.isValid());
        assertEquals(first, evaluator.compile("participant.age > 3"));
        assertFalse(evaluator.compile("participant.age >").isValid());
    }

    @Test
    void matchesCondition_notInRejectsAlreadyAccumulatedValues() {
        state.accumulatePickAssigns(Map.of("topic", List.of("climate")));
        PickCondition notIn = new PickCondition("topic", PickConditionOperator.NOT_IN);
        PickCondition in = new PickCondition("topic", PickConditionOperator.EQUAL);

        assertFalse(evaluator.matchesCondition(notIn, List.of("climate"), state));
        assertTrue(evaluator.matchesCondition(notIn, List.of("health"), state));
        assertTrue(evaluator.matchesCondition(in, List.of("climate"), state));
        assertFalse(evaluator.matchesCondition(in, List.of("climate", "health"), state));
    }

    @Test
    void matchesCondition_candidateWithoutValuePasses() {
        PickCondition in = new PickCondition("topic", PickConditionOperator.IN);

        assertTrue(evaluator.matchesCondition(in, List.of(), state));
        assertTrue(evaluator.matchesAll(List.of(in), Map.of(), state));
    }

    @Test
    void usages_reportPathsOperatorsAndComparedLiterals() {
        List<VariableUsage> usages = evaluator.usages("participant.gender == 'male' OR participant.region in ['north', 'south']");

        assertEquals(2, usages.size());
        assertEquals("participant.gender", usages.get(0).getPath().getText());
        assertEquals("==", usages.get(0).getOperator());
        assertEquals(List.of("male"), usages.get(0).getComparedValues());
        assertEquals(List.of("north", "south"), usages.get(1).getComparedValues());
        assertTrue(evaluator.usages("((").isEmpty());
    }

    @Test
    void syntaxCheck_reportsProblemOrNull() {
        assertNull(evaluator.syntaxCheck().check("a == 1"));
        assertTrue(evaluator.syntaxCheck().check("a == ").contains("Operand expected"));
    }
}
