package com.pathway.rules;

import com.pathway.executioncontext.ParticipantState;
import com.pathway.hierarchy.config.PickCondition;
import com.pathway.hierarchy.tree.HierarchyNode;
import com.pathway.hierarchy.validation.ExpressionCheck;
import com.pathway.rules.ast.VariableUsage;
import com.pathway.rules.parse.RuleParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates visibility rules and pick conditions against participant state.
 * <p>
 * Each distinct expression is parsed once into a typed tree and cached. A rule that cannot be parsed or
 * evaluated never aborts the caller: it yields the result of the configured {@link RuleEvaluationPolicy}
 * and is logged. Blank rules are always true. Thread-safe.
 */
public final class RuleEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RuleEvaluator.class);

    private final RuleEvaluationPolicy policy;
    private final Map<String, CompiledRule> cache = new ConcurrentHashMap<>();

    public RuleEvaluator(RuleEvaluationPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public RuleEvaluationPolicy getPolicy() {
        return policy;
    }

    /** Parses (or returns the cached parse of) an expression. Never throws. */
    public CompiledRule compile(String expression) {
        return cache.computeIfAbsent(expression, source -> {
            try {
                return CompiledRule.of(source, RuleParser.parse(source));
            } catch (RuleSyntaxException e) {
                log.warn("Rule rejected | expression={} | policy={} | error={}", source, policy, e.getMessage());
                return CompiledRule.failed(source, e);
            }
        });
    }

    /** Evaluates with the evaluator's policy. */
    public boolean evaluate(String expression, ParticipantState state) {
        return evaluate(expression, state, policy);
    }

    /**
     * Evaluates an expression against a participant.
     *
     * @return the rule's value; the policy fallback when it is malformed or fails at evaluation time
     */
    public boolean evaluate(String expression, ParticipantState state, RuleEvaluationPolicy failurePolicy) {
        if (expression == null || expression.isBlank()) return true;
        CompiledRule rule = compile(expression);
        if (!rule.isValid()) {
            log.debug("Malformed rule | sessionId={} | expression={} | result={}", state.getSessionId(), expression, failurePolicy.fallbackResult());
            return failurePolicy.fallbackResult();
        }
        try {
            return rule.getExpression().evaluate(state);
        } catch (RuleEvaluationException e) {
            log.warn("Rule evaluation failed | sessionId={} | expression={} | policy={} | error={}",
                    state.getSessionId(), expression, failurePolicy, e.getMessage());
            return failurePolicy.fallbackResult();
        }
    }

    /** Whether a node is visible to the participant (its own rule, else {@code rules.visibility}). */
    public boolean isVisible(HierarchyNode node, ParticipantState state) {
        return evaluate(node.effectiveVisibilityRule(), state);
    }

    /**
     * Tests a pick condition for one candidate. {@code in}/{@code ==} pass when every candidate value was already
     * accumulated for the variable; {@code not_in}/{@code !=} when none was. A candidate without values passes.
     */
    public boolean matchesCondition(PickCondition condition, List<String> candidateValues, ParticipantState state) {
        if (candidateValues == null || candidateValues.isEmpty()) return true;
        List<String> accumulated = state.pickValues(condition.getVariable());
        boolean requireMember = condition.getOperator().requiresMembership();
        for (String value : candidateValues) {
            boolean member = accumulated.stream().anyMatch(a -> Values.looselyEquals(value, a));
            if (member != requireMember) return false;
        }
        return true;
    }

    /**
     * AND over all conditions for a candidate whose effective pick assigns are {@code candidateAssigns}.
     */
    public boolean matchesAll(List<PickCondition> conditions, Map<String, List<String>> candidateAssigns, ParticipantState state) {
        for (PickCondition condition : conditions) {
            if (!matchesCondition(condition, candidateAssigns.get(condition.getVariable()), state)) {
                return false;
            }
        }
        return true;
    }

    /** Variable references of an expression; empty when it does not parse. */
    public List<VariableUsage> usages(String expression) {
        if (expression == null || expression.isBlank()) return List.of();
        CompiledRule rule = compile(expression);
        if (!rule.isValid()) return List.of();
        List<VariableUsage> out = new ArrayList<>();
        rule.getExpression().collectUsages(out);
        return out;
    }

    /** Syntax check for publish-time validation. */
    public ExpressionCheck syntaxCheck() {
        return expression -> {
            CompiledRule rule = compile(expression);
            return rule.isValid() ? null : rule.getError().getMessage();
        };
    }
}
