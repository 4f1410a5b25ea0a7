package com.pathway.rules.ast;

import com.pathway.executioncontext.ParticipantState;

import java.util.List;

public final class Not implements RuleExpression {

    private final RuleExpression operand;

    public Not(RuleExpression operand) {
        this.operand = operand;
    }

    @Override
    public boolean evaluate(ParticipantState state) {
        return !operand.evaluate(state);
    }

    @Override
    public void collectUsages(List<VariableUsage> out) {
        operand.collectUsages(out);
    }

    @Override
    public String toString() {
        return "NOT " + operand;
    }
}
