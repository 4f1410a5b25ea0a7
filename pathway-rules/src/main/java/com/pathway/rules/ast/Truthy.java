package com.pathway.rules.ast;

import com.pathway.executioncontext.ParticipantState;
import com.pathway.rules.Values;

import java.util.List;

/** Bare operand used as a condition, e.g. {@code participant.consented} or {@code true}. */
public final class Truthy implements RuleExpression {

    private final Operand operand;

    public Truthy(Operand operand) {
        this.operand = operand;
    }

    @Override
    public boolean evaluate(ParticipantState state) {
        return Values.isTruthy(operand.resolve(state));
    }

    @Override
    public void collectUsages(List<VariableUsage> out) {
        if (operand instanceof Variable) {
            out.add(new VariableUsage(((Variable) operand).getPath(), null, List.of()));
        }
    }

    @Override
    public String toString() {
        return String.valueOf(operand);
    }
}
