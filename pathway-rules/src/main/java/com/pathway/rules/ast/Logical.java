package com.pathway.rules.ast;

import com.pathway.executioncontext.ParticipantState;

import java.util.List;
import java.util.stream.Collectors;

/** Short-circuit AND / OR over two or more operands. */
public final class Logical implements RuleExpression {

    public enum Kind { AND, OR }

    private final Kind kind;
    private final List<RuleExpression> operands;

    public Logical(Kind kind, List<RuleExpression> operands) {
        this.kind = kind;
        this.operands = List.copyOf(operands);
    }

    public Kind getKind() {
        return kind;
    }

    public List<RuleExpression> getOperands() {
        return operands;
    }

    @Override
    public boolean evaluate(ParticipantState state) {
        if (kind == Kind.AND) {
            for (RuleExpression operand : operands) {
                if (!operand.evaluate(state)) return false;
            }
            return true;
        }
        for (RuleExpression operand : operands) {
            if (operand.evaluate(state)) return true;
        }
        return false;
    }

    @Override
    public void collectUsages(List<VariableUsage> out) {
        for (RuleExpression operand : operands) {
            operand.collectUsages(out);
        }
    }

    @Override
    public String toString() {
        return operands.stream().map(String::valueOf)
                .collect(Collectors.joining(" " + kind.name() + " ", "(", ")"));
    }
}
