package com.pathway.rules.ast;

import com.pathway.executioncontext.ParticipantState;
import com.pathway.rules.Values;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** {@code left <op> right} with loose typing; ordering a missing or non-numeric value against a number is false. */
public final class Comparison implements RuleExpression {

    private final Operand left;
    private final ComparisonOperator operator;
    private final Operand right;

    public Comparison(Operand left, ComparisonOperator operator, Operand right) {
        this.left = Objects.requireNonNull(left, "left");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.right = Objects.requireNonNull(right, "right");
    }

    @Override
    public boolean evaluate(ParticipantState state) {
        Object l = left.resolve(state);
        Object r = right.resolve(state);
        switch (operator) {
            case EQ:
                return Values.looselyEquals(l, r);
            case NE:
                return !Values.looselyEquals(l, r);
            default:
                Integer cmp = Values.compare(l, r);
                if (cmp == null) return false;
                switch (operator) {
                    case GT:
                        return cmp > 0;
                    case LT:
                        return cmp < 0;
                    case GE:
                        return cmp >= 0;
                    default:
                        return cmp <= 0;
                }
        }
    }

    @Override
    public void collectUsages(List<VariableUsage> out) {
        addUsage(left, right, out);
        addUsage(right, left, out);
    }

    private void addUsage(Operand variableSide, Operand otherSide, List<VariableUsage> out) {
        if (!(variableSide instanceof Variable)) return;
        List<Object> compared = new ArrayList<>();
        if (otherSide instanceof Literal) compared.add(((Literal) otherSide).getValue());
        out.add(new VariableUsage(((Variable) variableSide).getPath(), operator.symbol(), compared));
    }

    @Override
    public String toString() {
        return left + " " + operator.symbol() + " " + right;
    }
}
