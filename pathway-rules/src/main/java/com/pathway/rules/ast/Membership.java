package com.pathway.rules.ast;

import com.pathway.executioncontext.ParticipantState;
import com.pathway.rules.Values;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Membership tests: {@code value in collection}, {@code value not_in collection} and {@code collection contains value}.
 * A text container tests for a substring; a map container tests for a key.
 */
public final class Membership implements RuleExpression {

    public enum Kind {
        IN("in"),
        NOT_IN("not_in"),
        CONTAINS("contains");

        private final String symbol;

        Kind(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    private final Operand left;
    private final Kind kind;
    private final Operand right;

    public Membership(Operand left, Kind kind, Operand right) {
        this.left = Objects.requireNonNull(left, "left");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.right = Objects.requireNonNull(right, "right");
    }

    @Override
    public boolean evaluate(ParticipantState state) {
        Object l = left.resolve(state);
        Object r = right.resolve(state);
        switch (kind) {
            case IN:
                return memberOf(l, r);
            case NOT_IN:
                return !memberOf(l, r);
            default:
                return memberOf(r, l);
        }
    }

    static boolean memberOf(Object value, Object container) {
        if (container == null) return false;
        if (container instanceof Collection) {
            for (Object element : (Collection<?>) container) {
                if (Values.looselyEquals(value, element)) return true;
            }
            return false;
        }
        if (container instanceof Map) {
            return value != null && ((Map<?, ?>) container).containsKey(Values.asText(value));
        }
        if (container instanceof CharSequence) {
            return value != null && container.toString().contains(Values.asText(value));
        }
        return Values.looselyEquals(value, container);
    }

    @Override
    public void collectUsages(List<VariableUsage> out) {
        Operand variableSide = kind == Kind.CONTAINS ? right : left;
        Operand containerSide = kind == Kind.CONTAINS ? left : right;
        if (variableSide instanceof Variable) {
            out.add(new VariableUsage(((Variable) variableSide).getPath(), kind.symbol(), literals(containerSide)));
        }
        if (containerSide instanceof Variable) {
            List<Object> compared = new ArrayList<>();
            if (variableSide instanceof Literal) compared.add(((Literal) variableSide).getValue());
            out.add(new VariableUsage(((Variable) containerSide).getPath(), kind.symbol(), compared));
        }
    }

    private static List<Object> literals(Operand operand) {
        List<Object> values = new ArrayList<>();
        if (operand instanceof ListOperand) {
            for (Operand element : ((ListOperand) operand).getElements()) {
                if (element instanceof Literal) values.add(((Literal) element).getValue());
            }
        } else if (operand instanceof Literal) {
            values.add(((Literal) operand).getValue());
        }
        return values;
    }

    @Override
    public String toString() {
        return left + " " + kind.symbol() + " " + right;
    }
}
