package com.pathway.rules.ast;

import com.pathway.executioncontext.ParticipantState;

import java.util.Objects;

public final class Literal implements Operand {

    public static final Literal NULL = new Literal(null);

    private final Object value;

    public Literal(Object value) {
        this.value = value;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public Object resolve(ParticipantState state) {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Literal && Objects.equals(value, ((Literal) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }
}
