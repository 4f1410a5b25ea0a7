package com.pathway.rules.ast;

import com.pathway.executioncontext.ParticipantState;

import java.util.ArrayList;
import java.util.List;

/** Inline list literal such as {@code ['control', 'treatment']}. */
public final class ListOperand implements Operand {

    private final List<Operand> elements;

    public ListOperand(List<Operand> elements) {
        this.elements = List.copyOf(elements);
    }

    public List<Operand> getElements() {
        return elements;
    }

    @Override
    public Object resolve(ParticipantState state) {
        List<Object> values = new ArrayList<>(elements.size());
        for (Operand element : elements) {
            values.add(element.resolve(state));
        }
        return values;
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
