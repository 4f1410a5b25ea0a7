package com.pathway.rules.ast;

import com.pathway.executioncontext.ParticipantState;
import com.pathway.rules.VariablePath;

import java.util.Objects;

public final class Variable implements Operand {

    private final VariablePath path;

    public Variable(VariablePath path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    public VariablePath getPath() {
        return path;
    }

    @Override
    public Object resolve(ParticipantState state) {
        return path.resolve(state);
    }

    @Override
    public String toString() {
        return path.getText();
    }
}
