package com.pathway.rules.ast;

import com.pathway.rules.VariablePath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One reference to a variable inside a rule: the path, the operator applied (null for a bare truthiness test)
 * and the literal values it is compared against.
 */
public final class VariableUsage {

    private final VariablePath path;
    private final String operator;
    private final List<Object> comparedValues;

    public VariableUsage(VariablePath path, String operator, List<Object> comparedValues) {
        this.path = path;
        this.operator = operator;
        this.comparedValues = comparedValues != null
                ? Collections.unmodifiableList(new ArrayList<>(comparedValues))
                : List.of();
    }

    public VariablePath getPath() {
        return path;
    }

    public String getOperator() {
        return operator;
    }

    public List<Object> getComparedValues() {
        return comparedValues;
    }
}
