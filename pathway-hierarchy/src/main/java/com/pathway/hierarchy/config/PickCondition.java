package com.pathway.hierarchy.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Condition a pick candidate must satisfy: the candidate's effective pick-assign value for {@code variable}
 * is compared against the values the participant accumulated from earlier picks.
 */
public final class PickCondition {

    private final String variable;
    private final PickConditionOperator operator;

    @JsonCreator
    public PickCondition(
            @JsonProperty("variable") String variable,
            @JsonProperty("operator") PickConditionOperator operator) {
        this.variable = variable;
        this.operator = operator != null ? operator : PickConditionOperator.NOT_IN;
    }

    public String getVariable() {
        return variable;
    }

    public PickConditionOperator getOperator() {
        return operator;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PickCondition that = (PickCondition) o;
        return Objects.equals(variable, that.variable) && operator == that.operator;
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, operator);
    }

    @Override
    public String toString() {
        return variable + " " + operator.toValue();
    }
}
