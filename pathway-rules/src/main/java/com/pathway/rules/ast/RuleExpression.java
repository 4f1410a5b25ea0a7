package com.pathway.rules.ast;

import com.pathway.executioncontext.ParticipantState;

import java.util.List;

/**
 * Node of a parsed rule. Evaluation is a pure function of the participant state.
 */
public interface RuleExpression {

    boolean evaluate(ParticipantState state);

    /** Appends every variable reference in this expression, with the operator and literals it is compared against. */
    void collectUsages(List<VariableUsage> out);
}
