package com.pathway.rules.ast;

import com.pathway.executioncontext.ParticipantState;

/**
 * Value-producing leaf of a rule: a literal, a variable path or a list literal.
 */
public interface Operand {

    Object resolve(ParticipantState state);
}
