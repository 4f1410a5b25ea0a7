package com.pathway.hierarchy.validation;

/**
 * Syntax check for visibility expressions, supplied by the rules layer so the hierarchy model stays
 * independent of the expression language.
 */
@FunctionalInterface
public interface ExpressionCheck {

    /** Accepts every expression. */
    ExpressionCheck NONE = expression -> null;

    /**
     * @return a problem description, or null when the expression parses
     */
    String check(String expression);
}
