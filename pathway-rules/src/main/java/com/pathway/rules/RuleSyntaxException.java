package com.pathway.rules;

/**
 * Thrown when a rule expression cannot be parsed. Carries the offending expression and character position.
 */
public class RuleSyntaxException extends RuntimeException {

    private final String expression;
    private final int position;

    public RuleSyntaxException(String message, String expression, int position) {
        super(message + " at position " + position + " in '" + expression + "'");
        this.expression = expression;
        this.position = position;
    }

    public String getExpression() {
        return expression;
    }

    public int getPosition() {
        return position;
    }
}
