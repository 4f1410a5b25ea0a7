package com.pathway.rules;

import com.pathway.rules.ast.RuleExpression;

/**
 * Result of parsing a rule once: the expression tree, or the syntax error that prevented it.
 */
public final class CompiledRule {

    private final String source;
    private final RuleExpression expression;
    private final RuleSyntaxException error;

    private CompiledRule(String source, RuleExpression expression, RuleSyntaxException error) {
        this.source = source;
        this.expression = expression;
        this.error = error;
    }

    static CompiledRule of(String source, RuleExpression expression) {
        return new CompiledRule(source, expression, null);
    }

    static CompiledRule failed(String source, RuleSyntaxException error) {
        return new CompiledRule(source, null, error);
    }

    public String getSource() {
        return source;
    }

    public boolean isValid() {
        return expression != null;
    }

    /** Parsed tree; null when {@link #isValid()} is false. */
    public RuleExpression getExpression() {
        return expression;
    }

    public RuleSyntaxException getError() {
        return error;
    }
}
