package com.pathway.rules;

/**
 * Outcome of a rule that cannot be parsed or evaluated.
 */
public enum RuleEvaluationPolicy {
    /** Broken rules evaluate to true: the node stays visible. */
    FAIL_OPEN,
    /** Broken rules evaluate to false: the node and its subtree are skipped. */
    FAIL_CLOSED;

    public boolean fallbackResult() {
        return this == FAIL_OPEN;
    }

    public static RuleEvaluationPolicy fromFailOpen(boolean failOpen) {
        return failOpen ? FAIL_OPEN : FAIL_CLOSED;
    }
}
