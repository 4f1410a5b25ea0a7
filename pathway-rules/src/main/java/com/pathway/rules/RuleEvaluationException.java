package com.pathway.rules;

/**
 * Thrown when a parsed rule cannot be evaluated against a participant's state (e.g. ordering a list against a number).
 * Always recovered by {@link RuleEvaluator} through its {@link RuleEvaluationPolicy}.
 */
public class RuleEvaluationException extends RuntimeException {

    public RuleEvaluationException(String message) {
        super(message);
    }
}
