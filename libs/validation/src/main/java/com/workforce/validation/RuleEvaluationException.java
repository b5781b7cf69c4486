package com.workforce.validation;

/**
 * Thrown when a rule could not be evaluated, as opposed to evaluating to "invalid".
 * <p>
 * Typical causes are storage being unreachable while a context-dependent rule looks up persisted
 * state, or validation not completing within the configured timeout. This is a server fault and
 * must surface as a 5xx, never as a field error.
 */
public class RuleEvaluationException extends RuntimeException {

    private final String field;

    public RuleEvaluationException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public RuleEvaluationException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /**
     * Wraps a failure raised while evaluating a rule on {@code field}. An existing
     * {@code RuleEvaluationException} is returned unchanged.
     */
    static RuleEvaluationException forField(String field, Throwable cause) {
        if (cause instanceof RuleEvaluationException ree) {
            return ree;
        }
        return new RuleEvaluationException(
                field, "Rule on field '" + field + "' could not be evaluated: " + cause.getMessage(), cause);
    }

    /**
     * The field whose rule failed to evaluate, or null when the failure was not tied to a field.
     */
    public String field() {
        return field;
    }
}
