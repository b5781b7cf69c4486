package com.workforce.validation;

import java.util.concurrent.CompletableFuture;

/**
 * A rule set bound to exactly one payload type.
 * <p>
 * Implementations are stateless with respect to the payload: the same instance validates every
 * request for its type, possibly concurrently. Anything request-specific arrives through the
 * {@link RuleContext} argument.
 *
 * @param <T> the payload type this validator is bound to
 */
public interface Validator<T> {

    /**
     * Returns the payload type this validator is registered under in the {@link ValidatorRegistry}.
     */
    Class<T> payloadType();

    /**
     * Validates the payload. The returned future completes with the outcome, or exceptionally with
     * a {@link RuleEvaluationException} when a rule could not be evaluated at all.
     *
     * @param payload the deserialized payload (never null)
     * @param context request context visible to the rules
     * @return a future holding the validation outcome
     */
    CompletableFuture<ValidationOutcome> validate(T payload, RuleContext context);
}
