package com.workforce.validation;

import java.util.concurrent.CompletableFuture;

/**
 * A single, possibly asynchronous, predicate over one field of a payload.
 * <p>
 * A rule completes with {@code true} when the value is acceptable. A rule that cannot decide
 * (storage unreachable, bad programming) completes exceptionally instead of answering
 * {@code false}; the engine reports that as a {@link RuleEvaluationException}, never as a
 * field error.
 *
 * @param <T> payload type
 * @param <V> field value type
 */
@FunctionalInterface
public interface FieldRule<T, V> {

    /**
     * Evaluates the rule.
     *
     * @param value   the field value (may be null)
     * @param payload the whole payload, for rules comparing fields
     * @param context the request context (route values, executor for storage lookups)
     * @return a future completing with whether the value satisfies the rule
     */
    CompletableFuture<Boolean> evaluate(V value, T payload, RuleContext context);
}
