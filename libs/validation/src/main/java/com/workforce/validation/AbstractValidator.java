package com.workforce.validation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Base class for validators built from per-field rule chains.
 * <p>
 * Subclasses declare their rules in the constructor:
 *
 * <pre>{@code
 * public CreateEmployeeRequestValidator() {
 *     super(CreateEmployeeRequest.class);
 *     ruleFor("FirstName", CreateEmployeeRequest::firstName)
 *             .must(Rules.notEmpty(), "First name is required.");
 * }
 * }</pre>
 *
 * <h2>Evaluation</h2>
 *
 * <ul>
 *   <li>Rules of one field run one after another in declaration order, and every rule runs even
 *       when an earlier one on the same field failed, so all violations are reported.
 *   <li>Different fields are evaluated concurrently; their chains share no mutable state.
 *   <li>The outcome lists fields in declaration order whatever order the chains finish in.
 *   <li>A rule that throws or completes exceptionally fails the whole validation with a
 *       {@link RuleEvaluationException}.
 * </ul>
 *
 * @param <T> payload type
 */
public abstract class AbstractValidator<T> implements Validator<T> {

    private final Class<T> payloadType;
    private final Map<String, FieldChain<T, ?>> chains = new LinkedHashMap<>();

    protected AbstractValidator(Class<T> payloadType) {
        if (payloadType == null) {
            throw new IllegalArgumentException("payloadType must not be null");
        }
        this.payloadType = payloadType;
    }

    @Override
    public final Class<T> payloadType() {
        return payloadType;
    }

    /**
     * Starts (or continues) the rule chain for a field.
     *
     * @param field    field name as reported in the error map
     * @param accessor reads the field value from the payload
     * @return a builder for appending rules to the field
     */
    @SuppressWarnings("unchecked")
    protected final <V> FieldRuleBuilder<V> ruleFor(String field, Function<T, V> accessor) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field must not be null or blank");
        }
        FieldChain<T, ?> existing = chains.get(field);
        FieldChain<T, V> chain;
        if (existing == null) {
            chain = new FieldChain<>(field);
            chains.put(field, chain);
        } else {
            chain = (FieldChain<T, V>) existing;
        }
        return new FieldRuleBuilder<>(chain, accessor);
    }

    @Override
    public CompletableFuture<ValidationOutcome> validate(T payload, RuleContext context) {
        Map<String, CompletableFuture<List<String>>> running = new LinkedHashMap<>();
        for (FieldChain<T, ?> chain : chains.values()) {
            running.put(chain.field, chain.run(payload, context));
        }

        return CompletableFuture.allOf(running.values().toArray(CompletableFuture[]::new))
                .thenApply(done -> {
                    Map<String, List<String>> errors = new LinkedHashMap<>();
                    running.forEach((field, future) -> {
                        List<String> messages = future.join();
                        if (!messages.isEmpty()) {
                            errors.put(field, messages);
                        }
                    });
                    return errors.isEmpty() ? ValidationOutcome.ok() : new ValidationOutcome(errors);
                });
    }

    /**
     * Fluent builder appending rules to one field's chain.
     *
     * @param <V> field value type
     */
    public final class FieldRuleBuilder<V> {

        private final FieldChain<T, V> chain;
        private final Function<T, V> accessor;

        private FieldRuleBuilder(FieldChain<T, V> chain, Function<T, V> accessor) {
            this.chain = chain;
            this.accessor = accessor;
        }

        /**
         * Appends a synchronous rule.
         */
        public FieldRuleBuilder<V> must(Predicate<V> predicate, String message) {
            return mustAsync((value, payload, context) ->
                    CompletableFuture.completedFuture(predicate.test(value)), message);
        }

        /**
         * Appends an asynchronous rule, typically one consulting persisted state via
         * {@link RuleContext#supplyAsync}.
         */
        public FieldRuleBuilder<V> mustAsync(FieldRule<T, V> rule, String message) {
            if (rule == null) {
                throw new IllegalArgumentException("rule must not be null");
            }
            if (message == null || message.isBlank()) {
                throw new IllegalArgumentException("message must not be null or blank");
            }
            chain.add(accessor, rule, message);
            return this;
        }
    }

    private static final class FieldChain<T, V> {

        private final String field;
        private final List<Step<T, V>> steps = new ArrayList<>();

        FieldChain(String field) {
            this.field = field;
        }

        void add(Function<T, V> accessor, FieldRule<T, V> rule, String message) {
            steps.add(new Step<>(accessor, rule, message));
        }

        CompletableFuture<List<String>> run(T payload, RuleContext context) {
            CompletableFuture<List<String>> result = CompletableFuture.completedFuture(new ArrayList<>());
            for (Step<T, V> step : steps) {
                result = result.thenCompose(messages -> step.evaluate(field, payload, context)
                        .thenApply(passed -> {
                            if (!passed) {
                                messages.add(step.message);
                            }
                            return messages;
                        }));
            }
            return result;
        }
    }

    private record Step<T, V>(Function<T, V> accessor, FieldRule<T, V> rule, String message) {

        CompletableFuture<Boolean> evaluate(String field, T payload, RuleContext context) {
            CompletableFuture<Boolean> pending;
            try {
                context.throwIfCancelled();
                pending = rule.evaluate(accessor.apply(payload), payload, context);
            } catch (CancellationException e) {
                return CompletableFuture.failedFuture(e);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(RuleEvaluationException.forField(field, e));
            }
            if (pending == null) {
                return CompletableFuture.failedFuture(new RuleEvaluationException(
                        field, "Rule on field '" + field + "' returned no result", null));
            }
            return pending.handle((passed, failure) -> {
                if (failure != null) {
                    Throwable cause = unwrap(failure);
                    if (cause instanceof CancellationException cancelled) {
                        throw cancelled;
                    }
                    throw RuleEvaluationException.forField(field, cause);
                }
                return Boolean.TRUE.equals(passed);
            });
        }

        private static Throwable unwrap(Throwable failure) {
            if (failure instanceof CompletionException && failure.getCause() != null) {
                return failure.getCause();
            }
            return failure;
        }
    }
}
