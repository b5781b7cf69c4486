package com.workforce.validation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gate run before a request handler: validates every payload of the invocation and decides
 * whether the handler may run.
 * <p>
 * For each payload the {@link ValidatorRegistry} is consulted; payloads without a validator pass.
 * All validators start at once and are awaited together under one deadline, then their outcomes
 * are merged in payload order into a single error map. The pipeline never mutates a payload and
 * touches storage only through the rules it runs.
 *
 * <h2>Failure modes</h2>
 *
 * <ul>
 *   <li>Field errors → an invalid {@link ValidationOutcome}; the handler is not invoked.
 *   <li>A rule that cannot be evaluated → {@link RuleEvaluationException}.
 *   <li>Deadline exceeded → {@link RuleEvaluationException}; pending rules are cancelled.
 *   <li>Calling thread interrupted → {@link CancellationException}; pending rules are cancelled
 *       and the interrupt flag is restored.
 * </ul>
 */
public final class ValidationPipeline {

    private static final Logger log = LoggerFactory.getLogger(ValidationPipeline.class);

    /** Default bound on waiting for all rules of one invocation. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final ValidatorRegistry registry;
    private final Duration timeout;

    public ValidationPipeline(ValidatorRegistry registry) {
        this(registry, DEFAULT_TIMEOUT);
    }

    public ValidationPipeline(ValidatorRegistry registry, Duration timeout) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.registry = registry;
        this.timeout = timeout;
    }

    /**
     * Validates the given payloads and returns the aggregate outcome.
     *
     * @param payloads handler arguments bound from the request (nulls are skipped)
     * @param context  request context passed to every rule
     * @return the merged outcome, valid when no payload produced an error
     */
    public ValidationOutcome validate(List<?> payloads, RuleContext context) {
        List<CompletableFuture<ValidationOutcome>> running = new ArrayList<>();
        for (Object payload : payloads) {
            Optional<Validator<Object>> validator = registry.resolveFor(payload);
            validator.ifPresent(v -> running.add(start(v, payload, context)));
        }
        if (running.isEmpty()) {
            return ValidationOutcome.ok();
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(running.toArray(CompletableFuture[]::new));
        try {
            all.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            abandon(context, running);
            Thread.currentThread().interrupt();
            throw new CancellationException("Validation was interrupted");
        } catch (TimeoutException e) {
            abandon(context, running);
            throw new RuleEvaluationException(
                    "Validation did not complete within " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            abandon(context, running);
            throw translate(e.getCause());
        }

        ValidationOutcome outcome = ValidationOutcome.ok();
        for (CompletableFuture<ValidationOutcome> future : running) {
            outcome = outcome.merge(future.join());
        }
        if (!outcome.valid()) {
            log.debug("Validation rejected request: {}", outcome.errors());
        }
        return outcome;
    }

    /**
     * Validates the payloads and invokes {@code handler} only when they are all valid.
     *
     * @param payloads   handler arguments bound from the request
     * @param context    request context passed to every rule
     * @param handler    the guarded handler
     * @param onRejected produces the response for an invalid outcome
     * @return the handler's result, or the rejection response
     * @throws X whatever the handler throws
     */
    public <R, X extends Throwable> R gate(
            List<?> payloads,
            RuleContext context,
            GuardedHandler<R, X> handler,
            Function<ValidationOutcome, R> onRejected) throws X {
        ValidationOutcome outcome = validate(payloads, context);
        if (!outcome.valid()) {
            return onRejected.apply(outcome);
        }
        return handler.proceed();
    }

    /**
     * The handler guarded by {@link #gate}.
     *
     * @param <R> handler result
     * @param <X> exception the handler may throw
     */
    @FunctionalInterface
    public interface GuardedHandler<R, X extends Throwable> {

        R proceed() throws X;
    }

    private static CompletableFuture<ValidationOutcome> start(
            Validator<Object> validator, Object payload, RuleContext context) {
        try {
            CompletableFuture<ValidationOutcome> future = validator.validate(payload, context);
            if (future == null) {
                return CompletableFuture.failedFuture(new RuleEvaluationException(
                        validator.getClass().getSimpleName() + " returned no result", null));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static void abandon(RuleContext context, List<CompletableFuture<ValidationOutcome>> running) {
        context.cancel();
        running.forEach(future -> future.cancel(true));
    }

    private static RuntimeException translate(Throwable failure) {
        Throwable cause = failure;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuleEvaluationException ree) {
            return ree;
        }
        if (cause instanceof CancellationException ce) {
            return ce;
        }
        return new RuleEvaluationException("Validator failed: " + cause.getMessage(), cause);
    }
}
