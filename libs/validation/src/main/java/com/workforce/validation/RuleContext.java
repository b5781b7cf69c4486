package com.workforce.validation;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Request-scoped information handed explicitly to every rule evaluation.
 * <p>
 * Carries the route (path template) values of the inbound request, extracted once by the caller
 * of the {@link ValidationPipeline}, and the executor on which rules perform storage lookups.
 * Rules never reach into framework request state themselves.
 * <p>
 * A context is cancelled by the pipeline when the request is abandoned; rules that have not
 * started yet are then skipped and in-flight lookups see {@link #isCancelled()}.
 */
public final class RuleContext {

    private final Map<String, String> routeValues;
    private final Executor executor;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private RuleContext(Map<String, String> routeValues, Executor executor) {
        this.routeValues = Map.copyOf(routeValues);
        this.executor = executor;
    }

    /**
     * Creates a context from the given route values.
     *
     * @param routeValues path template variables of the request (e.g. {@code id -> "42"})
     * @param executor    executor for storage-backed rules
     */
    public static RuleContext of(Map<String, String> routeValues, Executor executor) {
        if (routeValues == null) {
            throw new IllegalArgumentException("routeValues must not be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        return new RuleContext(routeValues, executor);
    }

    /**
     * Creates a context without route values whose lookups run on the calling thread.
     */
    public static RuleContext empty() {
        return new RuleContext(Map.of(), Runnable::run);
    }

    /**
     * Returns the raw route value for {@code name}, if present and non-blank.
     */
    public Optional<String> routeValue(String name) {
        String value = routeValues.get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    /**
     * Returns the route value for {@code name} parsed as a numeric identifier. Absent and
     * malformed values both yield an empty result.
     */
    public OptionalLong routeId(String name) {
        Optional<String> raw = routeValue(name);
        if (raw.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(raw.get()));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    /**
     * Runs a storage lookup on this context's executor.
     *
     * @param lookup the blocking lookup
     * @return a future completing with the lookup result
     */
    public <V> CompletableFuture<V> supplyAsync(Supplier<V> lookup) {
        return CompletableFuture.supplyAsync(() -> {
            throwIfCancelled();
            return lookup.get();
        }, executor);
    }

    /**
     * Marks this context as cancelled.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("validation was cancelled");
        }
    }
}
