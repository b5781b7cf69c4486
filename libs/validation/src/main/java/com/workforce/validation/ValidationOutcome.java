package com.workforce.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of validating one or more payloads.
 * <p>
 * Maps field name to its error messages. Iteration order is the order in which the fields were
 * declared on the validator (and, across payloads, the order the payloads were validated in), so
 * error responses are deterministic regardless of which rule finished first.
 *
 * @param errors field name to ordered error messages (empty when valid)
 */
public record ValidationOutcome(Map<String, List<String>> errors) {

    private static final ValidationOutcome OK = new ValidationOutcome(Map.of());

    public ValidationOutcome {
        if (errors == null) {
            throw new IllegalArgumentException("errors must not be null");
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        errors.forEach((field, messages) -> {
            if (messages != null && !messages.isEmpty()) {
                copy.put(field, List.copyOf(messages));
            }
        });
        errors = Collections.unmodifiableMap(copy);
    }

    /** Convenience factory for a successful validation. */
    public static ValidationOutcome ok() {
        return OK;
    }

    /** True when no field carries an error. */
    public boolean valid() {
        return errors.isEmpty();
    }

    /** Total number of error messages across all fields. */
    public int errorCount() {
        return errors.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Returns an outcome holding this outcome's errors followed by {@code other}'s. Messages for a
     * field present in both are appended in that order.
     */
    public ValidationOutcome merge(ValidationOutcome other) {
        if (other.valid()) {
            return this;
        }
        if (valid()) {
            return other;
        }
        Map<String, List<String>> merged = new LinkedHashMap<>();
        errors.forEach((field, messages) -> merged.put(field, new ArrayList<>(messages)));
        other.errors.forEach((field, messages) ->
                merged.computeIfAbsent(field, f -> new ArrayList<>()).addAll(messages));
        return new ValidationOutcome(merged);
    }
}
