package com.workforce.validation;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.function.Predicate;

/**
 * Reusable synchronous predicates for {@link AbstractValidator#ruleFor}.
 * <p>
 * Except for {@link #notEmpty()}, every predicate accepts {@code null}: absence is the business of
 * a required-field rule, so an omitted optional field never collects more than one message.
 */
public final class Rules {

    private Rules() {
        // utility class
    }

    /** Rejects null, empty and whitespace-only strings. */
    public static Predicate<String> notEmpty() {
        return value -> value != null && !value.isBlank();
    }

    /** Rejects null values. */
    public static <V> Predicate<V> notNull() {
        return value -> value != null;
    }

    /** Rejects strings longer than {@code max} characters. */
    public static Predicate<String> maxLength(int max) {
        return value -> value == null || value.length() <= max;
    }

    /**
     * Rejects strings that do not look like an email address: exactly one {@code @} that is
     * neither the first nor the last character.
     */
    public static Predicate<String> emailAddress() {
        return value -> {
            if (value == null) {
                return true;
            }
            int at = value.indexOf('@');
            return at > 0 && at != value.length() - 1 && at == value.lastIndexOf('@');
        };
    }

    /** Rejects strings that are not absolute URIs. Empty strings are accepted. */
    public static Predicate<String> absoluteUri() {
        return value -> {
            if (value == null || value.isEmpty()) {
                return true;
            }
            try {
                return new URI(value).isAbsolute();
            } catch (URISyntaxException e) {
                return false;
            }
        };
    }

    /** Rejects integers below {@code min}. */
    public static Predicate<Integer> atLeast(int min) {
        return value -> value == null || value >= min;
    }

    /** Rejects integers above {@code max}. */
    public static Predicate<Integer> atMost(int max) {
        return value -> value == null || value <= max;
    }

    /** Rejects negative amounts. */
    public static Predicate<BigDecimal> notNegative() {
        return value -> value == null || value.signum() >= 0;
    }

    /** Accepts null and blank strings, otherwise delegates to {@code rule}. */
    public static Predicate<String> blankOr(Predicate<String> rule) {
        return value -> value == null || value.isBlank() || rule.test(value);
    }
}
