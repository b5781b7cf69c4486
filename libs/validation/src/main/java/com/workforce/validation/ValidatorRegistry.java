package com.workforce.validation;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a payload type to the single {@link Validator} bound to it.
 * <p>
 * Built once at startup from an enumerable list of validators (in a Spring application, every
 * {@code Validator} bean) and immutable afterwards. Lookups use the exact runtime class of the
 * payload; a payload type with no validator simply needs no validation, so an empty result is a
 * normal answer and never an error.
 */
public final class ValidatorRegistry {

    private final Map<Class<?>, Validator<?>> validators;

    /**
     * Indexes the given validators by {@link Validator#payloadType()}.
     *
     * @param validators all validators known to the process
     * @throws IllegalStateException if two validators claim the same payload type
     */
    public ValidatorRegistry(Collection<? extends Validator<?>> validators) {
        if (validators == null) {
            throw new IllegalArgumentException("validators must not be null");
        }
        Map<Class<?>, Validator<?>> index = new LinkedHashMap<>();
        for (Validator<?> validator : validators) {
            Class<?> type = validator.payloadType();
            if (type == null) {
                throw new IllegalStateException(
                        validator.getClass().getName() + " does not declare a payload type");
            }
            Validator<?> previous = index.putIfAbsent(type, validator);
            if (previous != null) {
                throw new IllegalStateException("Payload type " + type.getName()
                        + " is claimed by both " + previous.getClass().getName()
                        + " and " + validator.getClass().getName());
            }
        }
        this.validators = Map.copyOf(index);
    }

    /**
     * Returns the validator bound to {@code payloadType}, if any.
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<Validator<T>> resolve(Class<T> payloadType) {
        return Optional.ofNullable((Validator<T>) validators.get(payloadType));
    }

    /**
     * Returns the validator bound to the runtime class of {@code payload}, if any.
     */
    @SuppressWarnings("unchecked")
    public Optional<Validator<Object>> resolveFor(Object payload) {
        if (payload == null) {
            return Optional.empty();
        }
        return Optional.ofNullable((Validator<Object>) validators.get(payload.getClass()));
    }

    /**
     * Returns the payload types that have a validator.
     */
    public Set<Class<?>> registeredTypes() {
        return validators.keySet();
    }

    /**
     * Returns the number of registered validators.
     */
    public int size() {
        return validators.size();
    }
}
