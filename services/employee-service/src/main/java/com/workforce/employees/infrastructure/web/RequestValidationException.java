package com.workforce.employees.infrastructure.web;

import com.workforce.validation.ValidationOutcome;

/**
 * Raised by {@link RequestValidationAspect} for handlers that do not return a {@code
 * ResponseEntity}; {@link GlobalExceptionHandler} turns it into the validation 400 body.
 */
public class RequestValidationException extends RuntimeException {

    private final transient ValidationOutcome outcome;

    public RequestValidationException(ValidationOutcome outcome) {
        super("Request failed validation with " + outcome.errorCount() + " error(s)");
        this.outcome = outcome;
    }

    public ValidationOutcome outcome() {
        return outcome;
    }
}
