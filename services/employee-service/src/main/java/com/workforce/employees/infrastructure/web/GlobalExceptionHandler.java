package com.workforce.employees.infrastructure.web;

import com.workforce.database.uow.CommitFailedException;
import com.workforce.database.uow.ConstraintViolationException;
import com.workforce.employees.domain.NotFoundException;
import com.workforce.validation.RuleEvaluationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps faults to RFC 7807 {@link ProblemDetail} responses.
 *
 * <p>Rejected payloads never reach this class as errors: the validation aspect answers them
 * directly, and only hands over a {@link RequestValidationException} for handlers that cannot
 * return a response entity. Storage and rule faults are logged at ERROR and answered with a
 * generic 500 detail.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final ProblemDetails problemDetails;

    public GlobalExceptionHandler(ProblemDetails problemDetails) {
        this.problemDetails = problemDetails;
    }

    @ExceptionHandler(RequestValidationException.class)
    public ProblemDetail handleRequestValidation(RequestValidationException ex) {
        return problemDetails.validation(ex.outcome());
    }

    @ExceptionHandler(NotFoundException.class)
    public ProblemDetail handleNotFound(NotFoundException ex) {
        log.info("{}", ex.getMessage());
        return problemDetails.of(HttpStatus.NOT_FOUND, "not-found", "Not Found", ex.getMessage());
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class,
        BindException.class
    })
    public ProblemDetail handleUnreadable(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problemDetails.of(HttpStatus.BAD_REQUEST, "bad-request", "Bad Request", "The request could not be read.");
    }

    @ExceptionHandler(RuleEvaluationException.class)
    public ProblemDetail handleRuleEvaluation(RuleEvaluationException ex) {
        log.error("Validation rule for field {} failed to evaluate", ex.field(), ex);
        return internalError();
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ProblemDetail handleConstraintViolation(ConstraintViolationException ex) {
        log.error("Commit rejected by a storage constraint", ex);
        return internalError();
    }

    @ExceptionHandler(CommitFailedException.class)
    public ProblemDetail handleCommitFailed(CommitFailedException ex) {
        log.error("Commit failed", ex);
        return internalError();
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return internalError();
    }

    private ProblemDetail internalError() {
        return problemDetails.of(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "Internal Server Error",
                "An unexpected error occurred");
    }
}
