package com.workforce.employees.infrastructure.web;

import com.workforce.observability.CorrelationContextHolder;
import com.workforce.validation.ValidationOutcome;
import java.net.URI;
import java.time.Clock;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.stereotype.Component;

/**
 * Builds the RFC 7807 bodies returned by this service.
 *
 * <p>Every body carries {@code timestamp}, read from the application {@link Clock}, and the
 * {@code correlationId} of the current request when one is set.
 */
@Component
public class ProblemDetails {

    static final String TYPE_BASE = "https://workforce.example.com/errors/";

    private final Clock clock;

    public ProblemDetails(Clock clock) {
        this.clock = clock;
    }

    public ProblemDetail of(HttpStatus status, String type, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(TYPE_BASE + type));
        problem.setProperty("timestamp", clock.instant().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }

    /**
     * The 400 body for a rejected request. The {@code errors} property maps each failing field to
     * its messages, in rule order.
     */
    public ProblemDetail validation(ValidationOutcome outcome) {
        ProblemDetail problem = of(HttpStatus.BAD_REQUEST, "validation", "Validation Error",
                "One or more validation errors occurred.");
        problem.setProperty("errors", outcome.errors());
        return problem;
    }
}
