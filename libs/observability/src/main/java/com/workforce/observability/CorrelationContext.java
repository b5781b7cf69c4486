package com.workforce.observability;

/**
 * Immutable correlation context that flows with a single inbound request.
 * <p>
 * Every HTTP request establishes a {@code CorrelationContext} so that log lines written while
 * validating, handling and committing the request can be tied together. The values are
 * injected into SLF4J MDC by {@link CorrelationContextHolder}.
 *
 * @param correlationId caller-supplied or generated ID that is echoed back to the client
 * @param requestId     unique ID for this specific request (nullable)
 */
public record CorrelationContext(String correlationId, String requestId) {

    /**
     * MDC key for correlation ID.
     */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /**
     * MDC key for request ID.
     */
    public static final String MDC_REQUEST_ID = "requestId";

    /**
     * Compact constructor: ensures correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }
}
