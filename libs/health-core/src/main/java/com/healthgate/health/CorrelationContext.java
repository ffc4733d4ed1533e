package com.healthgate.health;

/**
 * Immutable correlation data of the request that triggered a health check run.
 * <p>
 * The aggregator carries it onto the threads that run probes, so log lines written by a
 * probe can be tied back to the inbound request.
 *
 * @param correlationId unique ID of the inbound request chain
 * @param requestId     unique ID of this request (nullable)
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
     * Compact constructor; ensures correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }
}
