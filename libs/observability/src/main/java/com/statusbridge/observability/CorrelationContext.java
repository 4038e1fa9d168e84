package com.statusbridge.observability;

/**
 * Immutable correlation context that flows with a single inbound request.
 * <p>
 * Every webhook or API call establishes a {@code CorrelationContext} so that the log lines
 * produced while the request fans out into target and service updates can be tied back to
 * the notification that caused them. Values are injected into SLF4J MDC by
 * {@link CorrelationContextHolder}.
 *
 * @param correlationId unique ID for the request (propagated from {@code X-Correlation-ID} or generated)
 * @param sourceAddress remote address of the caller (nullable)
 * @param requestPath   request URI path (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String sourceAddress,
        String requestPath
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for the caller address. */
    public static final String MDC_SOURCE_ADDRESS = "sourceAddress";

    /** MDC key for the request path. */
    public static final String MDC_REQUEST_PATH = "requestPath";

    /**
     * Compact constructor; correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Creates a context carrying only a correlation ID. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null);
    }
}
