package com.phillippitts.shato.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Opaque per-request tracing token.
 *
 * <p>Assigned once when an external request enters the service and passed unchanged to every
 * collaborator call (HTTP header {@value #HEADER}) and every log record (Log4j2
 * {@code ThreadContext} key {@value #MDC_KEY}).
 *
 * @param correlationId identifier value (never blank)
 */
public record CorrelationContext(String correlationId) {

    /** HTTP header carrying the identifier between services. */
    public static final String HEADER = "X-Correlation-ID";

    /** Log4j2 ThreadContext key. */
    public static final String MDC_KEY = "correlationId";

    private static final int GENERATED_LENGTH = 8;

    public CorrelationContext {
        Objects.requireNonNull(correlationId, "correlationId must not be null");
        if (correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be blank");
        }
    }

    /**
     * Creates a fresh identifier (first eight characters of a random UUID).
     *
     * @return new context
     */
    public static CorrelationContext generate() {
        return new CorrelationContext(UUID.randomUUID().toString().substring(0, GENERATED_LENGTH));
    }

    /**
     * Uses the supplied identifier, or generates one if it is null or blank.
     *
     * @param candidate caller-supplied identifier (nullable)
     * @return context wrapping the candidate or a generated identifier
     */
    public static CorrelationContext ofNullable(String candidate) {
        return (candidate == null || candidate.isBlank()) ? generate() : new CorrelationContext(candidate.trim());
    }

    @Override
    public String toString() {
        return correlationId;
    }
}
