package com.flagship.drink_ledger.observability;

import java.util.UUID;

/**
 * MDC keys and header name for correlation ID propagation.
 *
 * The correlation ID is taken from the {@code X-Correlation-ID} request
 * header (or generated) and attached to every log statement via MDC, so one
 * drink or payup can be followed from the HTTP request to the store write.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String PRINCIPAL_MDC_KEY = "principal";
    public static final String TARGET_USER_MDC_KEY = "targetUser";

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Short format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
