package com.flagship.gold_ledger.observability;

import java.util.List;
import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used across the service.
 *
 * The correlation id is taken from the {@code X-Correlation-ID} request header (or generated)
 * and the caller from {@code X-Caller-Address}; both appear on every log line of the request.
 * The aggregate keys are set by services for the duration of a single operation.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CALLER_HEADER = "X-Caller-Address";
    public static final String CALLER_MDC_KEY = "caller";
    public static final String TX_REF_MDC_KEY = "txRef";
    public static final String TOKEN_ID_MDC_KEY = "tokenId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";

    /**
     * Every key a request may leave in MDC; the filter clears them all when it finishes.
     */
    public static final List<String> REQUEST_MDC_KEYS = List.of(
        CORRELATION_ID_MDC_KEY, CALLER_MDC_KEY, TX_REF_MDC_KEY, TOKEN_ID_MDC_KEY, ACCOUNT_ID_MDC_KEY);

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
