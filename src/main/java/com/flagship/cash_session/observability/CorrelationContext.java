package com.flagship.cash_session.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * MDC keys of the service and the helpers that fill them. The logging
 * pattern prints {@code correlationId}, {@code sessionId} and {@code orderId}.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String SESSION_ID_MDC_KEY = "sessionId";
    public static final String ORDER_ID_MDC_KEY = "orderId";

    private static final Pattern SESSION_PATH = Pattern.compile(
        "^/api/pos/sessions/([0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12})(/.*)?$");

    private CorrelationContext() {
    }

    /**
     * The caller's correlation id, or a fresh eight-character one when the
     * header is missing or blank.
     */
    public static String resolveCorrelationId(String headerValue) {
        if (headerValue != null && !headerValue.isBlank()) {
            return headerValue.trim();
        }
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Session id addressed by a {@code /api/pos/sessions/{id}/...} request.
     */
    public static Optional<String> sessionIdFromPath(String requestUri) {
        if (requestUri == null) {
            return Optional.empty();
        }
        Matcher matcher = SESSION_PATH.matcher(requestUri);
        return matcher.matches() ? Optional.of(matcher.group(1).toLowerCase()) : Optional.empty();
    }

    public static void putSessionId(UUID sessionId) {
        if (sessionId != null) {
            MDC.put(SESSION_ID_MDC_KEY, sessionId.toString());
        }
    }

    public static void putOrderId(UUID orderId) {
        if (orderId != null) {
            MDC.put(ORDER_ID_MDC_KEY, orderId.toString());
        }
    }

    public static void clear() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(SESSION_ID_MDC_KEY);
        MDC.remove(ORDER_ID_MDC_KEY);
    }
}
