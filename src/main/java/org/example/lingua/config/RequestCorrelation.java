package org.example.lingua.config;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.MDC;

/**
 * Header, request-attribute and MDC keys that tie a request id and the calling
 * learner to every log line and error body of one request.
 */
public final class RequestCorrelation {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String USER_HEADER_NAME = "X-User-Id";
    /** Request attribute and MDC key. */
    public static final String REQUEST_ID_KEY = "requestId";
    public static final String USER_ID_KEY = "userId";
    public static final String UNKNOWN = "unknown";

    static final int MAX_HEADER_LENGTH = 80;

    private RequestCorrelation() {
    }

    /**
     * The id assigned by {@link RequestCorrelationFilter}, falling back to the MDC for
     * code running outside a servlet request.
     */
    public static String resolveRequestId(HttpServletRequest request) {
        if (request != null && request.getAttribute(REQUEST_ID_KEY) instanceof String value && !value.isBlank()) {
            return value;
        }
        String fromMdc = MDC.get(REQUEST_ID_KEY);
        return fromMdc == null || fromMdc.isBlank() ? UNKNOWN : fromMdc;
    }

    /**
     * Trims a caller-supplied header and caps its length; blank values become null.
     */
    static String normalizeHeader(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > MAX_HEADER_LENGTH ? trimmed.substring(0, MAX_HEADER_LENGTH) : trimmed;
    }
}
