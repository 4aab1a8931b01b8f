package com.warehouse.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Request id handling shared by the HTTP filter and anything that needs the
 * current id. The id is kept in the MDC under {@link #RID} so every log line
 * written while serving the request carries it.
 */
public final class RequestIdContext {

    public static final String RID = "rid";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    private static final int MAX_LENGTH = 64;

    private RequestIdContext() {}

    /**
     * Adopts the caller's request id when it sent a usable one, otherwise
     * generates one; populates the MDC and echoes the id on the response.
     */
    public static String ensureForHttp(HttpServletRequest request, HttpServletResponse response) {
        String requestId = sanitize(request.getHeader(REQUEST_ID_HEADER));
        if (requestId == null) {
            requestId = generateRequestId();
        }

        MDC.put(RID, requestId);

        if (response != null) {
            response.setHeader(REQUEST_ID_HEADER, requestId);
        }
        return requestId;
    }

    public static String current() {
        return MDC.get(RID);
    }

    public static String generateRequestId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static void clear() {
        MDC.remove(RID);
    }

    private static String sanitize(String candidate) {
        if (candidate == null) {
            return null;
        }
        String trimmed = candidate.trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_LENGTH) {
            return null;
        }
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '-' && c != '_') {
                return null;
            }
        }
        return trimmed;
    }
}
