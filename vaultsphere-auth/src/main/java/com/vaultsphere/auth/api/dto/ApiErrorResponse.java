package com.vaultsphere.auth.api.dto;

import java.time.Instant;

/**
 * Unified error response for all API errors.
 * Used by GlobalExceptionHandler and the security filters for consistent error structure.
 *
 * Example:
 * {
 *   "error": "INVALID_CREDENTIALS",
 *   "message": "Invalid email or password",
 *   "traceId": "abc-123",
 *   "timestamp": "2026-01-11T18:30:00Z"
 * }
 */
public class ApiErrorResponse {

    private final String error;       // Machine-readable error code
    private final String message;     // Human-readable error message
    private final String traceId;     // Echo of X-Trace-Id
    private final Instant timestamp;

    public ApiErrorResponse(String error, String message, String traceId, Instant timestamp) {
        this.error = error;
        this.message = message;
        this.traceId = traceId;
        this.timestamp = timestamp;
    }

    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public String getTraceId() {
        return traceId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
