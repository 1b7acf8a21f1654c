package com.williamcallahan.inference.domain.errors;

import java.util.Objects;

/**
 * Standard JSON error payload.
 *
 * @param status fixed status indicator ("error")
 * @param message user-facing error message
 * @param details optional diagnostic details
 * @param errorKind classified upstream failure kind when the error came from providers, otherwise null
 * @param retryAfterSeconds suggested wait before retrying, or null when no hint applies
 */
public record ApiErrorResponse(
        String status, String message, String details, String errorKind, Long retryAfterSeconds)
        implements ApiResponse {
    private static final String STATUS_ERROR = "error";

    public ApiErrorResponse {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(message, "Error message is required");
    }

    public static ApiErrorResponse error(String message) {
        return new ApiErrorResponse(STATUS_ERROR, message, null, null, null);
    }

    public static ApiErrorResponse error(String message, String details) {
        return new ApiErrorResponse(STATUS_ERROR, message, details, null, null);
    }

    /**
     * Creates an error payload describing an exhausted provider fallback run.
     *
     * @param message user-facing error message
     * @param details per-candidate summary
     * @param errorKind dominant error kind name
     * @param retryAfterSeconds suggested wait before retrying
     * @return standardized error payload
     */
    public static ApiErrorResponse providerFailure(
            String message, String details, String errorKind, long retryAfterSeconds) {
        return new ApiErrorResponse(STATUS_ERROR, message, details, errorKind, retryAfterSeconds);
    }
}
