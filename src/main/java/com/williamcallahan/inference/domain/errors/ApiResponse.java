package com.williamcallahan.inference.domain.errors;

/**
 * Shared contract for JSON payloads returned by the provider operations endpoints.
 */
public sealed interface ApiResponse permits ApiErrorResponse, ApiSuccessResponse {

    /**
     * Returns the status indicator for this response.
     *
     * @return response status for client handling
     */
    String status();
}
