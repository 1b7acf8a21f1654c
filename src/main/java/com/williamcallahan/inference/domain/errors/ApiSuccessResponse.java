package com.williamcallahan.inference.domain.errors;

import java.util.Objects;

/**
 * Standard JSON success payload for administrative actions such as resets.
 *
 * @param status fixed status indicator ("success")
 * @param message user-facing confirmation
 */
public record ApiSuccessResponse(String status, String message) implements ApiResponse {
    private static final String STATUS_SUCCESS = "success";

    public ApiSuccessResponse {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(message, "Success message is required");
    }

    public static ApiSuccessResponse success(String message) {
        return new ApiSuccessResponse(STATUS_SUCCESS, message);
    }
}
