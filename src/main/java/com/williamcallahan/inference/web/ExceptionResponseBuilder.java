package com.williamcallahan.inference.web;

import com.williamcallahan.inference.domain.errors.ApiErrorResponse;
import com.williamcallahan.inference.domain.errors.ApiResponse;
import com.williamcallahan.inference.domain.errors.ApiSuccessResponse;
import com.williamcallahan.inference.domain.failure.CandidateFailure;
import com.williamcallahan.inference.service.AllProvidersFailedException;
import java.util.stream.Collectors;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Builds the standard JSON error and success payloads for controllers.
 */
@Component
public class ExceptionResponseBuilder {

    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, describeException(exception)));
    }

    /**
     * Maps an exhausted fallback run to 503 with a {@code Retry-After} header and per-candidate details.
     *
     * @param failure terminal fallback failure
     * @return service-unavailable response
     */
    public ResponseEntity<ApiResponse> buildProviderFailureResponse(AllProvidersFailedException failure) {
        long retryAfterSeconds = Math.max(1, failure.retryAfter().getSeconds());
        String details = failure.failures().stream()
                .map(CandidateFailure::toString)
                .collect(Collectors.joining("; "));
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, Long.toString(retryAfterSeconds))
                .body(ApiErrorResponse.providerFailure(
                        "No provider could serve the request", details, failure.dominantKind().name(), retryAfterSeconds));
    }

    public ResponseEntity<ApiResponse> buildSuccessResponse(String message) {
        return ResponseEntity.ok(ApiSuccessResponse.success(message));
    }

    /**
     * Describes an exception as {@code Type: message}.
     *
     * @param exception exception to describe, may be null
     * @return description, or null when no exception is provided
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        String message = exception.getMessage();
        return exception.getClass().getSimpleName() + (message == null || message.isBlank() ? "" : ": " + message);
    }
}
