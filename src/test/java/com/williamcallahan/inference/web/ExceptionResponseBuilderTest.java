package com.williamcallahan.inference.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.williamcallahan.inference.domain.errors.ApiErrorResponse;
import com.williamcallahan.inference.domain.errors.ApiResponse;
import com.williamcallahan.inference.domain.failure.CandidateFailure;
import com.williamcallahan.inference.domain.failure.ErrorKind;
import com.williamcallahan.inference.service.AllProvidersFailedException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Verifies error payload construction.
 */
class ExceptionResponseBuilderTest {

    private final ExceptionResponseBuilder builder = new ExceptionResponseBuilder();

    @Test
    void describeException_includesTypeAndMessage() {
        assertEquals("IllegalStateException: broken", builder.describeException(new IllegalStateException("broken")));
        assertEquals("IllegalStateException", builder.describeException(new IllegalStateException()));
        assertNull(builder.describeException(null));
    }

    @Test
    void providerFailure_roundsRetryAfterUpToOneSecond() {
        AllProvidersFailedException failure = new AllProvidersFailedException(
                "generate",
                List.of(CandidateFailure.skipped("groq", "llama", CandidateFailure.SkipReason.CIRCUIT_OPEN, Duration.ZERO)),
                ErrorKind.SERVER_ERROR,
                Duration.ofMillis(200));

        ResponseEntity<ApiResponse> response = builder.buildProviderFailureResponse(failure);

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals("1", response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
        ApiErrorResponse body = assertInstanceOf(ApiErrorResponse.class, response.getBody());
        assertEquals("SERVER_ERROR", body.errorKind());
        assertEquals("groq/llama: skipped: circuit_open", body.details());
    }
}
