package com.williamcallahan.inference.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.inference.client.ProviderCallException;
import com.williamcallahan.inference.domain.failure.ErrorClassification;
import com.williamcallahan.inference.domain.failure.ErrorKind;
import com.williamcallahan.inference.domain.failure.ErrorSeverity;
import java.net.ConnectException;
import java.time.Duration;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;

/**
 * Verifies failure classification, retry hint extraction and recommended backoff.
 */
class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier(new Random(7));

    @Test
    void classify_mapsCommonUpstreamPhrases() {
        assertEquals(ErrorKind.RATE_LIMIT, classifier.classify("429 Too Many Requests").kind());
        assertEquals(ErrorKind.QUOTA_EXCEEDED, classifier.classify("insufficient_quota: quota exceeded").kind());
        assertEquals(ErrorKind.AUTHENTICATION, classifier.classify("401 invalid api key").kind());
        assertEquals(ErrorKind.AUTHORIZATION, classifier.classify("Access denied for this project").kind());
        assertEquals(ErrorKind.NOT_FOUND, classifier.classify("The model `vision-x` was not found").kind());
        assertEquals(ErrorKind.SERVER_ERROR, classifier.classify("502 Bad Gateway").kind());
        assertEquals(ErrorKind.NETWORK_ERROR, classifier.classify("Connection refused").kind());
        assertEquals(ErrorKind.TIMEOUT, classifier.classify("Request timed out after 30s").kind());
        assertEquals(ErrorKind.PAYMENT_REQUIRED, classifier.classify("Payment required to continue").kind());
        assertEquals(ErrorKind.INVALID_REQUEST, classifier.classify("Malformed request body").kind());
        assertEquals(ErrorKind.UNKNOWN, classifier.classify("something odd happened").kind());
        assertEquals(ErrorKind.UNKNOWN, classifier.classify((String) null).kind());
    }

    @Test
    void classify_ignoresCaseOfUpstreamMessages() {
        assertEquals(ErrorKind.QUOTA_EXCEEDED, classifier.classify("QUOTA EXCEEDED for project").kind());
        assertEquals(ErrorKind.AUTHENTICATION, classifier.classify("UNAUTHORIZED: Invalid API Key").kind());
        assertEquals(ErrorKind.SERVER_ERROR, classifier.classify("Service Unavailable").kind());
        assertEquals(ErrorKind.RATE_LIMIT, classifier.classify("THROTTLED by upstream").kind());
    }

    @Test
    void classify_carriesPolicyOfKind() {
        ErrorClassification authentication = classifier.classify("401 invalid api key");

        assertFalse(authentication.policy().retryable());
        assertTrue(authentication.policy().switchCredential());
        assertEquals(ErrorSeverity.CRITICAL, authentication.severity());

        ErrorClassification rateLimit = classifier.classify("rate limit reached");
        assertTrue(rateLimit.policy().retryable());
        assertEquals(Duration.ofSeconds(1), rateLimit.policy().backoffBase());
        assertEquals(Duration.ofSeconds(60), rateLimit.policy().backoffMax());
    }

    @Test
    void classify_prefersHttpStatusOverMessage() {
        ProviderCallException unauthorized = new ProviderCallException("alpha", 401, null, "HTTP 401 from alpha: {}");
        ProviderCallException quota = new ProviderCallException(
                "alpha", 429, 30L, "HTTP 429 from alpha: insufficient_quota");
        ProviderCallException badRequest = new ProviderCallException(
                "alpha", 400, null, "HTTP 400 from alpha: rate limit field invalid");
        ProviderCallException unavailable = new ProviderCallException("alpha", 503, null, "upstream down");

        assertEquals(ErrorKind.AUTHENTICATION, classifier.classify(unauthorized).kind());
        ErrorClassification quotaClassification = classifier.classify(quota);
        assertEquals(ErrorKind.QUOTA_EXCEEDED, quotaClassification.kind());
        assertEquals(Optional.of(Duration.ofSeconds(30)), quotaClassification.retryAfter());
        assertEquals(ErrorKind.INVALID_REQUEST, classifier.classify(badRequest).kind());
        assertEquals(ErrorKind.SERVER_ERROR, classifier.classify(unavailable).kind());
    }

    @Test
    void classify_detectsTimeoutAndConnectionFailuresInCauseChain() {
        RuntimeException timeout = new RuntimeException("call failed", new TimeoutException("Did not observe any item"));
        RuntimeException connect = new IllegalStateException("call failed", new ConnectException("nope"));

        assertEquals(ErrorKind.TIMEOUT, classifier.classify(timeout).kind());
        assertEquals(ErrorKind.NETWORK_ERROR, classifier.classify(connect).kind());
        assertEquals(ErrorKind.UNKNOWN, classifier.classify((Throwable) null).kind());
    }

    @Test
    void classify_readsMessagesOfWrappedCauses() {
        RuntimeException wrapped = new RuntimeException("generation failed", new IllegalStateException("403 Forbidden"));

        assertEquals(ErrorKind.AUTHORIZATION, classifier.classify(wrapped).kind());
    }

    @Test
    void extractRetryAfter_findsHintsInText() {
        assertEquals(Optional.of(Duration.ofSeconds(30)), classifier.extractRetryAfter("Retry after 30 seconds"));
        assertEquals(Optional.of(Duration.ofSeconds(12)), classifier.extractRetryAfter("please wait 12 seconds"));
        assertEquals(Optional.of(Duration.ofSeconds(5)), classifier.extractRetryAfter("Try again in 5s"));
        assertEquals(Optional.of(Duration.ofSeconds(30)), classifier.extractRetryAfter("Retry-After: 30"));
        assertEquals(Optional.of(Duration.ofSeconds(45)),
                classifier.extractRetryAfter("rate limited, retry after: 45 seconds"));
        assertEquals(Optional.of(Duration.ofSeconds(8)), classifier.extractRetryAfter("BACK OFF: 8"));
        assertEquals(Optional.empty(), classifier.extractRetryAfter("no hint here"));
        assertEquals(Optional.empty(), classifier.extractRetryAfter(null));
    }

    @Test
    void classify_readsHeaderStyleHintFromWrappedBody() {
        ErrorClassification classification = classifier.classify(
                new IllegalStateException("upstream said: Rate limit exceeded. Retry-After: 20"));

        assertEquals(ErrorKind.RATE_LIMIT, classification.kind());
        assertEquals(Duration.ofSeconds(20), classification.retryAfterHint());
    }

    @Test
    void recommendedBackoff_prefersExplicitHint() {
        assertEquals(Duration.ofSeconds(42),
                classifier.recommendedBackoff(ErrorKind.SERVER_ERROR, 3, Duration.ofSeconds(42)));
    }

    @Test
    void recommendedBackoff_isZeroForNonRetryableKinds() {
        assertEquals(Duration.ZERO, classifier.recommendedBackoff(ErrorKind.AUTHENTICATION, 0, null));
        assertEquals(Duration.ZERO, classifier.recommendedBackoff(ErrorKind.INVALID_REQUEST, 2, null));
    }

    @Test
    void recommendedBackoff_growsWithinJitterBoundsAndCap() {
        for (int attempt = 0; attempt < 10; attempt++) {
            double nominal = Math.min(5 * Math.pow(2, attempt), 300);
            long seconds = classifier.recommendedBackoff(ErrorKind.SERVER_ERROR, attempt, null).getSeconds();
            assertTrue(seconds >= Math.floor(nominal * 0.75) - 1, "attempt " + attempt + " was " + seconds);
            assertTrue(seconds <= nominal * 1.25, "attempt " + attempt + " was " + seconds);
        }
        assertTrue(classifier.recommendedBackoff(ErrorKind.RATE_LIMIT, 0, null).getSeconds() >= 1);
    }
}
