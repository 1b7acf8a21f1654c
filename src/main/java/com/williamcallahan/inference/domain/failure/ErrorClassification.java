package com.williamcallahan.inference.domain.failure;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of classifying one upstream failure.
 *
 * @param kind classified error kind
 * @param retryAfterHint explicit retry delay found in the failure, or null
 * @param message raw failure text used for classification
 */
public record ErrorClassification(ErrorKind kind, Duration retryAfterHint, String message) {

    public ErrorClassification {
        Objects.requireNonNull(kind, "kind");
        message = message == null ? "" : message;
    }

    public ErrorSeverity severity() {
        return kind.severity();
    }

    public RecoveryPolicy policy() {
        return kind.policy();
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfterHint);
    }
}
