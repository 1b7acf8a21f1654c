package com.williamcallahan.inference.domain.failure;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed recovery guidance attached to an {@link ErrorKind}.
 *
 * @param retryable whether the same request may be retried at all
 * @param backoffBase initial backoff before a retry
 * @param backoffMax ceiling for exponential backoff
 * @param severity severity assigned to the kind
 * @param switchProvider whether moving to a different provider is advised
 * @param switchCredential whether moving to a different credential is advised
 */
public record RecoveryPolicy(
        boolean retryable,
        Duration backoffBase,
        Duration backoffMax,
        ErrorSeverity severity,
        boolean switchProvider,
        boolean switchCredential) {

    public RecoveryPolicy {
        Objects.requireNonNull(backoffBase, "backoffBase");
        Objects.requireNonNull(backoffMax, "backoffMax");
        Objects.requireNonNull(severity, "severity");
        if (backoffBase.compareTo(backoffMax) > 0) {
            throw new IllegalArgumentException("backoffBase must not exceed backoffMax");
        }
    }

    static RecoveryPolicy of(
            boolean retryable,
            long backoffBaseSeconds,
            long backoffMaxSeconds,
            ErrorSeverity severity,
            boolean switchProvider,
            boolean switchCredential) {
        return new RecoveryPolicy(
                retryable,
                Duration.ofSeconds(backoffBaseSeconds),
                Duration.ofSeconds(backoffMaxSeconds),
                severity,
                switchProvider,
                switchCredential);
    }
}
