package com.williamcallahan.inference.domain.failure;

/**
 * Closed taxonomy of upstream failures and the recovery policy each one implies.
 *
 * <p>Declaration order is also classification order: the first kind whose pattern matches wins.</p>
 */
public enum ErrorKind {
    RATE_LIMIT(RecoveryPolicy.of(true, 1, 60, ErrorSeverity.MEDIUM, true, true)),
    QUOTA_EXCEEDED(RecoveryPolicy.of(true, 60, 3600, ErrorSeverity.HIGH, true, true)),
    AUTHENTICATION(RecoveryPolicy.of(false, 0, 0, ErrorSeverity.CRITICAL, false, true)),
    AUTHORIZATION(RecoveryPolicy.of(false, 0, 0, ErrorSeverity.CRITICAL, true, false)),
    NOT_FOUND(RecoveryPolicy.of(false, 0, 0, ErrorSeverity.HIGH, true, false)),
    SERVER_ERROR(RecoveryPolicy.of(true, 5, 300, ErrorSeverity.MEDIUM, true, false)),
    NETWORK_ERROR(RecoveryPolicy.of(true, 2, 60, ErrorSeverity.MEDIUM, false, false)),
    TIMEOUT(RecoveryPolicy.of(true, 5, 120, ErrorSeverity.MEDIUM, false, false)),
    PAYMENT_REQUIRED(RecoveryPolicy.of(false, 0, 0, ErrorSeverity.CRITICAL, true, true)),
    INVALID_REQUEST(RecoveryPolicy.of(false, 0, 0, ErrorSeverity.LOW, false, false)),
    UNKNOWN(RecoveryPolicy.of(true, 10, 300, ErrorSeverity.MEDIUM, true, false));

    private final RecoveryPolicy policy;

    ErrorKind(RecoveryPolicy policy) {
        this.policy = policy;
    }

    public RecoveryPolicy policy() {
        return policy;
    }

    public ErrorSeverity severity() {
        return policy.severity();
    }

    /** Quota and rate-limit failures put the model into an explicit cooldown window. */
    public boolean isRateLimiting() {
        return this == RATE_LIMIT || this == QUOTA_EXCEEDED;
    }

    /**
     * Failures tied to the credential or account: other providers may still serve the request,
     * but the same provider must not be retried within the call.
     */
    public boolean isCredentialFatal() {
        return this == AUTHENTICATION || this == AUTHORIZATION || this == PAYMENT_REQUIRED;
    }

    /** Caller errors propagate unchanged instead of triggering fallback. */
    public boolean isCallerError() {
        return this == INVALID_REQUEST;
    }
}
