package com.williamcallahan.inference.domain.failure;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of one candidate that did not produce a result during a fallback run.
 *
 * @param provider provider name
 * @param model model identifier
 * @param kind classified error kind, null when the candidate was skipped without a call
 * @param skipReason why the candidate was not called, null when it was attempted
 * @param message failure or skip description
 * @param retryAfter how long until this candidate is expected to accept traffic again, or null
 */
public record CandidateFailure(
        String provider, String model, ErrorKind kind, SkipReason skipReason, String message, Duration retryAfter) {

    /**
     * Why a candidate was passed over without an upstream call.
     */
    public enum SkipReason {
        RATE_LIMITED,
        CIRCUIT_OPEN,
        UNHEALTHY,
        BACKING_OFF,
        CREDENTIAL_REJECTED,
        BUDGET_EXHAUSTED
    }

    public CandidateFailure {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(model, "model");
        if ((kind == null) == (skipReason == null)) {
            throw new IllegalArgumentException("Exactly one of kind or skipReason must be set");
        }
        message = message == null ? "" : message;
    }

    /** Creates an entry for a candidate that was called and failed. */
    public static CandidateFailure attempted(
            String provider, String model, ErrorKind kind, String message, Duration retryAfter) {
        return new CandidateFailure(provider, model, kind, null, message, retryAfter);
    }

    /** Creates an entry for a candidate that was skipped. */
    public static CandidateFailure skipped(String provider, String model, SkipReason reason, Duration retryAfter) {
        return new CandidateFailure(
                provider, model, null, reason, "skipped: " + reason.name().toLowerCase(java.util.Locale.ROOT), retryAfter);
    }

    public boolean wasAttempted() {
        return kind != null;
    }

    @Override
    public String toString() {
        return provider + "/" + model + ": " + (kind != null ? kind + " " : "") + message;
    }
}
