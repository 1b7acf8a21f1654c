package com.williamcallahan.inference.domain.failure;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of the bounded error history.
 *
 * @param timestamp when the failure was recorded
 * @param kind classified kind
 * @param severity severity of the kind
 * @param provider provider that failed
 * @param keyIndex index of the credential in use, 0 for single-key providers
 * @param message raw failure message
 */
public record ErrorRecord(
        Instant timestamp, ErrorKind kind, ErrorSeverity severity, String provider, int keyIndex, String message) {

    public ErrorRecord {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(severity, "severity");
        provider = provider == null ? "" : provider;
        message = message == null ? "" : message;
    }
}
