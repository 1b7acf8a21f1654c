package com.williamcallahan.inference.domain.failure;

/**
 * Severity of a classified provider failure, ordered from least to most severe.
 */
public enum ErrorSeverity {
    /** Temporary, retry immediately. */
    LOW,
    /** Temporary, retry with backoff. */
    MEDIUM,
    /** Requires intervention, longer backoff. */
    HIGH,
    /** Permanent or semi-permanent failure of the provider or credential. */
    CRITICAL;

    /** Reports whether this severity outranks the other one. */
    public boolean isMoreSevereThan(ErrorSeverity other) {
        return compareTo(other) > 0;
    }
}
