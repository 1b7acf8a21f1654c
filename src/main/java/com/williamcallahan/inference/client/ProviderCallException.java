package com.williamcallahan.inference.client;

import java.time.Duration;
import java.util.Optional;

/**
 * Signals that an upstream provider rejected or failed a generation call.
 *
 * <p>Carries the HTTP status when one was received and any retry delay the provider advertised, so
 * classification does not depend on message wording alone.</p>
 */
public class ProviderCallException extends RuntimeException {

    /** Status value used when the failure happened before any HTTP response. */
    public static final int NO_STATUS = 0;

    private final String provider;
    private final int statusCode;
    private final Long retryAfterSeconds;

    public ProviderCallException(String provider, int statusCode, Long retryAfterSeconds, String message) {
        this(provider, statusCode, retryAfterSeconds, message, null);
    }

    public ProviderCallException(
            String provider, int statusCode, Long retryAfterSeconds, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public String provider() {
        return provider;
    }

    /**
     * Returns the upstream HTTP status, or {@link #NO_STATUS} for transport failures.
     */
    public int statusCode() {
        return statusCode;
    }

    public boolean hasStatus() {
        return statusCode != NO_STATUS;
    }

    /**
     * Returns the provider-advertised retry delay, when present.
     */
    public Optional<Duration> retryAfter() {
        return retryAfterSeconds == null || retryAfterSeconds < 0
                ? Optional.empty()
                : Optional.of(Duration.ofSeconds(retryAfterSeconds));
    }
}
