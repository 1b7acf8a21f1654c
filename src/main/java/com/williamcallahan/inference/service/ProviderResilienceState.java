package com.williamcallahan.inference.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Breaker and backoff state owned by one provider.
 *
 * <p>The backoff window opens at a failure and lasts for the provider's retry hint or its next backoff delay.
 * A success closes it and restarts the backoff sequence.</p>
 */
final class ProviderResilienceState {

    private final ProviderCircuitBreaker breaker;
    private final ExponentialBackoff backoff;
    private final Clock clock;

    private Instant backoffUntil;

    ProviderResilienceState(ProviderCircuitBreaker breaker, ExponentialBackoff backoff, Clock clock) {
        this.breaker = Objects.requireNonNull(breaker, "breaker");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    ProviderCircuitBreaker breaker() {
        return breaker;
    }

    synchronized void recordSuccess() {
        breaker.recordSuccess();
        backoff.reset();
        backoffUntil = null;
    }

    /**
     * Opens a backoff window starting now.
     *
     * @param retryAfterHint explicit delay from the provider, or null to use the next backoff delay
     * @return length of the window
     */
    synchronized Duration openBackoffWindow(Duration retryAfterHint) {
        Duration window = retryAfterHint != null && !retryAfterHint.isZero() && !retryAfterHint.isNegative()
                ? retryAfterHint
                : backoff.nextDelay();
        Instant until = clock.instant().plus(window);
        if (backoffUntil == null || until.isAfter(backoffUntil)) {
            backoffUntil = until;
        }
        return window;
    }

    /**
     * Returns the remaining backoff time, zero when no window is open.
     */
    synchronized Duration remainingBackoff() {
        if (backoffUntil == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), backoffUntil);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    synchronized Instant backoffUntil() {
        return backoffUntil;
    }

    synchronized int backoffAttempt() {
        return backoff.attempt();
    }

    synchronized void reset() {
        breaker.reset();
        backoff.reset();
        backoffUntil = null;
    }
}
