package com.williamcallahan.inference.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Circuit breaker for one provider.
 *
 * <p>CLOSED admits everything. After {@code failureThreshold} consecutive failures the circuit opens and
 * rejects calls until the recovery timeout has elapsed since the last failure; the next attempt then moves
 * it to HALF_OPEN and becomes the single trial. That trial's outcome closes or reopens the circuit.</p>
 */
public final class ProviderCircuitBreaker {

    /** Breaker states. */
    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String provider;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    private State state = State.CLOSED;
    private int failureCount;
    private Instant lastFailureTime;
    private Instant lastSuccessTime;
    private boolean trialInFlight;

    public ProviderCircuitBreaker(String provider, int failureThreshold, Duration recoveryTimeout, Clock clock) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.recoveryTimeout = Objects.requireNonNull(recoveryTimeout, "recoveryTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        this.failureThreshold = failureThreshold;
    }

    /**
     * Decides whether a call may be sent now.
     *
     * <p>Returning true from OPEN or HALF_OPEN reserves the single trial; the caller must resolve it with
     * {@link #recordSuccess()} or {@link #recordFailure()}.</p>
     *
     * @return true when the call may proceed
     */
    public synchronized boolean canAttempt() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (Duration.between(lastFailureTime, clock.instant()).compareTo(recoveryTimeout) > 0) {
                    state = State.HALF_OPEN;
                    trialInFlight = true;
                    return true;
                }
                return false;
            case HALF_OPEN:
                if (trialInFlight) {
                    return false;
                }
                trialInFlight = true;
                return true;
            default:
                throw new IllegalStateException("Unexpected breaker state " + state);
        }
    }

    /**
     * Resets the failure count and closes the circuit.
     */
    public synchronized void recordSuccess() {
        failureCount = 0;
        state = State.CLOSED;
        trialInFlight = false;
        lastSuccessTime = clock.instant();
    }

    /**
     * Counts a failure; opens the circuit at the threshold or when the half-open trial fails.
     *
     * @return the state after the failure
     */
    public synchronized State recordFailure() {
        failureCount++;
        lastFailureTime = clock.instant();
        trialInFlight = false;
        if (state == State.HALF_OPEN || failureCount >= failureThreshold) {
            state = State.OPEN;
        }
        return state;
    }

    /**
     * Releases a reserved half-open trial that ended without a provider verdict, such as a caller error, a
     * cancelled call or a failure blamed on the credential.
     */
    public synchronized void releaseTrial() {
        trialInFlight = false;
    }

    public synchronized void reset() {
        state = State.CLOSED;
        failureCount = 0;
        lastFailureTime = null;
        lastSuccessTime = null;
        trialInFlight = false;
    }

    public synchronized State state() {
        return state;
    }

    public synchronized int failureCount() {
        return failureCount;
    }

    public synchronized Instant lastFailureTime() {
        return lastFailureTime;
    }

    public synchronized Instant lastSuccessTime() {
        return lastSuccessTime;
    }

    /**
     * Returns the time until an open circuit admits its trial, zero when not open.
     */
    public synchronized Duration remainingOpenTime() {
        if (state != State.OPEN || lastFailureTime == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), lastFailureTime.plus(recoveryTimeout));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public String provider() {
        return provider;
    }
}
