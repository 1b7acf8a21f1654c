package com.williamcallahan.inference.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.inference.service.ProviderCircuitBreaker.State;
import com.williamcallahan.inference.support.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * Verifies breaker transitions and the single half-open trial.
 */
class ProviderCircuitBreakerTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
    private final ProviderCircuitBreaker breaker =
            new ProviderCircuitBreaker("alpha", 3, Duration.ofSeconds(60), clock);

    @Test
    void opensAtFailureThreshold() {
        assertEquals(State.CLOSED, breaker.recordFailure());
        assertEquals(State.CLOSED, breaker.recordFailure());
        assertTrue(breaker.canAttempt());

        assertEquals(State.OPEN, breaker.recordFailure());
        assertFalse(breaker.canAttempt());
        assertEquals(Duration.ofSeconds(60), breaker.remainingOpenTime());
    }

    @Test
    void successResetsFailureCount() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();

        assertEquals(State.CLOSED, breaker.state());
        assertEquals(1, breaker.failureCount());
    }

    @Test
    void admitsExactlyOneTrialAfterRecoveryTimeout() {
        tripOpen();
        clock.advance(Duration.ofSeconds(61));

        assertTrue(breaker.canAttempt());
        assertEquals(State.HALF_OPEN, breaker.state());
        assertFalse(breaker.canAttempt());
    }

    @Test
    void failedTrialReopensCircuit() {
        tripOpen();
        clock.advance(Duration.ofSeconds(61));
        breaker.canAttempt();

        assertEquals(State.OPEN, breaker.recordFailure());
        assertFalse(breaker.canAttempt());
    }

    @Test
    void successfulTrialClosesCircuit() {
        tripOpen();
        clock.advance(Duration.ofSeconds(61));
        breaker.canAttempt();

        breaker.recordSuccess();

        assertEquals(State.CLOSED, breaker.state());
        assertEquals(0, breaker.failureCount());
        assertTrue(breaker.canAttempt());
        assertEquals(Duration.ZERO, breaker.remainingOpenTime());
    }

    @Test
    void releasedTrialCanBeRetaken() {
        tripOpen();
        clock.advance(Duration.ofSeconds(61));
        breaker.canAttempt();

        breaker.releaseTrial();

        assertEquals(State.HALF_OPEN, breaker.state());
        assertTrue(breaker.canAttempt());
    }

    @Test
    void staysOpenUntilRecoveryTimeoutHasStrictlyElapsed() {
        tripOpen();
        clock.advance(Duration.ofSeconds(60));

        assertFalse(breaker.canAttempt());
    }

    @Test
    void resetClosesCircuit() {
        tripOpen();

        breaker.reset();

        assertEquals(State.CLOSED, breaker.state());
        assertTrue(breaker.canAttempt());
    }

    private void tripOpen() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordFailure();
    }
}
