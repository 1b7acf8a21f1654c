package com.williamcallahan.inference.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Random;
import org.junit.jupiter.api.Test;

/**
 * Verifies exponential growth, capping, reset and jitter bounds.
 */
class ExponentialBackoffTest {

    @Test
    void doublesUntilCapped() {
        ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(10));

        assertEquals(Duration.ofSeconds(1), backoff.nextDelay());
        assertEquals(Duration.ofSeconds(2), backoff.nextDelay());
        assertEquals(Duration.ofSeconds(4), backoff.nextDelay());
        assertEquals(Duration.ofSeconds(8), backoff.nextDelay());
        assertEquals(Duration.ofSeconds(10), backoff.nextDelay());
        assertEquals(Duration.ofSeconds(10), backoff.nextDelay());
        assertEquals(6, backoff.attempt());
    }

    @Test
    void resetRestartsSequence() {
        ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(60));
        backoff.nextDelay();
        backoff.nextDelay();

        backoff.reset();

        assertEquals(0, backoff.attempt());
        assertEquals(Duration.ofSeconds(1), backoff.nextDelay());
    }

    @Test
    void jitterStaysWithinQuarterOfNominalDelay() {
        ExponentialBackoff backoff =
                new ExponentialBackoff(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(60), new Random(42));

        for (int attempt = 0; attempt < 12; attempt++) {
            long nominalMillis = Math.min(1000L << attempt, 60_000L);
            long delayMillis = backoff.nextDelay().toMillis();
            assertTrue(delayMillis >= nominalMillis * 0.75 - 1, "attempt " + attempt + " was " + delayMillis);
            assertTrue(delayMillis <= nominalMillis * 1.25 + 1, "attempt " + attempt + " was " + delayMillis);
        }
    }

    @Test
    void neverDropsBelowMinimumDelay() {
        ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofMillis(10), 1.0, Duration.ofMillis(10));

        assertEquals(ExponentialBackoff.MIN_DELAY, backoff.nextDelay());
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoff(Duration.ZERO, 2.0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoff(Duration.ofSeconds(5), 2.0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoff(Duration.ofSeconds(1), 0.5, Duration.ofSeconds(10)));
    }
}
