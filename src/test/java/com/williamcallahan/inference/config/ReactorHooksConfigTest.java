package com.williamcallahan.inference.config;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.InterruptedIOException;
import org.junit.jupiter.api.Test;

/**
 * Verifies which dropped errors count as abandoned provider attempts.
 */
class ReactorHooksConfigTest {

    @Test
    void recognizesInterruptsAnywhereInCauseChain() {
        assertTrue(ReactorHooksConfig.isAbandonedAttemptError(new InterruptedException("sleep interrupted")));
        assertTrue(ReactorHooksConfig.isAbandonedAttemptError(
                new IllegalStateException("read failed", new InterruptedIOException())));
        assertTrue(ReactorHooksConfig.isAbandonedAttemptError(new RuntimeException("Thread was interrupted")));
    }

    @Test
    void treatsOtherErrorsAsUnexpected() {
        assertFalse(ReactorHooksConfig.isAbandonedAttemptError(new IllegalStateException("boom")));
        assertFalse(ReactorHooksConfig.isAbandonedAttemptError(new RuntimeException()));
    }
}
