package com.williamcallahan.inference.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * Verifies app property validation for resilience settings.
 */
class AppPropertiesValidationTest {

    @Test
    void acceptsDefaults() {
        assertDoesNotThrow(new AppProperties()::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveCacheCapacity() {
        AppProperties appProperties = new AppProperties();
        appProperties.getCache().setMaxEntries(0);

        assertThrows(IllegalStateException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsBackoffBaseAboveMax() {
        AppProperties appProperties = new AppProperties();
        appProperties.getBackoff().setBase(Duration.ofMinutes(5));

        assertThrows(IllegalStateException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsZeroBreakerRecoveryTimeout() {
        AppProperties appProperties = new AppProperties();
        appProperties.getBreaker().setRecoveryTimeout(Duration.ZERO);

        assertThrows(IllegalStateException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNegativeTruncationLength() {
        AppProperties appProperties = new AppProperties();
        appProperties.getCache().setParamTruncationLength(-1);

        assertThrows(IllegalStateException.class, appProperties::validateConfiguration);
    }

    @Test
    void allowsZeroMaxBackoffWait() {
        AppProperties appProperties = new AppProperties();
        appProperties.getOrchestrator().setMaxBackoffWait(Duration.ZERO);

        assertDoesNotThrow(appProperties::validateConfiguration);
    }
}
