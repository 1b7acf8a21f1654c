package com.williamcallahan.inference.service;

import static com.williamcallahan.inference.service.TestCatalog.model;
import static com.williamcallahan.inference.service.TestCatalog.provider;
import static com.williamcallahan.inference.service.TestCatalog.providerWithKeys;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.inference.domain.failure.ErrorKind;
import com.williamcallahan.inference.support.MutableClock;
import java.time.Duration;
import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

/**
 * Verifies credential selection, rejection, resting windows and resets.
 */
class CredentialRotationTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
    private final ModelRegistry registry = TestCatalog.builder()
            .add(providerWithKeys("groq", 30, 1, "GROQ_API_KEY", "GROQ_API_KEY_2", "GROQ_API_KEY_3"),
                    model("groq", "groq-vision", 16384, 1))
            .add(provider("solo", 10, 100, 2), model("solo", "solo-text", 8192, 1))
            .build();
    private final CredentialRotation rotation = new CredentialRotation(registry, clock);

    @Test
    void activeCredential_startsAtFirstKey() {
        assertEquals(OptionalInt.of(0), rotation.activeCredential("groq"));
        assertEquals(OptionalInt.of(0), rotation.activeCredential("solo"));
        assertEquals(3, rotation.status("groq").count());
    }

    @Test
    void rotate_rejectsKeyAfterAuthenticationFailure() {
        assertTrue(rotation.rotate("groq", 0, ErrorKind.AUTHENTICATION, null));

        assertEquals(OptionalInt.of(1), rotation.activeCredential("groq"));
        assertEquals(List.of(0), rotation.status("groq").rejected());

        clock.advance(Duration.ofDays(1));
        assertEquals(OptionalInt.of(1), rotation.activeCredential("groq"));
    }

    @Test
    void rotate_restsRateLimitedKeyUntilWindowEnds() {
        assertTrue(rotation.rotate("groq", 0, ErrorKind.RATE_LIMIT, Duration.ofSeconds(30)));
        assertTrue(rotation.rotate("groq", 1, ErrorKind.RATE_LIMIT, Duration.ofSeconds(90)));

        assertEquals(OptionalInt.of(2), rotation.activeCredential("groq"));
        assertEquals(List.of(0, 1), rotation.status("groq").resting());

        clock.advance(Duration.ofSeconds(31));
        assertEquals(List.of(1), rotation.status("groq").resting());
        assertEquals(OptionalInt.of(2), rotation.activeCredential("groq"));
    }

    @Test
    void rotate_usesProviderCooldownWithoutWindow() {
        rotation.rotate("groq", 0, ErrorKind.QUOTA_EXCEEDED, null);

        clock.advance(Duration.ofSeconds(59));
        assertEquals(List.of(0), rotation.status("groq").resting());
        clock.advance(Duration.ofSeconds(2));
        assertTrue(rotation.status("groq").resting().isEmpty());
    }

    @Test
    void rotate_reportsFalseWhenNoOtherKeyIsUsable() {
        rotation.rotate("groq", 0, ErrorKind.AUTHENTICATION, null);
        rotation.rotate("groq", 1, ErrorKind.PAYMENT_REQUIRED, null);

        assertFalse(rotation.rotate("groq", 2, ErrorKind.AUTHENTICATION, null));
        assertEquals(OptionalInt.empty(), rotation.activeCredential("groq"));
        assertFalse(rotation.rotate("solo", 0, ErrorKind.RATE_LIMIT, Duration.ofSeconds(10)));
    }

    @Test
    void activeCredential_fallsBackToEarliestRestedKey() {
        rotation.rotate("groq", 0, ErrorKind.AUTHENTICATION, null);
        rotation.rotate("groq", 1, ErrorKind.RATE_LIMIT, Duration.ofSeconds(120));
        rotation.rotate("groq", 2, ErrorKind.RATE_LIMIT, Duration.ofSeconds(30));

        assertEquals(OptionalInt.of(2), rotation.activeCredential("groq"));
    }

    @Test
    void reset_returnsEveryKeyToRotation() {
        rotation.rotate("groq", 0, ErrorKind.AUTHENTICATION, null);
        rotation.rotate("groq", 1, ErrorKind.RATE_LIMIT, Duration.ofMinutes(5));

        rotation.reset("groq");

        assertEquals(OptionalInt.of(0), rotation.activeCredential("groq"));
        assertTrue(rotation.status("groq").rejected().isEmpty());
        assertTrue(rotation.status("groq").resting().isEmpty());
    }

    @Test
    void rejectsUnknownProviderAndCredential() {
        assertThrows(UnknownProviderException.class, () -> rotation.activeCredential("ghost"));
        assertThrows(IllegalArgumentException.class,
                () -> rotation.rotate("groq", 3, ErrorKind.AUTHENTICATION, null));
    }
}
