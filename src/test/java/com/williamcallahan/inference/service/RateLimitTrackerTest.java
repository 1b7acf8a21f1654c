package com.williamcallahan.inference.service;

import static com.williamcallahan.inference.service.TestCatalog.model;
import static com.williamcallahan.inference.service.TestCatalog.provider;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.inference.domain.ModelConfig;
import com.williamcallahan.inference.domain.ProviderConfig;
import com.williamcallahan.inference.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

/**
 * Verifies sliding-window admission, explicit rate-limited windows and atomic reservations.
 */
class RateLimitTrackerTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T12:00:00Z");

    private RateLimitTracker trackerFor(ProviderConfig provider, ModelConfig... models) {
        return new RateLimitTracker(TestCatalog.builder().add(provider, models).build(), clock);
    }

    @Test
    void admit_rejectsOnceMinuteLimitIsReached() {
        RateLimitTracker tracker = trackerFor(provider("alpha", 3, 100, 1), model("alpha", "m", 8192, 1));

        for (int request = 0; request < 3; request++) {
            assertTrue(tracker.admit("alpha", "m"));
            tracker.record("alpha", "m", true);
        }

        assertFalse(tracker.admit("alpha", "m"));
        clock.advance(Duration.ofSeconds(61));
        assertTrue(tracker.admit("alpha", "m"));
    }

    @Test
    void admit_rejectsOnceDayLimitIsReached() {
        RateLimitTracker tracker = trackerFor(provider("alpha", 100, 2, 1), model("alpha", "m", 8192, 1));

        tracker.record("alpha", "m", true);
        clock.advance(Duration.ofHours(1));
        tracker.record("alpha", "m", false);
        clock.advance(Duration.ofHours(1));

        assertFalse(tracker.admit("alpha", "m"));
        clock.advance(Duration.ofHours(22).plusSeconds(1));
        assertTrue(tracker.admit("alpha", "m"));
    }

    @Test
    void admit_usesModelLimitsOverProviderLimits() {
        ModelConfig tightModel = new ModelConfig("tight", "alpha", 8192, Set.of(), 1, 0, 1);
        RateLimitTracker tracker = trackerFor(provider("alpha", 50, 100, 1), tightModel);

        tracker.record("alpha", "tight", true);

        assertFalse(tracker.admit("alpha", "tight"));
    }

    @Test
    void admit_respectsBurstLimit() {
        RateLimitTracker tracker = trackerFor(
                provider("alpha", 100, 1, Duration.ofMinutes(1), 2), model("alpha", "m", 8192, 1));

        tracker.record("alpha", "m", true);
        tracker.record("alpha", "m", true);

        assertFalse(tracker.admit("alpha", "m"));
        clock.advance(Duration.ofMillis(1500));
        assertTrue(tracker.admit("alpha", "m"));
    }

    @Test
    void markLimited_blocksUntilWindowElapsesAndKeepsLaterDeadline() {
        RateLimitTracker tracker = trackerFor(provider("alpha", 100, 1000, 1), model("alpha", "m", 8192, 1));
        Instant start = clock.instant();

        Instant dailyDeadline = tracker.markLimited("alpha", "m", 3600);
        Instant kept = tracker.markLimited("alpha", "m", 60);

        assertEquals(start.plusSeconds(3600), dailyDeadline);
        assertEquals(dailyDeadline, kept);
        assertFalse(tracker.admit("alpha", "m"));
        assertEquals(Duration.ofSeconds(3600), tracker.remainingLimit("alpha", "m"));

        clock.advance(Duration.ofSeconds(3600));
        assertTrue(tracker.admit("alpha", "m"));
        assertEquals(Duration.ZERO, tracker.remainingLimit("alpha", "m"));
    }

    @Test
    void resetWindowFor_distinguishesDailyQuotasFromMinuteLimits() {
        ProviderConfig provider = provider("alpha", 10, 1, Duration.ofSeconds(90), 0);
        RateLimitTracker tracker = trackerFor(provider, model("alpha", "m", 8192, 1));

        assertEquals(Duration.ofHours(24), tracker.resetWindowFor("Daily quota exceeded for model", provider));
        assertEquals(Duration.ofHours(24), tracker.resetWindowFor("limit of 50 requests per day", provider));
        assertEquals(Duration.ofSeconds(90), tracker.resetWindowFor("429 Too Many Requests", provider));
        assertEquals(Duration.ofSeconds(90), tracker.resetWindowFor(null, provider));
    }

    @Test
    void tryAcquire_reservesSlotImmediately() {
        RateLimitTracker tracker = trackerFor(provider("alpha", 2, 100, 1), model("alpha", "m", 8192, 1));

        assertTrue(tracker.tryAcquire("alpha", "m"));
        assertTrue(tracker.tryAcquire("alpha", "m"));
        assertFalse(tracker.tryAcquire("alpha", "m"));

        tracker.complete("alpha", "m", true);
        tracker.complete("alpha", "m", false);
        RateLimitTracker.UsageSnapshot snapshot = tracker.snapshot("alpha", "m");
        assertEquals(2, snapshot.requestsLastMinute());
        assertEquals(2, snapshot.requestsLastDay());
        assertEquals(1, snapshot.successCount());
        assertEquals(1, snapshot.failureCount());
        assertNull(snapshot.rateLimitedUntil());
    }

    @Test
    void tryAcquire_neverAdmitsMoreThanTheLimitUnderContention() throws Exception {
        RateLimitTracker tracker = trackerFor(provider("alpha", 5, 100, 1), model("alpha", "m", 8192, 1));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch startGate = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int caller = 0; caller < 40; caller++) {
                Callable<Boolean> acquire = () -> {
                    startGate.await();
                    return tracker.tryAcquire("alpha", "m");
                };
                results.add(executor.submit(acquire));
            }
            startGate.countDown();
            int admitted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    admitted++;
                }
            }
            assertEquals(5, admitted);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void reset_clearsCountersAndWindows() {
        RateLimitTracker tracker = trackerFor(provider("alpha", 1, 100, 1), model("alpha", "m", 8192, 1));
        tracker.record("alpha", "m", true);
        tracker.markLimited("alpha", "m", 600);

        tracker.reset("alpha");

        assertTrue(tracker.admit("alpha", "m"));
        assertEquals(0, tracker.snapshots("alpha").get(0).successCount());
    }

    @Test
    void unknownPairIsRejected() {
        RateLimitTracker tracker = trackerFor(provider("alpha", 1, 100, 1), model("alpha", "m", 8192, 1));

        assertThrows(IllegalArgumentException.class, () -> tracker.admit("alpha", "missing"));
        assertThrows(IllegalArgumentException.class, () -> tracker.record("ghost", "m", true));
    }
}
