package com.williamcallahan.inference.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.williamcallahan.inference.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

/**
 * Covers header parsing behavior for upstream retry delays.
 */
class RateLimitHeaderParserTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
    private final RateLimitHeaderParser parser = new RateLimitHeaderParser(clock);

    @Test
    void parseRetryAfter_acceptsSecondsAndHttpDates() {
        assertEquals(120L, parser.parseRetryAfter("120"));
        assertEquals(90L, parser.parseRetryAfter("Sun, 01 Mar 2026 12:01:30 GMT"));
        assertNull(parser.parseRetryAfter("soon"));
        assertNull(parser.parseRetryAfter(" "));
    }

    @Test
    void parseEpochReset_handlesEpochAndRelativeValues() {
        long inFiveMinutes = clock.instant().getEpochSecond() + 300;

        assertEquals(300L, parser.parseEpochReset(Long.toString(inFiveMinutes)));
        assertEquals(45L, parser.parseEpochReset("45"));
        assertNull(parser.parseEpochReset("tomorrow"));
    }

    @Test
    void parseDurationSeconds_readsCompoundDurations() {
        assertEquals(360L, parser.parseDurationSeconds("6m0s"));
        assertEquals(1L, parser.parseDurationSeconds("250ms"));
        assertEquals(2L, parser.parseDurationSeconds("1.5s"));
        assertEquals(3600L, parser.parseDurationSeconds("1h"));
        assertEquals(0L, parser.parseDurationSeconds("later"));
    }

    @Test
    void retryAfterSeconds_prefersRetryAfterThenResetThenShortestWindow() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("x-ratelimit-reset-requests", "6m0s");
        headers.add("x-ratelimit-reset-tokens", "20s");
        assertEquals(20L, parser.retryAfterSeconds(headers));

        headers.add("X-RateLimit-Reset", "30");
        assertEquals(30L, parser.retryAfterSeconds(headers));

        headers.add(HttpHeaders.RETRY_AFTER, "7");
        assertEquals(7L, parser.retryAfterSeconds(headers));

        assertNull(parser.retryAfterSeconds(new HttpHeaders()));
        assertNull(parser.retryAfterSeconds(null));
    }
}
