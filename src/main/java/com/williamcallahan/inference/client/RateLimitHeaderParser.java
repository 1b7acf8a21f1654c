package com.williamcallahan.inference.client;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.function.LongFunction;
import org.springframework.http.HttpHeaders;

/**
 * Extracts a retry delay in seconds from upstream rate limit headers.
 *
 * <p>{@code Retry-After} (delta seconds or HTTP date) wins; otherwise {@code X-RateLimit-Reset} (epoch seconds)
 * and the OpenAI-style {@code x-ratelimit-reset-requests}/{@code -tokens} durations such as {@code 6m0s} or
 * {@code 250ms} are used. Unparseable values are ignored.</p>
 */
final class RateLimitHeaderParser {

    /**
     * Duration units with their conversion to a {@link Duration}, longest suffix first.
     */
    private enum DurationUnit {
        MILLISECONDS("ms", Duration::ofMillis),
        DAYS("d", Duration::ofDays),
        HOURS("h", Duration::ofHours),
        MINUTES("m", Duration::ofMinutes),
        SECONDS("s", Duration::ofSeconds);

        private final String suffix;
        private final LongFunction<Duration> toDuration;

        DurationUnit(String suffix, LongFunction<Duration> toDuration) {
            this.suffix = suffix;
            this.toDuration = toDuration;
        }
    }

    private final Clock clock;

    RateLimitHeaderParser(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the advertised retry delay in seconds, or null when no usable header is present.
     */
    Long retryAfterSeconds(HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        Long retryAfter = parseRetryAfter(headers.getFirst(HttpHeaders.RETRY_AFTER));
        if (retryAfter != null) {
            return retryAfter;
        }
        Long reset = parseEpochReset(headers.getFirst("X-RateLimit-Reset"));
        if (reset != null) {
            return reset;
        }
        long shortest = minPositive(
                parseDurationSeconds(headers.getFirst("x-ratelimit-reset-requests")),
                parseDurationSeconds(headers.getFirst("x-ratelimit-reset-tokens")));
        return shortest > 0 ? shortest : null;
    }

    Long parseRetryAfter(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return null;
        }
        String trimmed = rawValue.trim();
        if (isDigits(trimmed)) {
            return Long.parseLong(trimmed);
        }
        try {
            ZonedDateTime httpDate = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
            return Math.max(0, Duration.between(clock.instant(), httpDate.toInstant()).getSeconds());
        } catch (DateTimeParseException unparseable) {
            return null;
        }
    }

    Long parseEpochReset(String rawValue) {
        if (rawValue == null || !isDigits(rawValue.trim())) {
            return null;
        }
        long epochSeconds = Long.parseLong(rawValue.trim());
        Instant now = clock.instant();
        // small values are relative seconds rather than an epoch timestamp
        if (epochSeconds < now.getEpochSecond() / 2) {
            return epochSeconds;
        }
        return Math.max(0, epochSeconds - now.getEpochSecond());
    }

    long parseDurationSeconds(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return 0;
        }
        String remaining = rawValue.trim().toLowerCase(Locale.ROOT);
        if (isDigits(remaining)) {
            return Long.parseLong(remaining);
        }
        Duration total = Duration.ZERO;
        while (!remaining.isEmpty()) {
            int digitsEnd = 0;
            while (digitsEnd < remaining.length()
                    && (Character.isDigit(remaining.charAt(digitsEnd)) || remaining.charAt(digitsEnd) == '.')) {
                digitsEnd++;
            }
            if (digitsEnd == 0) {
                return 0;
            }
            String number = remaining.substring(0, digitsEnd);
            String rest = remaining.substring(digitsEnd);
            DurationUnit unit = null;
            for (DurationUnit candidate : DurationUnit.values()) {
                if (rest.startsWith(candidate.suffix)) {
                    unit = candidate;
                    break;
                }
            }
            if (unit == null) {
                return 0;
            }
            long wholeValue;
            try {
                wholeValue = (long) Math.ceil(Double.parseDouble(number));
            } catch (NumberFormatException unparseable) {
                return 0;
            }
            total = total.plus(unit.toDuration.apply(wholeValue));
            remaining = rest.substring(unit.suffix.length());
        }
        long seconds = total.getSeconds();
        return seconds == 0 && !total.isZero() ? 1 : seconds;
    }

    private static long minPositive(long... values) {
        long min = 0;
        for (long value : values) {
            if (value > 0 && (min == 0 || value < min)) {
                min = value;
            }
        }
        return min;
    }

    private static boolean isDigits(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int index = 0; index < value.length(); index++) {
            if (!Character.isDigit(value.charAt(index))) {
                return false;
            }
        }
        return true;
    }
}
