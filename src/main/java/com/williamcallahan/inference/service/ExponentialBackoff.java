package com.williamcallahan.inference.service;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Exponential backoff with optional uniform jitter of plus or minus 25 percent.
 *
 * <p>Each {@link #nextDelay()} call advances the attempt counter; {@link #reset()} restarts the sequence.
 * Delays never drop below {@link #MIN_DELAY}.</p>
 */
public final class ExponentialBackoff {

    static final Duration MIN_DELAY = Duration.ofMillis(100);
    private static final double JITTER_FRACTION = 0.25;

    private final Duration base;
    private final double multiplier;
    private final Duration max;
    private final Random random;

    private int attempt;

    /**
     * Creates a backoff without jitter.
     */
    public ExponentialBackoff(Duration base, double multiplier, Duration max) {
        this(base, multiplier, max, null);
    }

    /**
     * Creates a backoff.
     *
     * @param base first delay
     * @param multiplier growth factor per attempt, at least 1
     * @param max ceiling before jitter
     * @param random jitter source, or null to disable jitter
     */
    public ExponentialBackoff(Duration base, double multiplier, Duration max, Random random) {
        this.base = Objects.requireNonNull(base, "base");
        this.max = Objects.requireNonNull(max, "max");
        if (base.isNegative() || base.isZero() || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("Backoff requires 0 < base <= max");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        this.multiplier = multiplier;
        this.random = random;
    }

    /**
     * Returns the delay for the current attempt and advances the counter.
     */
    public synchronized Duration nextDelay() {
        double baseMillis = base.toMillis();
        double uncapped = baseMillis * Math.pow(multiplier, attempt);
        double capped = Math.min(uncapped, max.toMillis());
        attempt++;
        if (random != null) {
            capped += capped * JITTER_FRACTION * (random.nextDouble() * 2.0 - 1.0);
        }
        long delayMillis = Math.max(MIN_DELAY.toMillis(), Math.round(capped));
        return Duration.ofMillis(delayMillis);
    }

    public synchronized int attempt() {
        return attempt;
    }

    public synchronized void reset() {
        attempt = 0;
    }
}
