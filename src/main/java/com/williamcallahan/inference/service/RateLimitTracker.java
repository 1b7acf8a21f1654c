package com.williamcallahan.inference.service;

import com.williamcallahan.inference.domain.ModelCandidate;
import com.williamcallahan.inference.domain.ProviderConfig;
import com.williamcallahan.inference.support.AsciiTextNormalizer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sliding-window admission control per provider/model pair.
 *
 * <p>Each pair keeps the timestamps of its completed requests for the trailing day. A pair is admitted
 * while it is under its per-minute and per-day limits and outside any explicit rate-limited window.
 * Every window is guarded by its own monitor so concurrent requests on different models never contend.</p>
 */
@Service
public class RateLimitTracker {
    private static final Logger log = LoggerFactory.getLogger(RateLimitTracker.class);

    static final Duration MINUTE_WINDOW = Duration.ofSeconds(60);
    static final Duration DAY_WINDOW = Duration.ofHours(24);
    static final Duration BURST_WINDOW = Duration.ofSeconds(1);

    private static final Pattern DAILY_LIMIT_PATTERN = Pattern.compile("\\bdaily\\b|\\bper\\s+day\\b|\\bday\\b|\\bdays\\b");

    private final ModelRegistry registry;
    private final Clock clock;
    private final Map<String, UsageWindow> windows = new ConcurrentHashMap<>();

    public RateLimitTracker(ModelRegistry registry, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Decides whether one more request may be sent to the model right now.
     *
     * @param provider provider name
     * @param model model identifier
     * @return true when the pair is under all of its limits and not rate limited
     * @throws IllegalArgumentException when the pair is not in the catalogue
     */
    public boolean admit(String provider, String model) {
        ModelCandidate candidate = resolve(provider, model);
        Instant now = clock.instant();
        UsageWindow window = window(provider, model);
        synchronized (window) {
            return isAdmissible(window, candidate, now);
        }
    }

    /**
     * Admits and reserves a slot in one step so concurrent callers cannot overrun the limits.
     *
     * <p>The reserved timestamp counts toward the windows immediately; finish the request with
     * {@link #complete(String, String, boolean)} rather than {@link #record(String, String, boolean)}.</p>
     *
     * @return true when the request was admitted and counted
     */
    public boolean tryAcquire(String provider, String model) {
        ModelCandidate candidate = resolve(provider, model);
        Instant now = clock.instant();
        UsageWindow window = window(provider, model);
        synchronized (window) {
            if (!isAdmissible(window, candidate, now)) {
                return false;
            }
            window.timestamps.addLast(now);
            return true;
        }
    }

    /**
     * Updates the outcome totals of a request previously reserved with {@link #tryAcquire(String, String)}.
     */
    public void complete(String provider, String model, boolean success) {
        resolve(provider, model);
        UsageWindow window = window(provider, model);
        synchronized (window) {
            window.countOutcome(success);
        }
    }

    private boolean isAdmissible(UsageWindow window, ModelCandidate candidate, Instant now) {
        String provider = candidate.providerName();
        String model = candidate.modelId();
        window.prune(now);
        if (window.rateLimitedUntil != null && now.isBefore(window.rateLimitedUntil)) {
            log.debug("[{}] {} rate limited until {}", provider, model, window.rateLimitedUntil);
            return false;
        }
        int perMinute = candidate.model().effectiveRequestsPerMinute(candidate.provider());
        if (window.countSince(now.minus(MINUTE_WINDOW)) >= perMinute) {
            log.debug("[{}] {} reached {} requests per minute", provider, model, perMinute);
            return false;
        }
        int perDay = candidate.model().effectiveRequestsPerDay(candidate.provider());
        if (window.timestamps.size() >= perDay) {
            log.debug("[{}] {} reached {} requests per day", provider, model, perDay);
            return false;
        }
        int burstLimit = candidate.provider().burstLimit();
        if (burstLimit > 0 && window.countSince(now.minus(BURST_WINDOW)) >= burstLimit) {
            log.debug("[{}] {} reached burst limit {}", provider, model, burstLimit);
            return false;
        }
        return true;
    }

    /**
     * Records one completed request against the pair's windows.
     *
     * @param provider provider name
     * @param model model identifier
     * @param success whether the upstream call produced a result
     */
    public void record(String provider, String model, boolean success) {
        resolve(provider, model);
        Instant now = clock.instant();
        UsageWindow window = window(provider, model);
        synchronized (window) {
            window.timestamps.addLast(now);
            window.countOutcome(success);
        }
    }

    /**
     * Blocks admission for the pair until the reset window elapses, independent of the counters.
     *
     * <p>An existing later deadline is kept so a per-minute limit never shortens a daily one.</p>
     *
     * @param provider provider name
     * @param model model identifier
     * @param resetSeconds seconds until the upstream accepts requests again
     * @return the effective rate-limited-until instant
     */
    public Instant markLimited(String provider, String model, long resetSeconds) {
        resolve(provider, model);
        if (resetSeconds < 0) {
            throw new IllegalArgumentException("resetSeconds must be non-negative");
        }
        Instant until = clock.instant().plusSeconds(resetSeconds);
        UsageWindow window = window(provider, model);
        synchronized (window) {
            if (window.rateLimitedUntil == null || until.isAfter(window.rateLimitedUntil)) {
                window.rateLimitedUntil = until;
            }
            log.warn("[{}] {} marked rate limited until {}", provider, model, window.rateLimitedUntil);
            return window.rateLimitedUntil;
        }
    }

    /**
     * Infers how long a rate limit lasts from the upstream error text.
     *
     * @param errorText upstream failure message
     * @param provider provider whose cooldown applies to per-minute limits
     * @return one day for daily quota phrasing, otherwise the provider cooldown
     */
    public Duration resetWindowFor(String errorText, ProviderConfig provider) {
        Objects.requireNonNull(provider, "provider");
        String normalized = AsciiTextNormalizer.toLowerAscii(errorText);
        if (DAILY_LIMIT_PATTERN.matcher(normalized).find()) {
            return DAY_WINDOW;
        }
        return provider.cooldown();
    }

    /**
     * Returns the remaining rate-limited time for the pair, zero when admission is not blocked explicitly.
     */
    public Duration remainingLimit(String provider, String model) {
        Instant now = clock.instant();
        UsageWindow window = windows.get(key(provider, model));
        if (window == null) {
            return Duration.ZERO;
        }
        synchronized (window) {
            if (window.rateLimitedUntil == null || !now.isBefore(window.rateLimitedUntil)) {
                return Duration.ZERO;
            }
            return Duration.between(now, window.rateLimitedUntil);
        }
    }

    /**
     * Captures the current counters of one pair.
     */
    public UsageSnapshot snapshot(String provider, String model) {
        ModelCandidate candidate = resolve(provider, model);
        Instant now = clock.instant();
        UsageWindow window = window(provider, model);
        synchronized (window) {
            window.prune(now);
            Instant limitedUntil = window.rateLimitedUntil != null && now.isBefore(window.rateLimitedUntil)
                    ? window.rateLimitedUntil
                    : null;
            return new UsageSnapshot(
                    provider,
                    model,
                    window.countSince(now.minus(MINUTE_WINDOW)),
                    window.timestamps.size(),
                    candidate.model().effectiveRequestsPerMinute(candidate.provider()),
                    candidate.model().effectiveRequestsPerDay(candidate.provider()),
                    limitedUntil,
                    window.successCount,
                    window.failureCount);
        }
    }

    /**
     * Captures every model of a provider in catalogue order.
     */
    public List<UsageSnapshot> snapshots(String provider) {
        List<UsageSnapshot> snapshots = new ArrayList<>();
        registry.models(provider).forEach(model -> snapshots.add(snapshot(provider, model.modelId())));
        return snapshots;
    }

    /**
     * Clears counters and rate-limited windows of every model of a provider.
     */
    public void reset(String provider) {
        String prefix = provider + "\u0000";
        windows.keySet().removeIf(key -> key.startsWith(prefix));
        log.info("[{}] Rate limit windows reset", provider);
    }

    public void resetAll() {
        windows.clear();
        log.info("All rate limit windows reset");
    }

    private ModelCandidate resolve(String provider, String model) {
        return registry.candidate(provider, model)
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider/model: " + provider + "/" + model));
    }

    private UsageWindow window(String provider, String model) {
        return windows.computeIfAbsent(key(provider, model), ignored -> new UsageWindow());
    }

    private static String key(String provider, String model) {
        return provider + "\u0000" + model;
    }

    /**
     * Point-in-time view of one provider/model pair.
     *
     * @param provider provider name
     * @param model model identifier
     * @param requestsLastMinute requests completed in the trailing minute
     * @param requestsLastDay requests completed in the trailing day
     * @param requestsPerMinuteLimit effective per-minute limit
     * @param requestsPerDayLimit effective per-day limit
     * @param rateLimitedUntil explicit block deadline, null when not blocked
     * @param successCount cumulative successful requests
     * @param failureCount cumulative failed requests
     */
    public record UsageSnapshot(
            String provider,
            String model,
            int requestsLastMinute,
            int requestsLastDay,
            int requestsPerMinuteLimit,
            int requestsPerDayLimit,
            Instant rateLimitedUntil,
            long successCount,
            long failureCount) {}

    private static final class UsageWindow {
        private final Deque<Instant> timestamps = new ArrayDeque<>();
        private Instant rateLimitedUntil;
        private long successCount;
        private long failureCount;

        void prune(Instant now) {
            Instant cutoff = now.minus(DAY_WINDOW);
            while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
                timestamps.removeFirst();
            }
        }

        void countOutcome(boolean success) {
            if (success) {
                successCount++;
            } else {
                failureCount++;
            }
        }

        int countSince(Instant cutoff) {
            int count = 0;
            Iterator<Instant> newestFirst = timestamps.descendingIterator();
            while (newestFirst.hasNext()) {
                if (!newestFirst.next().isAfter(cutoff)) {
                    break;
                }
                count++;
            }
            return count;
        }
    }
}
