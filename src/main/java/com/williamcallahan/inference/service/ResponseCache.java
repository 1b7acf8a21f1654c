package com.williamcallahan.inference.service;

import com.williamcallahan.inference.config.AppProperties;
import com.williamcallahan.inference.support.CacheKeyHasher;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * TTL cache for provider responses keyed by provider, operation and normalized parameters.
 *
 * <p>Entries are kept in creation order; at capacity the oldest entry is evicted. An expired entry is never
 * returned but stays in memory until evicted or purged.</p>
 */
@Service
public class ResponseCache {
    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final boolean enabled;
    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;
    private final CacheKeyHasher keyHasher;

    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>();
    private long hits;
    private long misses;
    private long evictions;

    @Autowired
    public ResponseCache(AppProperties appProperties, Clock clock) {
        this(appProperties.getCache().isEnabled(),
                appProperties.getCache().getTtl(),
                appProperties.getCache().getMaxEntries(),
                new CacheKeyHasher(appProperties.getCache().getParamTruncationLength()),
                clock);
    }

    public ResponseCache(boolean enabled, Duration ttl, int maxEntries, CacheKeyHasher keyHasher, Clock clock) {
        this.enabled = enabled;
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.keyHasher = Objects.requireNonNull(keyHasher, "keyHasher");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.maxEntries = maxEntries;
    }

    /**
     * Looks up a fresh response.
     *
     * @param provider provider scope
     * @param method logical operation name
     * @param params request parameters
     * @return cached payload when present and not expired
     */
    public Optional<Object> get(String provider, String method, Object params) {
        if (!enabled) {
            return Optional.empty();
        }
        return getByKey(keyHasher.cacheKey(provider, method, params));
    }

    synchronized Optional<Object> getByKey(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null || !clock.instant().isBefore(entry.expiresAt())) {
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(entry.payload());
    }

    /**
     * Stores a response, evicting the oldest entries when the cache is full.
     */
    public void put(String provider, String method, Object params, Object payload) {
        if (!enabled || payload == null) {
            return;
        }
        String key = keyHasher.cacheKey(provider, method, params);
        Instant now = clock.instant();
        synchronized (this) {
            entries.remove(key);
            while (entries.size() >= maxEntries) {
                Iterator<String> oldest = entries.keySet().iterator();
                oldest.next();
                oldest.remove();
                evictions++;
            }
            entries.put(key, new CacheEntry(payload, now, now.plus(ttl)));
        }
    }

    /**
     * Removes expired entries.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        synchronized (this) {
            Iterator<Map.Entry<String, CacheEntry>> iterator = entries.entrySet().iterator();
            while (iterator.hasNext()) {
                if (!now.isBefore(iterator.next().getValue().expiresAt())) {
                    iterator.remove();
                    removed++;
                }
            }
            evictions += removed;
        }
        return removed;
    }

    @Scheduled(fixedDelayString = "${app.inference.cache.purge-interval:PT5M}")
    public void scheduledPurge() {
        int removed = purgeExpired();
        if (removed > 0) {
            log.debug("Purged {} expired cache entries", removed);
        }
    }

    public void clear() {
        int cleared;
        synchronized (this) {
            cleared = entries.size();
            entries.clear();
        }
        log.info("Response cache cleared ({} entries)", cleared);
    }

    /** Returns the number of physically stored entries, expired ones included. */
    public synchronized int size() {
        return entries.size();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public synchronized CacheStats stats() {
        return new CacheStats(enabled, entries.size(), maxEntries, hits, misses, evictions);
    }

    private record CacheEntry(Object payload, Instant createdAt, Instant expiresAt) {}

    /**
     * Counters of the response cache.
     *
     * @param enabled whether caching is active
     * @param size stored entries
     * @param maxEntries capacity
     * @param hits fresh lookups
     * @param misses absent or expired lookups
     * @param evictions entries removed by capacity or purge
     */
    public record CacheStats(boolean enabled, int size, int maxEntries, long hits, long misses, long evictions) {}
}
