package com.williamcallahan.inference.service;

import com.williamcallahan.inference.config.AppProperties;
import com.williamcallahan.inference.domain.failure.ErrorClassification;
import com.williamcallahan.inference.domain.failure.ErrorKind;
import com.williamcallahan.inference.domain.failure.ErrorRecord;
import com.williamcallahan.inference.domain.failure.ErrorSeverity;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Bounded history of classified provider failures with per-provider and per-credential counters.
 *
 * <p>All state is guarded by this instance's monitor.</p>
 */
@Service
public class ErrorHistory {
    private static final Logger log = LoggerFactory.getLogger(ErrorHistory.class);

    static final int RECENT_ERROR_COUNT = 10;

    private final int capacity;
    private final Clock clock;
    private final Deque<ErrorRecord> records = new ArrayDeque<>();
    private final Map<String, Map<ErrorKind, Integer>> providerCounts = new LinkedHashMap<>();
    private final Map<CredentialKey, Map<ErrorKind, Integer>> credentialCounts = new LinkedHashMap<>();

    @Autowired
    public ErrorHistory(AppProperties appProperties, Clock clock) {
        this(appProperties.getErrors().getHistoryCapacity(), clock);
    }

    public ErrorHistory(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Appends a failure, updates counters and logs it at a level matching its severity.
     *
     * @param provider provider that failed
     * @param keyIndex credential index, 0 for single-key providers
     * @param classification classified failure
     * @return the stored record
     */
    public ErrorRecord record(String provider, int keyIndex, ErrorClassification classification) {
        Objects.requireNonNull(classification, "classification");
        ErrorRecord errorRecord = new ErrorRecord(
                clock.instant(),
                classification.kind(),
                classification.severity(),
                provider,
                keyIndex,
                classification.message());
        synchronized (this) {
            records.addLast(errorRecord);
            while (records.size() > capacity) {
                records.removeFirst();
            }
            if (!errorRecord.provider().isEmpty()) {
                increment(providerCounts.computeIfAbsent(errorRecord.provider(), ignored -> new EnumMap<>(ErrorKind.class)),
                        errorRecord.kind());
            }
            increment(credentialCounts.computeIfAbsent(
                            new CredentialKey(errorRecord.provider(), keyIndex), ignored -> new EnumMap<>(ErrorKind.class)),
                    errorRecord.kind());
        }
        logRecord(errorRecord);
        return errorRecord;
    }

    private static void increment(Map<ErrorKind, Integer> counts, ErrorKind kind) {
        counts.merge(kind, 1, Integer::sum);
    }

    private static void logRecord(ErrorRecord errorRecord) {
        switch (errorRecord.severity()) {
            case CRITICAL -> log.error("[{}] CRITICAL {} error: {}",
                    errorRecord.provider(), errorRecord.kind(), errorRecord.message());
            case HIGH -> log.warn("[{}] HIGH {} error: {}",
                    errorRecord.provider(), errorRecord.kind(), errorRecord.message());
            default -> log.info("[{}] {} {} error: {}",
                    errorRecord.provider(), errorRecord.severity(), errorRecord.kind(), errorRecord.message());
        }
    }

    /**
     * Advises moving away from a provider after repeated credential-fatal or quota failures.
     *
     * @return true after two authentication/payment failures or five rate-limit/quota failures
     */
    public synchronized boolean shouldSwitchProvider(String provider) {
        Map<ErrorKind, Integer> counts = providerCounts.get(provider);
        if (counts == null) {
            return false;
        }
        int critical = count(counts, ErrorKind.AUTHENTICATION) + count(counts, ErrorKind.PAYMENT_REQUIRED);
        if (critical >= 2) {
            return true;
        }
        return count(counts, ErrorKind.RATE_LIMIT) + count(counts, ErrorKind.QUOTA_EXCEEDED) >= 5;
    }

    /**
     * Advises rotating a credential after any authentication failure or three quota failures.
     */
    public synchronized boolean shouldSwitchCredential(String provider, int keyIndex) {
        Map<ErrorKind, Integer> counts = credentialCounts.get(new CredentialKey(provider, keyIndex));
        if (counts == null) {
            return false;
        }
        return count(counts, ErrorKind.AUTHENTICATION) >= 1 || count(counts, ErrorKind.QUOTA_EXCEEDED) >= 3;
    }

    /**
     * Returns the error counts of a provider by kind.
     */
    public synchronized Map<ErrorKind, Integer> providerErrorCounts(String provider) {
        Map<ErrorKind, Integer> counts = providerCounts.get(provider);
        return counts == null ? Map.of() : Map.copyOf(counts);
    }

    /**
     * Summarizes the history: totals by kind, severity and provider, recent errors and provider health.
     */
    public synchronized ErrorStatistics statistics() {
        Map<ErrorKind, Integer> byKind = new EnumMap<>(ErrorKind.class);
        Map<ErrorSeverity, Integer> bySeverity = new EnumMap<>(ErrorSeverity.class);
        Map<String, Integer> byProvider = new LinkedHashMap<>();
        for (ErrorRecord errorRecord : records) {
            byKind.merge(errorRecord.kind(), 1, Integer::sum);
            bySeverity.merge(errorRecord.severity(), 1, Integer::sum);
            if (!errorRecord.provider().isEmpty()) {
                byProvider.merge(errorRecord.provider(), 1, Integer::sum);
            }
        }
        List<ErrorRecord> all = new ArrayList<>(records);
        List<ErrorRecord> recent = all.subList(Math.max(0, all.size() - RECENT_ERROR_COUNT), all.size());

        Map<String, ProviderErrorHealth> health = new LinkedHashMap<>();
        providerCounts.forEach((provider, counts) -> health.put(provider, assess(counts)));

        return new ErrorStatistics(
                records.size(), byKind, bySeverity, byProvider, List.copyOf(recent), health);
    }

    private static ProviderErrorHealth assess(Map<ErrorKind, Integer> counts) {
        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        int critical = count(counts, ErrorKind.AUTHENTICATION) + count(counts, ErrorKind.PAYMENT_REQUIRED);
        String health;
        if (critical > 0) {
            health = "critical";
        } else if (total > 10) {
            health = "poor";
        } else if (total > 5) {
            health = "fair";
        } else {
            health = "good";
        }
        return new ProviderErrorHealth(health, total, critical, Map.copyOf(counts));
    }

    /**
     * Produces one line of operator advice per provider with recorded errors.
     */
    public synchronized Map<String, String> recommendations() {
        Map<String, String> advice = new LinkedHashMap<>();
        providerCounts.forEach((provider, counts) -> advice.put(provider, recommend(counts)));
        return advice;
    }

    private static String recommend(Map<ErrorKind, Integer> counts) {
        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        if (total == 0) {
            return "Healthy - no errors recorded";
        }
        if (count(counts, ErrorKind.AUTHENTICATION) > 0) {
            return "Check API key configuration - authentication failures detected";
        }
        if (count(counts, ErrorKind.PAYMENT_REQUIRED) > 0) {
            return "Check billing/subscription - payment required errors detected";
        }
        if (count(counts, ErrorKind.QUOTA_EXCEEDED) > 5) {
            return "Consider upgrading plan - frequent quota exceeded errors";
        }
        if (count(counts, ErrorKind.RATE_LIMIT) > 10) {
            return "Lower request rate - frequent rate limit errors";
        }
        if (total > 15) {
            return "Monitor closely - high error rate detected";
        }
        return "Stable with minor issues - continue monitoring";
    }

    private static int count(Map<ErrorKind, Integer> counts, ErrorKind kind) {
        return counts.getOrDefault(kind, 0);
    }

    /**
     * Drops the records and counters of one provider.
     */
    public void clear(String provider) {
        synchronized (this) {
            records.removeIf(errorRecord -> errorRecord.provider().equals(provider));
            providerCounts.remove(provider);
            credentialCounts.keySet().removeIf(key -> key.provider().equals(provider));
        }
        log.info("[{}] Cleared error history", provider);
    }

    public void clearAll() {
        synchronized (this) {
            records.clear();
            providerCounts.clear();
            credentialCounts.clear();
        }
        log.info("Cleared all error history");
    }

    public synchronized int size() {
        return records.size();
    }

    private record CredentialKey(String provider, int keyIndex) {}

    /**
     * Error mix and health label of one provider.
     *
     * @param health one of critical, poor, fair, good
     * @param totalErrors errors recorded for the provider
     * @param criticalErrors authentication and payment failures
     * @param breakdown errors by kind
     */
    public record ProviderErrorHealth(
            String health, int totalErrors, int criticalErrors, Map<ErrorKind, Integer> breakdown) {}

    /**
     * Aggregate view over the error history.
     *
     * @param totalErrors records currently retained
     * @param errorsByKind counts by kind
     * @param errorsBySeverity counts by severity
     * @param errorsByProvider counts by provider
     * @param recentErrors most recent records, oldest first
     * @param providerHealth health assessment per provider
     */
    public record ErrorStatistics(
            int totalErrors,
            Map<ErrorKind, Integer> errorsByKind,
            Map<ErrorSeverity, Integer> errorsBySeverity,
            Map<String, Integer> errorsByProvider,
            List<ErrorRecord> recentErrors,
            Map<String, ProviderErrorHealth> providerHealth) {}
}
