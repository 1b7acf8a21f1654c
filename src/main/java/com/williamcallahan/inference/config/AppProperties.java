package com.williamcallahan.inference.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tuning knobs for the resilience layer, bound from {@code app.inference.*}.
 */
@Component
@ConfigurationProperties(prefix = "app.inference")
public class AppProperties {

    private Cache cache = new Cache();
    private Breaker breaker = new Breaker();
    private Backoff backoff = new Backoff();
    private Health health = new Health();
    private Orchestrator orchestrator = new Orchestrator();
    private Errors errors = new Errors();

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Breaker getBreaker() {
        return breaker;
    }

    public void setBreaker(Breaker breaker) {
        this.breaker = breaker;
    }

    public Backoff getBackoff() {
        return backoff;
    }

    public void setBackoff(Backoff backoff) {
        this.backoff = backoff;
    }

    public Health getHealth() {
        return health;
    }

    public void setHealth(Health health) {
        this.health = health;
    }

    public Orchestrator getOrchestrator() {
        return orchestrator;
    }

    public void setOrchestrator(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public Errors getErrors() {
        return errors;
    }

    public void setErrors(Errors errors) {
        this.errors = errors;
    }

    /**
     * Rejects nonsensical tuning at startup instead of at the first request.
     *
     * @throws IllegalStateException when any value is out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        requirePositive(cache.getTtl(), "app.inference.cache.ttl");
        if (cache.getMaxEntries() <= 0) {
            throw new IllegalStateException("app.inference.cache.max-entries must be positive");
        }
        if (cache.getParamTruncationLength() < 0) {
            throw new IllegalStateException("app.inference.cache.param-truncation-length must be >= 0");
        }
        if (breaker.getFailureThreshold() <= 0) {
            throw new IllegalStateException("app.inference.breaker.failure-threshold must be positive");
        }
        requirePositive(breaker.getRecoveryTimeout(), "app.inference.breaker.recovery-timeout");
        requirePositive(backoff.getBase(), "app.inference.backoff.base");
        requirePositive(backoff.getMax(), "app.inference.backoff.max");
        if (backoff.getBase().compareTo(backoff.getMax()) > 0) {
            throw new IllegalStateException("app.inference.backoff.base must not exceed app.inference.backoff.max");
        }
        if (backoff.getMultiplier() < 1.0) {
            throw new IllegalStateException("app.inference.backoff.multiplier must be >= 1.0");
        }
        requirePositive(health.getCheckInterval(), "app.inference.health.check-interval");
        requirePositive(health.getProbeTimeout(), "app.inference.health.probe-timeout");
        if (health.getFailureThreshold() <= 0) {
            throw new IllegalStateException("app.inference.health.failure-threshold must be positive");
        }
        requirePositive(orchestrator.getAttemptTimeout(), "app.inference.orchestrator.attempt-timeout");
        requirePositive(orchestrator.getDefaultRetryAfter(), "app.inference.orchestrator.default-retry-after");
        if (orchestrator.getMaxBackoffWait().isNegative()) {
            throw new IllegalStateException("app.inference.orchestrator.max-backoff-wait must be >= 0");
        }
        if (errors.getHistoryCapacity() <= 0) {
            throw new IllegalStateException("app.inference.errors.history-capacity must be positive");
        }
    }

    private static void requirePositive(Duration value, String propertyName) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalStateException(propertyName + " must be a positive duration");
        }
    }

    public static class Cache {
        private boolean enabled = true;
        private Duration ttl = Duration.ofMinutes(30);
        private int maxEntries = 1000;
        private int paramTruncationLength = 0;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }

        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }

        /** Prefix length long string parameters are cut to before hashing, 0 keeps them whole. */
        public int getParamTruncationLength() { return paramTruncationLength; }
        public void setParamTruncationLength(int paramTruncationLength) {
            this.paramTruncationLength = paramTruncationLength;
        }
    }

    public static class Breaker {
        private int failureThreshold = 3;
        private Duration recoveryTimeout = Duration.ofSeconds(60);

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public Duration getRecoveryTimeout() { return recoveryTimeout; }
        public void setRecoveryTimeout(Duration recoveryTimeout) { this.recoveryTimeout = recoveryTimeout; }
    }

    public static class Backoff {
        private Duration base = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private Duration max = Duration.ofSeconds(60);
        private boolean jitter = true;

        public Duration getBase() { return base; }
        public void setBase(Duration base) { this.base = base; }

        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }

        public Duration getMax() { return max; }
        public void setMax(Duration max) { this.max = max; }

        public boolean isJitter() { return jitter; }
        public void setJitter(boolean jitter) { this.jitter = jitter; }
    }

    public static class Health {
        private boolean enabled = true;
        private Duration checkInterval = Duration.ofMinutes(5);
        private Duration probeTimeout = Duration.ofSeconds(10);
        private int failureThreshold = 3;
        private String probePrompt = "Health check test";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getCheckInterval() { return checkInterval; }
        public void setCheckInterval(Duration checkInterval) { this.checkInterval = checkInterval; }

        public Duration getProbeTimeout() { return probeTimeout; }
        public void setProbeTimeout(Duration probeTimeout) { this.probeTimeout = probeTimeout; }

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public String getProbePrompt() { return probePrompt; }
        public void setProbePrompt(String probePrompt) { this.probePrompt = probePrompt; }
    }

    public static class Orchestrator {
        private Duration attemptTimeout = Duration.ofSeconds(30);
        private Duration maxBackoffWait = Duration.ofSeconds(10);
        private Duration defaultRetryAfter = Duration.ofSeconds(60);

        public Duration getAttemptTimeout() { return attemptTimeout; }
        public void setAttemptTimeout(Duration attemptTimeout) { this.attemptTimeout = attemptTimeout; }

        /** Longest remaining backoff window the orchestrator waits out before calling; longer ones are skipped. */
        public Duration getMaxBackoffWait() { return maxBackoffWait; }
        public void setMaxBackoffWait(Duration maxBackoffWait) { this.maxBackoffWait = maxBackoffWait; }

        public Duration getDefaultRetryAfter() { return defaultRetryAfter; }
        public void setDefaultRetryAfter(Duration defaultRetryAfter) { this.defaultRetryAfter = defaultRetryAfter; }
    }

    public static class Errors {
        private int historyCapacity = 1000;

        public int getHistoryCapacity() { return historyCapacity; }
        public void setHistoryCapacity(int historyCapacity) { this.historyCapacity = historyCapacity; }
    }
}
