package com.williamcallahan.inference.service;

import com.williamcallahan.inference.client.InferenceClient;
import com.williamcallahan.inference.client.InferenceClientRegistry;
import com.williamcallahan.inference.client.InferenceRequest;
import com.williamcallahan.inference.config.AppProperties;
import com.williamcallahan.inference.domain.HealthState;
import com.williamcallahan.inference.domain.ModelConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Probes providers with a minimal generation and tracks their health.
 *
 * <p>A successful probe marks the provider HEALTHY and clears its failure count. Failed probes mark it
 * DEGRADED until the failure threshold is reached, then UNHEALTHY. Probes of the same provider never overlap.
 * The background poll runs on the scheduler thread and re-checks providers whose last check is older than
 * the configured interval.</p>
 */
@Service
public class ProviderHealthMonitor {
    private static final Logger log = LoggerFactory.getLogger(ProviderHealthMonitor.class);

    /** 1x1 transparent PNG used to probe vision models. */
    static final String PROBE_IMAGE_BASE64 =
            "iVBORw0KGgoAAAANSUhEUgAAAAEAAAABCAYAAAAfFcSJAAAADUlEQVR42mP8/5+hHgAHggJ/PchI7wAAAABJRU5ErkJggg==";
    static final String PROBE_IMAGE_MIME_TYPE = "image/png";

    private final ModelRegistry modelRegistry;
    private final InferenceClientRegistry clientRegistry;
    private final CredentialRotation credentialRotation;
    private final Clock clock;
    private final boolean enabled;
    private final Duration checkInterval;
    private final Duration probeTimeout;
    private final int failureThreshold;
    private final String probePrompt;
    private final Map<String, ProviderStatus> statuses = new LinkedHashMap<>();

    public ProviderHealthMonitor(
            ModelRegistry modelRegistry,
            InferenceClientRegistry clientRegistry,
            CredentialRotation credentialRotation,
            AppProperties appProperties,
            Clock clock) {
        this.modelRegistry = Objects.requireNonNull(modelRegistry, "modelRegistry");
        this.clientRegistry = Objects.requireNonNull(clientRegistry, "clientRegistry");
        this.credentialRotation = Objects.requireNonNull(credentialRotation, "credentialRotation");
        this.clock = Objects.requireNonNull(clock, "clock");
        AppProperties.Health health = appProperties.getHealth();
        this.enabled = health.isEnabled();
        this.checkInterval = health.getCheckInterval();
        this.probeTimeout = health.getProbeTimeout();
        this.failureThreshold = health.getFailureThreshold();
        this.probePrompt = health.getProbePrompt();
        for (String provider : clientRegistry.providerNames()) {
            if (modelRegistry.isKnownProvider(provider)) {
                statuses.put(provider, new ProviderStatus());
            } else {
                log.warn("[{}] Client registered for a provider missing from the catalogue; not monitored", provider);
            }
        }
        log.info("ProviderHealthMonitor initialized, monitoring {} providers (enabled={})", statuses.size(), enabled);
    }

    /**
     * Runs one probe against the provider.
     *
     * <p>When a probe of the same provider is already running, returns whether the provider was last seen healthy
     * without issuing another call.</p>
     *
     * @param provider provider name
     * @return true when the provider answered the probe
     * @throws UnknownProviderException when the provider is not monitored
     */
    public boolean check(String provider) {
        ProviderStatus status = requireStatus(provider);
        if (!status.tryStartCheck()) {
            log.debug("[{}] Health check already in progress", provider);
            return status.state == HealthState.HEALTHY;
        }
        try {
            return probe(provider, status);
        } finally {
            status.finishCheck();
        }
    }

    private boolean probe(String provider, ProviderStatus status) {
        Optional<InferenceClient> client = clientRegistry.client(provider);
        Optional<ModelConfig> model = modelRegistry.defaultModel(provider);
        if (client.isEmpty() || model.isEmpty()) {
            status.markFailed(clock.instant(), failureThreshold, "No client or model configured");
            log.warn("[HEALTH] [{}] Cannot probe: no client or model configured", provider);
            return false;
        }
        int credential = credentialRotation.activeCredential(provider).orElse(0);
        InferenceRequest probe = probeRequest(model.get()).withCredential(credential);
        try {
            Mono.fromCallable(() -> client.get().generate(probe))
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(probeTimeout)
                    .block();
            status.markHealthy(clock.instant());
            log.info("[HEALTH] [{}] Probe succeeded using {}", provider, model.get().modelId());
            return true;
        } catch (RuntimeException probeFailure) {
            HealthState state = status.markFailed(clock.instant(), failureThreshold, describe(probeFailure));
            log.warn("[HEALTH] [{}] Probe failed (exceptionType={}, failures={}, state={})",
                    provider, probeFailure.getClass().getSimpleName(), status.consecutiveFailures, state.label());
            return false;
        }
    }

    private InferenceRequest probeRequest(ModelConfig model) {
        InferenceRequest request = model.supportsVision()
                ? InferenceRequest.withImage(probePrompt, PROBE_IMAGE_BASE64, PROBE_IMAGE_MIME_TYPE)
                : InferenceRequest.text(probePrompt);
        return request.forModel(model.modelId());
    }

    /**
     * Re-checks every provider whose last check is older than the check interval.
     */
    @Scheduled(
            initialDelayString = "${app.inference.health.initial-delay:PT10S}",
            fixedDelayString = "${app.inference.health.poll-interval:PT60S}")
    public void pollProviders() {
        if (!enabled) {
            return;
        }
        Instant now = clock.instant();
        for (String provider : monitoredProviders()) {
            ProviderStatus status = statuses.get(provider);
            if (status.lastCheck != null && Duration.between(status.lastCheck, now).compareTo(checkInterval) < 0) {
                continue;
            }
            try {
                check(provider);
            } catch (RuntimeException unexpected) {
                log.error("[HEALTH] [{}] Health poll failed unexpectedly", provider, unexpected);
            }
        }
    }

    /**
     * Picks the first usable provider from a preference list.
     *
     * @param preferredOrder provider names, most preferred first
     * @return first HEALTHY provider, else first DEGRADED or UNKNOWN, else empty
     */
    public Optional<String> getHealthyProvider(List<String> preferredOrder) {
        String fallback = null;
        for (String provider : preferredOrder) {
            HealthState state = state(provider);
            if (state == HealthState.HEALTHY) {
                return Optional.of(provider);
            }
            if (fallback == null && state.isUsable()) {
                fallback = provider;
            }
        }
        return Optional.ofNullable(fallback);
    }

    /**
     * Returns the provider's health, UNKNOWN for providers that are not monitored.
     */
    public HealthState state(String provider) {
        ProviderStatus status = statuses.get(provider);
        return status == null ? HealthState.UNKNOWN : status.state;
    }

    /**
     * Reports whether routing should skip the provider: monitoring is on and the provider is UNHEALTHY.
     */
    public boolean isExcluded(String provider) {
        return enabled && state(provider) == HealthState.UNHEALTHY;
    }

    /**
     * Summarizes every monitored provider.
     */
    public Map<String, ProviderHealthReport> getStatusReport() {
        Map<String, ProviderHealthReport> report = new LinkedHashMap<>();
        for (String provider : monitoredProviders()) {
            ProviderStatus status = statuses.get(provider);
            HealthState state = status.state;
            report.put(provider, new ProviderHealthReport(
                    state.label(), status.lastCheck, status.consecutiveFailures, state.isUsable(), status.lastError));
        }
        return report;
    }

    /**
     * Forgets a provider's health history so it is treated as UNKNOWN and probed on the next poll.
     */
    public void reset(String provider) {
        ProviderStatus status = statuses.get(provider);
        if (status != null) {
            status.reset();
            log.info("[HEALTH] [{}] Health status reset", provider);
        }
    }

    public void resetAll() {
        monitoredProviders().forEach(this::reset);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public List<String> monitoredProviders() {
        return List.copyOf(statuses.keySet());
    }

    private ProviderStatus requireStatus(String provider) {
        ProviderStatus status = statuses.get(provider);
        if (status == null) {
            throw new UnknownProviderException(provider);
        }
        return status;
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return failure.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    /**
     * Health summary of one provider.
     *
     * @param status lowercase health label
     * @param lastCheck completion time of the last probe, null before the first probe
     * @param consecutiveFailures failed probes since the last success
     * @param available whether routing may use the provider
     * @param lastError description of the last probe failure, null after a success
     */
    public record ProviderHealthReport(
            String status, Instant lastCheck, int consecutiveFailures, boolean available, String lastError) {}

    private static final class ProviderStatus {
        private final AtomicBoolean checkInProgress = new AtomicBoolean(false);
        private volatile HealthState state = HealthState.UNKNOWN;
        private volatile Instant lastCheck;
        private volatile int consecutiveFailures;
        private volatile String lastError;

        boolean tryStartCheck() {
            return checkInProgress.compareAndSet(false, true);
        }

        void finishCheck() {
            checkInProgress.set(false);
        }

        synchronized void markHealthy(Instant checkedAt) {
            state = HealthState.HEALTHY;
            consecutiveFailures = 0;
            lastError = null;
            lastCheck = checkedAt;
        }

        synchronized HealthState markFailed(Instant checkedAt, int failureThreshold, String error) {
            consecutiveFailures++;
            state = consecutiveFailures >= failureThreshold ? HealthState.UNHEALTHY : HealthState.DEGRADED;
            lastError = error;
            lastCheck = checkedAt;
            return state;
        }

        synchronized void reset() {
            state = HealthState.UNKNOWN;
            consecutiveFailures = 0;
            lastError = null;
            lastCheck = null;
            checkInProgress.set(false);
        }
    }
}
