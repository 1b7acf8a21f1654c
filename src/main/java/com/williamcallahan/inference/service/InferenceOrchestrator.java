package com.williamcallahan.inference.service;

import com.williamcallahan.inference.client.InferenceClient;
import com.williamcallahan.inference.client.InferenceClientRegistry;
import com.williamcallahan.inference.client.InferenceRequest;
import com.williamcallahan.inference.client.ProviderCallException;
import com.williamcallahan.inference.config.AppProperties;
import com.williamcallahan.inference.domain.CapabilityRequirement;
import com.williamcallahan.inference.domain.ModelCandidate;
import com.williamcallahan.inference.domain.ProviderConfig;
import com.williamcallahan.inference.domain.failure.CandidateFailure;
import com.williamcallahan.inference.domain.failure.CandidateFailure.SkipReason;
import com.williamcallahan.inference.domain.failure.ErrorClassification;
import com.williamcallahan.inference.domain.failure.ErrorKind;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs a request against an ordered list of candidates until one succeeds.
 *
 * <p>Candidates are skipped while their provider is unhealthy, rate limited, circuit-open or backing off for
 * longer than the configured wait. Failures are classified, recorded and fed back into the rate tracker,
 * breaker and backoff of the provider before moving to the next candidate. A failure that only condemns the
 * credential is retried on the same candidate with the provider's next key. Caller errors stop the run
 * immediately; credential-fatal errors with no key left rule out the rest of that provider's candidates for
 * the run.</p>
 */
@Service
public class InferenceOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(InferenceOrchestrator.class);

    static final String GENERATE_OPERATION = "generate";

    private final ModelRegistry modelRegistry;
    private final RateLimitTracker rateLimitTracker;
    private final ErrorClassifier errorClassifier;
    private final ErrorHistory errorHistory;
    private final ResponseCache responseCache;
    private final ProviderHealthMonitor healthMonitor;
    private final CredentialRotation credentialRotation;
    private final InferenceClientRegistry clientRegistry;
    private final Clock clock;
    private final AppProperties.Breaker breakerSettings;
    private final AppProperties.Backoff backoffSettings;
    private final Duration attemptTimeout;
    private final Duration maxBackoffWait;
    private final Duration defaultRetryAfter;
    private final Map<String, ProviderResilienceState> providerStates = new ConcurrentHashMap<>();

    public InferenceOrchestrator(
            ModelRegistry modelRegistry,
            RateLimitTracker rateLimitTracker,
            ErrorClassifier errorClassifier,
            ErrorHistory errorHistory,
            ResponseCache responseCache,
            ProviderHealthMonitor healthMonitor,
            CredentialRotation credentialRotation,
            InferenceClientRegistry clientRegistry,
            AppProperties appProperties,
            Clock clock) {
        this.modelRegistry = Objects.requireNonNull(modelRegistry, "modelRegistry");
        this.rateLimitTracker = Objects.requireNonNull(rateLimitTracker, "rateLimitTracker");
        this.errorClassifier = Objects.requireNonNull(errorClassifier, "errorClassifier");
        this.errorHistory = Objects.requireNonNull(errorHistory, "errorHistory");
        this.responseCache = Objects.requireNonNull(responseCache, "responseCache");
        this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor");
        this.credentialRotation = Objects.requireNonNull(credentialRotation, "credentialRotation");
        this.clientRegistry = Objects.requireNonNull(clientRegistry, "clientRegistry");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.breakerSettings = appProperties.getBreaker();
        this.backoffSettings = appProperties.getBackoff();
        this.attemptTimeout = appProperties.getOrchestrator().getAttemptTimeout();
        this.maxBackoffWait = appProperties.getOrchestrator().getMaxBackoffWait();
        this.defaultRetryAfter = appProperties.getOrchestrator().getDefaultRetryAfter();
    }

    /**
     * Executes the request against the candidates in order, without an overall deadline.
     *
     * @see #executeWithFallback(String, List, CandidateRequest, Object, Map, Duration)
     */
    public <T> Mono<T> executeWithFallback(
            String operationName,
            List<ModelCandidate> candidates,
            CandidateRequest<T> requestFn,
            Object cacheKeyParams,
            Map<String, Object> arguments) {
        return executeWithFallback(operationName, candidates, requestFn, cacheKeyParams, arguments, null);
    }

    /**
     * Executes the request against the candidates in order until one succeeds.
     *
     * @param operationName logical operation, part of the cache key
     * @param candidates candidates in preference order, already filtered by capability
     * @param requestFn performs the upstream call for one candidate
     * @param cacheKeyParams parameters identifying the request for caching, null to bypass the cache
     * @param arguments arguments handed to {@code requestFn}
     * @param overallBudget deadline for the whole run including backoff waits, null for none
     * @param <T> result type
     * @return the first successful result; errors with {@link AllProvidersFailedException} when every candidate
     *     failed or was skipped, or with the original error when the request itself is invalid
     */
    public <T> Mono<T> executeWithFallback(
            String operationName,
            List<ModelCandidate> candidates,
            CandidateRequest<T> requestFn,
            Object cacheKeyParams,
            Map<String, Object> arguments,
            Duration overallBudget) {
        Objects.requireNonNull(operationName, "operationName");
        Objects.requireNonNull(candidates, "candidates");
        Objects.requireNonNull(requestFn, "requestFn");
        Map<String, Object> callArguments = arguments == null ? Map.of() : arguments;
        return Mono.defer(() -> {
            Optional<T> cached = cachedResult(operationName, candidates, cacheKeyParams);
            if (cached.isPresent()) {
                return Mono.just(cached.get());
            }
            Instant deadline = overallBudget == null ? null : clock.instant().plus(overallBudget);
            FallbackRun<T> run = new FallbackRun<>(
                    operationName, List.copyOf(candidates), requestFn, cacheKeyParams, callArguments, deadline);
            return attempt(run, 0);
        });
    }

    @SuppressWarnings("unchecked")
    private <T> Optional<T> cachedResult(String operationName, List<ModelCandidate> candidates, Object cacheKeyParams) {
        if (cacheKeyParams == null || !responseCache.isEnabled()) {
            return Optional.empty();
        }
        Set<String> providers = new LinkedHashSet<>();
        candidates.forEach(candidate -> providers.add(candidate.providerName()));
        for (String provider : providers) {
            Optional<Object> hit = responseCache.get(provider, operationName, cacheKeyParams);
            if (hit.isPresent()) {
                log.debug("[{}] Cache hit for {}", provider, operationName);
                return Optional.of((T) hit.get());
            }
        }
        return Optional.empty();
    }

    private <T> Mono<T> attempt(FallbackRun<T> run, int index) {
        if (index >= run.candidates.size()) {
            return Mono.error(exhausted(run));
        }
        ModelCandidate candidate = run.candidates.get(index);
        String provider = candidate.providerName();
        String model = candidate.modelId();

        Duration remainingBudget = run.remainingBudget(clock.instant());
        if (remainingBudget != null && remainingBudget.isZero()) {
            for (int rest = index; rest < run.candidates.size(); rest++) {
                ModelCandidate skipped = run.candidates.get(rest);
                run.failures.add(CandidateFailure.skipped(
                        skipped.providerName(), skipped.modelId(), SkipReason.BUDGET_EXHAUSTED, null));
            }
            log.warn("Overall budget exhausted for {} after {} candidates", run.operationName, index);
            return Mono.error(exhausted(run));
        }
        if (run.credentialRejected.contains(provider)) {
            return skip(run, index, candidate, SkipReason.CREDENTIAL_REJECTED, null);
        }
        OptionalInt activeCredential = credentialRotation.activeCredential(provider);
        if (activeCredential.isEmpty()) {
            return skip(run, index, candidate, SkipReason.CREDENTIAL_REJECTED, null);
        }
        int credential = activeCredential.getAsInt();
        if (healthMonitor.isExcluded(provider)) {
            return skip(run, index, candidate, SkipReason.UNHEALTHY, null);
        }
        if (!rateLimitTracker.admit(provider, model)) {
            return skip(run, index, candidate, SkipReason.RATE_LIMITED, remainingLimit(provider, model));
        }
        ProviderResilienceState state = stateFor(candidate.provider());
        Duration backoffWait = state.remainingBackoff();
        if (backoffWait.compareTo(maxBackoffWait) > 0
                || (remainingBudget != null && backoffWait.compareTo(remainingBudget) >= 0)) {
            return skip(run, index, candidate, SkipReason.BACKING_OFF, backoffWait);
        }
        if (!state.breaker().canAttempt()) {
            return skip(run, index, candidate, SkipReason.CIRCUIT_OPEN, state.breaker().remainingOpenTime());
        }
        if (!rateLimitTracker.tryAcquire(provider, model)) {
            // lost the last slot to a concurrent request
            state.breaker().releaseTrial();
            return skip(run, index, candidate, SkipReason.RATE_LIMITED, remainingLimit(provider, model));
        }

        Duration timeout = remainingBudget == null
                ? attemptTimeout
                : min(attemptTimeout, remainingBudget.minus(backoffWait));
        Mono<T> call = Mono.fromCallable(() -> run.requestFn.call(candidate, credential, run.arguments))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .switchIfEmpty(Mono.error(() -> new ProviderCallException(
                        provider, ProviderCallException.NO_STATUS, null, "Empty result from " + candidate.label())));
        if (!backoffWait.isZero()) {
            log.debug("[{}] Waiting {} ms of backoff before calling {}", provider, backoffWait.toMillis(), model);
            call = Mono.delay(backoffWait).then(call);
        }
        // the reservation and any trial are settled exactly once: by the outcome or by cancellation
        AtomicBoolean settled = new AtomicBoolean();
        return call
                .doOnCancel(() -> {
                    if (settled.compareAndSet(false, true)) {
                        state.breaker().releaseTrial();
                        rateLimitTracker.complete(provider, model, false);
                        log.debug("[{}] {} cancelled during {}", provider, model, run.operationName);
                    }
                })
                .map(result -> settled.compareAndSet(false, true) ? onSuccess(run, candidate, state, result) : result)
                .onErrorResume(error -> settled.compareAndSet(false, true)
                        ? onFailure(run, index, candidate, credential, state, error)
                        : Mono.error(error));
    }

    private <T> T onSuccess(FallbackRun<T> run, ModelCandidate candidate, ProviderResilienceState state, T result) {
        rateLimitTracker.complete(candidate.providerName(), candidate.modelId(), true);
        state.recordSuccess();
        if (run.cacheKeyParams != null) {
            responseCache.put(candidate.providerName(), run.operationName, run.cacheKeyParams, result);
        }
        log.debug("[{}] {} succeeded with {}", candidate.providerName(), run.operationName, candidate.modelId());
        return result;
    }

    private <T> Mono<T> onFailure(
            FallbackRun<T> run,
            int index,
            ModelCandidate candidate,
            int credential,
            ProviderResilienceState state,
            Throwable error) {
        String provider = candidate.providerName();
        String model = candidate.modelId();
        ErrorClassification classification = errorClassifier.classify(error);
        ErrorKind kind = classification.kind();
        errorHistory.record(provider, credential, classification);
        rateLimitTracker.complete(provider, model, false);

        if (kind.isCallerError()) {
            state.breaker().releaseTrial();
            log.warn("[{}] {} rejected the request as invalid; not falling back", provider, model);
            return Mono.error(error);
        }

        Duration hint = classification.retryAfterHint();
        if (kind.policy().switchCredential() && candidate.provider().credentialCount() > 1) {
            Duration keyWindow = kind.isRateLimiting() && hint == null
                    ? rateLimitTracker.resetWindowFor(classification.message(), candidate.provider())
                    : hint;
            if (credentialRotation.rotate(provider, credential, kind, keyWindow)) {
                state.breaker().releaseTrial();
                run.failures.add(CandidateFailure.attempted(provider, model, kind, classification.message(), null));
                log.warn("[{}] {} failed for {} with credential {} ({}); retrying with the next credential",
                        provider, model, run.operationName, credential, kind);
                return attempt(run, index);
            }
        }

        ProviderCircuitBreaker.State breakerState = state.breaker().recordFailure();
        Duration retryAfter = state.openBackoffWindow(hint);
        if (kind.isRateLimiting()) {
            Duration limitWindow = hint != null ? hint : rateLimitTracker.resetWindowFor(
                    classification.message(), candidate.provider());
            rateLimitTracker.markLimited(provider, model, limitWindow.getSeconds());
            retryAfter = limitWindow;
        }
        if (breakerState == ProviderCircuitBreaker.State.OPEN) {
            retryAfter = max(retryAfter, state.breaker().remainingOpenTime());
        }
        if (kind.isCredentialFatal()) {
            run.credentialRejected.add(provider);
        }
        run.failures.add(CandidateFailure.attempted(provider, model, kind, classification.message(), retryAfter));
        log.warn("[{}] {} failed for {} ({}, breaker={}, retryAfter={}s); trying next candidate",
                provider, model, run.operationName, kind, breakerState, retryAfter.getSeconds());
        return attempt(run, index + 1);
    }

    private <T> Mono<T> skip(
            FallbackRun<T> run, int index, ModelCandidate candidate, SkipReason reason, Duration retryAfter) {
        log.debug("[{}] Skipping {} ({})", candidate.providerName(), candidate.modelId(), reason);
        run.failures.add(CandidateFailure.skipped(candidate.providerName(), candidate.modelId(), reason, retryAfter));
        return attempt(run, index + 1);
    }

    private AllProvidersFailedException exhausted(FallbackRun<?> run) {
        ErrorKind dominant = null;
        boolean rateLimitedSkip = false;
        Duration retryAfter = null;
        for (CandidateFailure failure : run.failures) {
            if (failure.wasAttempted()
                    && (dominant == null || failure.kind().severity().isMoreSevereThan(dominant.severity()))) {
                dominant = failure.kind();
            }
            if (failure.skipReason() == SkipReason.RATE_LIMITED) {
                rateLimitedSkip = true;
            }
            Duration window = failure.retryAfter();
            if (window != null && !window.isZero() && !window.isNegative()
                    && (retryAfter == null || window.compareTo(retryAfter) < 0)) {
                retryAfter = window;
            }
        }
        if (dominant == null) {
            dominant = rateLimitedSkip ? ErrorKind.RATE_LIMIT : ErrorKind.UNKNOWN;
        }
        Duration effectiveRetryAfter = retryAfter == null ? defaultRetryAfter : retryAfter;
        log.error("All {} candidates failed for {} (dominant={}, retryAfter={}s)",
                run.candidates.size(), run.operationName, dominant, effectiveRetryAfter.getSeconds());
        return new AllProvidersFailedException(run.operationName, run.failures, dominant, effectiveRetryAfter);
    }

    /**
     * Generates text with the best available model satisfying the requirement.
     *
     * @param requirement capabilities the model must have
     * @param request prompt and optional image; its model field is ignored
     * @return generated text
     */
    public Mono<String> generate(CapabilityRequirement requirement, InferenceRequest request) {
        Objects.requireNonNull(request, "request");
        List<ModelCandidate> candidates = new ArrayList<>();
        for (ModelCandidate candidate : modelRegistry.rankCandidates(requirement)) {
            if (clientRegistry.client(candidate.providerName()).isPresent()) {
                candidates.add(candidate);
            }
        }
        Map<String, Object> cacheKeyParams = new LinkedHashMap<>();
        cacheKeyParams.put("prompt", request.prompt());
        cacheKeyParams.put("imageData", request.imageData());
        cacheKeyParams.put("imageMimeType", request.imageMimeType());
        cacheKeyParams.put("capabilities", requirement.capabilities());
        cacheKeyParams.put("minContextLength", requirement.minContextLength());
        return executeWithFallback(
                GENERATE_OPERATION,
                candidates,
                (candidate, credential, arguments) -> {
                    InferenceClient client = clientRegistry.client(candidate.providerName())
                            .orElseThrow(() -> new IllegalStateException("No client for " + candidate.providerName()));
                    return client.generate(request.forModel(candidate.modelId()).withCredential(credential));
                },
                cacheKeyParams,
                Map.of());
    }

    /**
     * Snapshots limits, counters, breaker, backoff, credentials, health and error counts of every provider.
     */
    public Map<String, ProviderStats> getProviderStats() {
        Map<String, ProviderStats> stats = new LinkedHashMap<>();
        for (ProviderConfig provider : modelRegistry.providers()) {
            ProviderResilienceState state = stateFor(provider);
            ProviderCircuitBreaker breaker = state.breaker();
            stats.put(provider.name(), new ProviderStats(
                    provider.name(),
                    provider.enabled(),
                    provider.priority(),
                    provider.requestsPerMinute(),
                    provider.requestsPerDay(),
                    healthMonitor.state(provider.name()).label(),
                    breaker.state().name(),
                    breaker.failureCount(),
                    state.backoffAttempt(),
                    state.backoffUntil(),
                    rateLimitTracker.snapshots(provider.name()),
                    credentialRotation.status(provider.name()),
                    errorHistory.providerErrorCounts(provider.name())));
        }
        return stats;
    }

    /**
     * Clears every piece of runtime state held for the provider.
     *
     * @throws UnknownProviderException when the provider is not in the catalogue
     */
    public void resetProvider(String name) {
        ProviderConfig provider = modelRegistry.provider(name).orElseThrow(() -> new UnknownProviderException(name));
        stateFor(provider).reset();
        rateLimitTracker.reset(name);
        errorHistory.clear(name);
        healthMonitor.reset(name);
        credentialRotation.reset(name);
        log.info("[{}] Provider state reset", name);
    }

    public void resetAllProviders() {
        providerStates.values().forEach(ProviderResilienceState::reset);
        rateLimitTracker.resetAll();
        errorHistory.clearAll();
        healthMonitor.resetAll();
        credentialRotation.resetAll();
        log.info("All provider state reset");
    }

    ProviderCircuitBreaker breaker(String provider) {
        ProviderConfig config = modelRegistry.provider(provider).orElseThrow(() -> new UnknownProviderException(provider));
        return stateFor(config).breaker();
    }

    private ProviderResilienceState stateFor(ProviderConfig provider) {
        return providerStates.computeIfAbsent(provider.name(), name -> new ProviderResilienceState(
                new ProviderCircuitBreaker(
                        name, breakerSettings.getFailureThreshold(), breakerSettings.getRecoveryTimeout(), clock),
                new ExponentialBackoff(
                        backoffSettings.getBase(),
                        backoffSettings.getMultiplier(),
                        backoffSettings.getMax(),
                        backoffSettings.isJitter() ? new Random() : null),
                clock));
    }

    private Duration remainingLimit(String provider, String model) {
        Duration limitedFor = rateLimitTracker.remainingLimit(provider, model);
        return limitedFor.isZero() ? null : limitedFor;
    }

    private static Duration min(Duration first, Duration second) {
        return first.compareTo(second) <= 0 ? first : second;
    }

    private static Duration max(Duration first, Duration second) {
        return first.compareTo(second) >= 0 ? first : second;
    }

    /**
     * Runtime view of one provider.
     *
     * @param provider provider name
     * @param enabled whether the provider takes traffic
     * @param priority routing rank
     * @param requestsPerMinute provider-wide minute limit
     * @param requestsPerDay provider-wide day limit
     * @param health health label
     * @param circuitState breaker state name
     * @param circuitFailures consecutive failures counted by the breaker
     * @param backoffAttempt current backoff attempt
     * @param backoffUntil end of the current backoff window, null when none
     * @param models per-model rate windows
     * @param credentials credential rotation state
     * @param errorCounts recorded errors by kind
     */
    public record ProviderStats(
            String provider,
            boolean enabled,
            int priority,
            int requestsPerMinute,
            int requestsPerDay,
            String health,
            String circuitState,
            int circuitFailures,
            int backoffAttempt,
            Instant backoffUntil,
            List<RateLimitTracker.UsageSnapshot> models,
            CredentialRotation.CredentialStatus credentials,
            Map<ErrorKind, Integer> errorCounts) {}

    private static final class FallbackRun<T> {
        private final String operationName;
        private final List<ModelCandidate> candidates;
        private final CandidateRequest<T> requestFn;
        private final Object cacheKeyParams;
        private final Map<String, Object> arguments;
        private final Instant deadline;
        private final List<CandidateFailure> failures = new ArrayList<>();
        private final Set<String> credentialRejected = new HashSet<>();

        FallbackRun(
                String operationName,
                List<ModelCandidate> candidates,
                CandidateRequest<T> requestFn,
                Object cacheKeyParams,
                Map<String, Object> arguments,
                Instant deadline) {
            this.operationName = operationName;
            this.candidates = candidates;
            this.requestFn = requestFn;
            this.cacheKeyParams = cacheKeyParams;
            this.arguments = arguments;
            this.deadline = deadline;
        }

        /** Returns the remaining budget, null without a deadline and zero once it has passed. */
        Duration remainingBudget(Instant now) {
            if (deadline == null) {
                return null;
            }
            Duration remaining = Duration.between(now, deadline);
            return remaining.isNegative() ? Duration.ZERO : remaining;
        }
    }
}
