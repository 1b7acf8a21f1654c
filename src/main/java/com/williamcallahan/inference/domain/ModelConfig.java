package com.williamcallahan.inference.domain;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable catalogue entry for one model exposed by a provider.
 *
 * <p>Runtime counters (rate-limited-until, successes, failures) are owned by the rate-limit
 * tracker so this record stays shareable across threads.</p>
 *
 * @param modelId upstream model identifier
 * @param provider owning provider name
 * @param contextLength context window in tokens
 * @param capabilities declared capabilities
 * @param requestsPerMinute per-model minute limit, 0 to inherit the provider limit
 * @param requestsPerDay per-model day limit, 0 to inherit the provider limit
 * @param priority rank within the provider, lower is preferred
 */
public record ModelConfig(
        String modelId,
        String provider,
        int contextLength,
        Set<ModelCapability> capabilities,
        int requestsPerMinute,
        int requestsPerDay,
        int priority) {

    public ModelConfig {
        Objects.requireNonNull(modelId, "modelId");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(capabilities, "capabilities");
        if (modelId.isBlank()) {
            throw new IllegalArgumentException("Model id must not be blank");
        }
        if (contextLength < 0 || requestsPerMinute < 0 || requestsPerDay < 0) {
            throw new IllegalArgumentException("Model " + modelId + " has negative limits");
        }
        capabilities = capabilities.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(capabilities));
    }

    /** Reports whether the model accepts image input. */
    public boolean supportsVision() {
        return capabilities.contains(ModelCapability.VISION);
    }

    /**
     * Resolves the effective per-minute limit, inheriting from the provider when unset.
     */
    public int effectiveRequestsPerMinute(ProviderConfig providerConfig) {
        return requestsPerMinute > 0 ? requestsPerMinute : providerConfig.requestsPerMinute();
    }

    /**
     * Resolves the effective per-day limit, inheriting from the provider when unset.
     */
    public int effectiveRequestsPerDay(ProviderConfig providerConfig) {
        return requestsPerDay > 0 ? requestsPerDay : providerConfig.requestsPerDay();
    }
}
