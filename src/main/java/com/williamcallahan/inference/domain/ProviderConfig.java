package com.williamcallahan.inference.domain;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable per-provider limits and routing metadata loaded from the catalogue.
 *
 * @param name provider identifier used as the key for all runtime state
 * @param requestsPerMinute provider-wide per-minute request limit
 * @param requestsPerDay provider-wide per-day request limit
 * @param burstLimit maximum requests within one second, 0 when unlimited
 * @param cooldown reset window applied after a per-minute rate limit
 * @param priority routing rank, lower is preferred
 * @param baseUrl OpenAI-compatible endpoint base, null when the client is supplied elsewhere
 * @param apiKeyEnvs environment variables holding the provider credentials, in rotation order
 * @param enabled whether the provider takes traffic at all
 */
public record ProviderConfig(
        String name,
        int requestsPerMinute,
        int requestsPerDay,
        int burstLimit,
        Duration cooldown,
        int priority,
        String baseUrl,
        List<String> apiKeyEnvs,
        boolean enabled) {

    public ProviderConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(cooldown, "cooldown");
        apiKeyEnvs = apiKeyEnvs == null ? List.of() : List.copyOf(apiKeyEnvs);
        if (name.isBlank()) {
            throw new IllegalArgumentException("Provider name must not be blank");
        }
        if (requestsPerMinute <= 0 || requestsPerDay <= 0) {
            throw new IllegalArgumentException("Provider " + name + " must declare positive request limits");
        }
        if (burstLimit < 0) {
            throw new IllegalArgumentException("Provider " + name + " burst limit must be non-negative");
        }
        if (cooldown.isNegative() || cooldown.isZero()) {
            throw new IllegalArgumentException("Provider " + name + " cooldown must be positive");
        }
    }

    /**
     * Creates an enabled provider without a built-in client endpoint.
     */
    public static ProviderConfig of(String name, int requestsPerMinute, int requestsPerDay, int priority) {
        return new ProviderConfig(
                name, requestsPerMinute, requestsPerDay, 0, Duration.ofMinutes(1), priority, null, List.of(), true);
    }

    /**
     * Returns how many credentials the provider rotates through; a provider without configured keys has one
     * implicit credential.
     */
    public int credentialCount() {
        return Math.max(1, apiKeyEnvs.size());
    }

    /** Reports whether a built-in OpenAI-compatible client should be created for this provider. */
    public boolean hasEndpoint() {
        return baseUrl != null && !baseUrl.isBlank();
    }
}
