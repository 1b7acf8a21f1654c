package com.williamcallahan.inference.domain;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Describes what a candidate model must support to serve a request.
 *
 * @param capabilities capabilities every candidate must declare
 * @param minContextLength minimum context window in tokens, 0 when unconstrained
 */
public record CapabilityRequirement(Set<ModelCapability> capabilities, int minContextLength) {

    public CapabilityRequirement {
        Objects.requireNonNull(capabilities, "capabilities");
        if (minContextLength < 0) {
            throw new IllegalArgumentException("minContextLength must be non-negative");
        }
        capabilities = capabilities.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(capabilities));
    }

    /** Matches every model in the catalogue. */
    public static CapabilityRequirement any() {
        return new CapabilityRequirement(Set.of(), 0);
    }

    /** Matches models declaring all of the given capabilities. */
    public static CapabilityRequirement of(ModelCapability first, ModelCapability... rest) {
        return new CapabilityRequirement(EnumSet.of(first, rest), 0);
    }

    /** Matches vision-capable models only. */
    public static CapabilityRequirement vision() {
        return of(ModelCapability.VISION);
    }

    /**
     * Returns a copy that additionally requires a minimum context window.
     */
    public CapabilityRequirement withMinContextLength(int tokens) {
        return new CapabilityRequirement(capabilities, tokens);
    }

    /**
     * Reports whether the model satisfies this requirement.
     */
    public boolean isSatisfiedBy(ModelConfig model) {
        return model.capabilities().containsAll(capabilities) && model.contextLength() >= minContextLength;
    }
}
