package com.williamcallahan.inference.domain;

import java.util.Objects;

/**
 * Couples a model with its provider configuration for one routing decision.
 *
 * @param provider provider limits and metadata
 * @param model model catalogue entry
 */
public record ModelCandidate(ProviderConfig provider, ModelConfig model) {

    public ModelCandidate {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(model, "model");
        if (!provider.name().equals(model.provider())) {
            throw new IllegalArgumentException(
                    "Model " + model.modelId() + " does not belong to provider " + provider.name());
        }
    }

    public String providerName() {
        return provider.name();
    }

    public String modelId() {
        return model.modelId();
    }

    /** Renders the candidate as {@code provider/model} for logs and failure reports. */
    public String label() {
        return provider.name() + "/" + model.modelId();
    }
}
