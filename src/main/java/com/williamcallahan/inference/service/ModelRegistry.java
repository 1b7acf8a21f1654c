package com.williamcallahan.inference.service;

import com.williamcallahan.inference.config.ProviderCatalogProperties;
import com.williamcallahan.inference.domain.CapabilityRequirement;
import com.williamcallahan.inference.domain.ModelCandidate;
import com.williamcallahan.inference.domain.ModelConfig;
import com.williamcallahan.inference.domain.ProviderConfig;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Immutable catalogue of providers and models, loaded once at startup.
 *
 * <p>Ranking orders candidates by provider priority, then model priority, then declaration order.</p>
 */
@Service
public class ModelRegistry {
    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final Map<String, ProviderConfig> providersByName;
    private final Map<String, List<ModelConfig>> modelsByProvider;
    private final List<ModelCandidate> declarationOrder;

    /**
     * Builds the registry from the bound catalogue.
     *
     * @param catalog bound catalogue properties
     * @throws IllegalStateException when the catalogue is invalid
     */
    @Autowired
    public ModelRegistry(ProviderCatalogProperties catalog) {
        this(convert(Objects.requireNonNull(catalog, "catalog")));
    }

    /**
     * Builds the registry from already converted provider and model entries.
     *
     * @param catalogue providers mapped to their models, in declaration order
     * @throws IllegalStateException when a model references another provider or names repeat
     */
    public ModelRegistry(Map<ProviderConfig, List<ModelConfig>> catalogue) {
        Objects.requireNonNull(catalogue, "catalogue");
        Map<String, ProviderConfig> providers = new LinkedHashMap<>();
        Map<String, List<ModelConfig>> models = new LinkedHashMap<>();
        List<ModelCandidate> ordered = new ArrayList<>();
        for (Map.Entry<ProviderConfig, List<ModelConfig>> entry : catalogue.entrySet()) {
            ProviderConfig provider = entry.getKey();
            if (providers.putIfAbsent(provider.name(), provider) != null) {
                throw new IllegalStateException("Duplicate provider in catalogue: " + provider.name());
            }
            Set<String> modelIds = new HashSet<>();
            List<ModelConfig> providerModels = new ArrayList<>();
            for (ModelConfig model : entry.getValue()) {
                if (!provider.name().equals(model.provider())) {
                    throw new IllegalStateException("Model " + model.modelId() + " references provider "
                            + model.provider() + " but is declared under " + provider.name());
                }
                if (!modelIds.add(model.modelId())) {
                    throw new IllegalStateException(
                            "Duplicate model " + model.modelId() + " for provider " + provider.name());
                }
                providerModels.add(model);
                ordered.add(new ModelCandidate(provider, model));
            }
            models.put(provider.name(), List.copyOf(providerModels));
        }
        this.providersByName = Collections.unmodifiableMap(providers);
        this.modelsByProvider = Collections.unmodifiableMap(models);
        this.declarationOrder = List.copyOf(ordered);
        log.info("Model registry loaded {} providers with {} models", providers.size(), ordered.size());
    }

    private static Map<ProviderConfig, List<ModelConfig>> convert(ProviderCatalogProperties catalog) {
        Map<ProviderConfig, List<ModelConfig>> converted = new LinkedHashMap<>();
        for (ProviderCatalogProperties.ProviderEntry entry : catalog.getProviders()) {
            try {
                ProviderConfig provider = entry.toProviderConfig();
                List<ModelConfig> models = new ArrayList<>();
                for (ProviderCatalogProperties.ModelEntry modelEntry : entry.getModels()) {
                    models.add(modelEntry.toModelConfig(provider.name()));
                }
                if (converted.containsKey(provider)) {
                    throw new IllegalStateException("Duplicate provider in catalogue: " + provider.name());
                }
                converted.put(provider, models);
            } catch (IllegalArgumentException | NullPointerException invalidEntry) {
                throw new IllegalStateException(
                        "Invalid catalogue entry for provider " + entry.getName() + ": " + invalidEntry.getMessage(),
                        invalidEntry);
            }
        }
        return converted;
    }

    /**
     * Returns every enabled model satisfying the requirement, best candidate first.
     *
     * @param requirement capabilities and minimum context the request needs
     * @return ordered candidates, empty when nothing qualifies
     */
    public List<ModelCandidate> rankCandidates(CapabilityRequirement requirement) {
        Objects.requireNonNull(requirement, "requirement");
        List<ModelCandidate> eligible = new ArrayList<>();
        for (ModelCandidate candidate : declarationOrder) {
            if (candidate.provider().enabled() && requirement.isSatisfiedBy(candidate.model())) {
                eligible.add(candidate);
            }
        }
        // List.sort is stable, so declaration order breaks remaining ties
        eligible.sort(Comparator.comparingInt((ModelCandidate candidate) -> candidate.provider().priority())
                .thenComparingInt(candidate -> candidate.model().priority()));
        return List.copyOf(eligible);
    }

    public Optional<ProviderConfig> provider(String name) {
        return Optional.ofNullable(providersByName.get(name));
    }

    /** Returns all providers in priority order, disabled ones included. */
    public List<ProviderConfig> providers() {
        List<ProviderConfig> sorted = new ArrayList<>(providersByName.values());
        sorted.sort(Comparator.comparingInt(ProviderConfig::priority));
        return List.copyOf(sorted);
    }

    public List<ModelConfig> models(String providerName) {
        return modelsByProvider.getOrDefault(providerName, List.of());
    }

    /**
     * Returns the preferred model of a provider, used for health probes.
     */
    public Optional<ModelConfig> defaultModel(String providerName) {
        return models(providerName).stream().min(Comparator.comparingInt(ModelConfig::priority));
    }

    /**
     * Resolves the candidate for a provider/model pair.
     */
    public Optional<ModelCandidate> candidate(String providerName, String modelId) {
        ProviderConfig provider = providersByName.get(providerName);
        if (provider == null) {
            return Optional.empty();
        }
        return models(providerName).stream()
                .filter(model -> model.modelId().equals(modelId))
                .findFirst()
                .map(model -> new ModelCandidate(provider, model));
    }

    public boolean isKnownProvider(String name) {
        return providersByName.containsKey(name);
    }
}
