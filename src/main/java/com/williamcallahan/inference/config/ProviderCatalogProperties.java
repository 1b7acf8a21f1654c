package com.williamcallahan.inference.config;

import com.williamcallahan.inference.domain.ModelCapability;
import com.williamcallahan.inference.domain.ModelConfig;
import com.williamcallahan.inference.domain.ProviderConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Declarative provider and model catalogue bound from {@code app.inference.catalog}.
 *
 * <p>Entries are mutable binding targets; {@link com.williamcallahan.inference.service.ModelRegistry}
 * converts them once into immutable {@link ProviderConfig} and {@link ModelConfig} records.</p>
 */
@Component
@ConfigurationProperties(prefix = "app.inference.catalog")
public class ProviderCatalogProperties {

    private boolean requireCredentials = false;
    private List<ProviderEntry> providers = new ArrayList<>();

    /** When true, a provider endpoint whose key variable is unset fails startup instead of logging a warning. */
    public boolean isRequireCredentials() {
        return requireCredentials;
    }

    public void setRequireCredentials(boolean requireCredentials) {
        this.requireCredentials = requireCredentials;
    }

    public List<ProviderEntry> getProviders() {
        return providers;
    }

    public void setProviders(List<ProviderEntry> providers) {
        this.providers = providers;
    }

    public static class ProviderEntry {
        private String name;
        private int requestsPerMinute = 60;
        private int requestsPerDay = 1000;
        private int burstLimit = 0;
        private Duration cooldown = Duration.ofMinutes(1);
        private int priority = 100;
        private String baseUrl;
        private String apiKeyEnv;
        private List<String> apiKeyEnvs = new ArrayList<>();
        private boolean enabled = true;
        private List<ModelEntry> models = new ArrayList<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public int getRequestsPerMinute() { return requestsPerMinute; }
        public void setRequestsPerMinute(int requestsPerMinute) { this.requestsPerMinute = requestsPerMinute; }

        public int getRequestsPerDay() { return requestsPerDay; }
        public void setRequestsPerDay(int requestsPerDay) { this.requestsPerDay = requestsPerDay; }

        public int getBurstLimit() { return burstLimit; }
        public void setBurstLimit(int burstLimit) { this.burstLimit = burstLimit; }

        public Duration getCooldown() { return cooldown; }
        public void setCooldown(Duration cooldown) { this.cooldown = cooldown; }

        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKeyEnv() { return apiKeyEnv; }
        public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }

        public List<String> getApiKeyEnvs() { return apiKeyEnvs; }
        public void setApiKeyEnvs(List<String> apiKeyEnvs) { this.apiKeyEnvs = apiKeyEnvs; }

        /**
         * Returns the credential variables in rotation order: {@code api-key-env} first, then {@code api-key-envs}.
         */
        public List<String> credentialEnvs() {
            List<String> envs = new ArrayList<>();
            if (apiKeyEnv != null && !apiKeyEnv.isBlank()) {
                envs.add(apiKeyEnv.trim());
            }
            if (apiKeyEnvs != null) {
                for (String env : apiKeyEnvs) {
                    if (env != null && !env.isBlank() && !envs.contains(env.trim())) {
                        envs.add(env.trim());
                    }
                }
            }
            return envs;
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public List<ModelEntry> getModels() { return models; }
        public void setModels(List<ModelEntry> models) { this.models = models; }

        /**
         * Converts the bound entry into its immutable form.
         *
         * @throws IllegalArgumentException when limits or names are invalid
         */
        public ProviderConfig toProviderConfig() {
            return new ProviderConfig(
                    name, requestsPerMinute, requestsPerDay, burstLimit, cooldown, priority, baseUrl,
                    credentialEnvs(), enabled);
        }
    }

    public static class ModelEntry {
        private String id;
        private int contextLength = 8192;
        private List<ModelCapability> capabilities = new ArrayList<>();
        private int requestsPerMinute = 0;
        private int requestsPerDay = 0;
        private int priority = 100;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public int getContextLength() { return contextLength; }
        public void setContextLength(int contextLength) { this.contextLength = contextLength; }

        public List<ModelCapability> getCapabilities() { return capabilities; }
        public void setCapabilities(List<ModelCapability> capabilities) { this.capabilities = capabilities; }

        public int getRequestsPerMinute() { return requestsPerMinute; }
        public void setRequestsPerMinute(int requestsPerMinute) { this.requestsPerMinute = requestsPerMinute; }

        public int getRequestsPerDay() { return requestsPerDay; }
        public void setRequestsPerDay(int requestsPerDay) { this.requestsPerDay = requestsPerDay; }

        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }

        /**
         * Converts the bound entry into its immutable form, owned by the named provider.
         */
        public ModelConfig toModelConfig(String providerName) {
            EnumSet<ModelCapability> capabilitySet = EnumSet.noneOf(ModelCapability.class);
            if (capabilities != null) {
                capabilitySet.addAll(capabilities);
            }
            return new ModelConfig(
                    id, providerName, contextLength, capabilitySet, requestsPerMinute, requestsPerDay, priority);
        }
    }
}
