package com.williamcallahan.inference.client;

import com.williamcallahan.inference.config.AppProperties;
import com.williamcallahan.inference.domain.ProviderConfig;
import com.williamcallahan.inference.service.ModelRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Maps provider names to their clients.
 *
 * <p>Explicit {@link InferenceClient} beans take precedence; every remaining catalogue provider with a base URL
 * gets an {@link OpenAiCompatibleInferenceClient}.</p>
 */
@Component
public class InferenceClientRegistry {
    private static final Logger log = LoggerFactory.getLogger(InferenceClientRegistry.class);

    private final Map<String, InferenceClient> clients;

    @Autowired
    public InferenceClientRegistry(
            ObjectProvider<InferenceClient> clientBeans,
            ModelRegistry modelRegistry,
            WebClient.Builder webClientBuilder,
            AppProperties appProperties,
            Environment environment,
            Clock clock) {
        Map<String, InferenceClient> byProvider = new LinkedHashMap<>();
        clientBeans.orderedStream().forEach(client -> {
            if (byProvider.putIfAbsent(client.providerName(), client) != null) {
                throw new IllegalStateException("Multiple clients registered for provider " + client.providerName());
            }
        });
        for (ProviderConfig provider : modelRegistry.providers()) {
            if (provider.enabled() && provider.hasEndpoint() && !byProvider.containsKey(provider.name())) {
                List<String> apiKeys = new ArrayList<>();
                provider.apiKeyEnvs().forEach(keyEnv -> apiKeys.add(environment.getProperty(keyEnv)));
                byProvider.put(provider.name(), new OpenAiCompatibleInferenceClient(
                        provider,
                        apiKeys,
                        webClientBuilder,
                        appProperties.getOrchestrator().getAttemptTimeout(),
                        clock));
            }
        }
        this.clients = Collections.unmodifiableMap(byProvider);
        log.info("Registered inference clients for providers {}", clients.keySet());
    }

    /**
     * Creates a registry over fixed clients.
     */
    public InferenceClientRegistry(List<InferenceClient> clientList) {
        Map<String, InferenceClient> byProvider = new LinkedHashMap<>();
        clientList.forEach(client -> byProvider.put(client.providerName(), client));
        this.clients = Collections.unmodifiableMap(byProvider);
    }

    public Optional<InferenceClient> client(String providerName) {
        return Optional.ofNullable(clients.get(providerName));
    }

    /** Returns registered provider names in registration order. */
    public List<String> providerNames() {
        return List.copyOf(clients.keySet());
    }
}
