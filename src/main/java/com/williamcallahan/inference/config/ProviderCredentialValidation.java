package com.williamcallahan.inference.config;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Checks at startup that every provider with a built-in endpoint has its credential variable set.
 *
 * <p>Missing credentials are logged as warnings by default so the gateway can start with a partial
 * catalogue; with {@code app.inference.catalog.require-credentials=true} they halt startup instead.</p>
 */
@Configuration
public class ProviderCredentialValidation {
    private static final Logger log = LoggerFactory.getLogger(ProviderCredentialValidation.class);

    private final ProviderCatalogProperties catalog;
    private final Environment environment;

    ProviderCredentialValidation(ProviderCatalogProperties catalog, Environment environment) {
        this.catalog = catalog;
        this.environment = environment;
    }

    /**
     * Validates configured provider credentials.
     *
     * @throws IllegalStateException when credentials are required and any are missing
     */
    @PostConstruct
    public void validateProviderCredentials() {
        List<String> missing = missingCredentials();
        if (missing.isEmpty()) {
            log.info("Provider credential validation passed");
            return;
        }
        String message = "Missing API key environment variables for providers: " + String.join(", ", missing);
        if (catalog.isRequireCredentials()) {
            throw new IllegalStateException(message);
        }
        log.warn("{}; those providers will fail with authentication errors until configured", message);
    }

    /**
     * Lists providers none of whose credential variables resolve to a value.
     */
    List<String> missingCredentials() {
        List<String> missing = new ArrayList<>();
        for (ProviderCatalogProperties.ProviderEntry entry : catalog.getProviders()) {
            boolean hasEndpoint = entry.getBaseUrl() != null && !entry.getBaseUrl().isBlank();
            if (!entry.isEnabled() || !hasEndpoint) {
                continue;
            }
            List<String> keyEnvs = entry.credentialEnvs();
            if (keyEnvs.isEmpty()) {
                missing.add(entry.getName() + " (no api-key-env)");
                continue;
            }
            boolean anyResolved = keyEnvs.stream().anyMatch(keyEnv -> {
                String keyValue = environment.getProperty(keyEnv);
                return keyValue != null && !keyValue.isBlank();
            });
            if (!anyResolved) {
                missing.add(entry.getName() + " (" + String.join(", ", keyEnvs) + ")");
            }
        }
        return missing;
    }
}
