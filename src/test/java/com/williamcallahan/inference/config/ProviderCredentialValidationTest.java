package com.williamcallahan.inference.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

/**
 * Verifies startup credential checks for providers with built-in endpoints.
 */
class ProviderCredentialValidationTest {

    private static ProviderCatalogProperties.ProviderEntry entry(String name, String baseUrl, String keyEnv) {
        ProviderCatalogProperties.ProviderEntry entry = new ProviderCatalogProperties.ProviderEntry();
        entry.setName(name);
        entry.setBaseUrl(baseUrl);
        entry.setApiKeyEnv(keyEnv);
        return entry;
    }

    private static ProviderCatalogProperties catalog(ProviderCatalogProperties.ProviderEntry... entries) {
        ProviderCatalogProperties catalog = new ProviderCatalogProperties();
        catalog.setProviders(List.of(entries));
        return catalog;
    }

    @Test
    void reportsOnlyEndpointProvidersWithoutKeys() {
        ProviderCatalogProperties.ProviderEntry disabled = entry("together", "https://api.together.xyz/v1", "TOGETHER_API_KEY");
        disabled.setEnabled(false);
        ProviderCatalogProperties catalog = catalog(
                entry("groq", "https://api.groq.com/openai/v1", "GROQ_API_KEY"),
                entry("gemini", "https://generativelanguage.googleapis.com/v1beta/openai", "GEMINI_API_KEY"),
                entry("local", null, null),
                disabled);
        MockEnvironment environment = new MockEnvironment().withProperty("GEMINI_API_KEY", "g-key");

        ProviderCredentialValidation validation = new ProviderCredentialValidation(catalog, environment);

        assertEquals(List.of("groq (GROQ_API_KEY)"), validation.missingCredentials());
        assertDoesNotThrow(validation::validateProviderCredentials);
    }

    @Test
    void failsStartupWhenCredentialsAreRequired() {
        ProviderCatalogProperties catalog = catalog(entry("groq", "https://api.groq.com/openai/v1", "GROQ_API_KEY"));
        catalog.setRequireCredentials(true);

        ProviderCredentialValidation validation = new ProviderCredentialValidation(catalog, new MockEnvironment());

        assertThrows(IllegalStateException.class, validation::validateProviderCredentials);
    }

    @Test
    void providerWithAnyResolvedRotationKeyIsNotMissing() {
        ProviderCatalogProperties.ProviderEntry groq = entry("groq", "https://api.groq.com/openai/v1", "GROQ_API_KEY");
        groq.setApiKeyEnvs(List.of("GROQ_API_KEY_2", "GROQ_API_KEY"));
        ProviderCatalogProperties.ProviderEntry openrouter =
                entry("openrouter", "https://openrouter.ai/api/v1", "OPENROUTER_API_KEY");
        openrouter.setApiKeyEnvs(List.of("OPENROUTER_API_KEY_2"));
        MockEnvironment environment = new MockEnvironment().withProperty("GROQ_API_KEY_2", "second-key");

        ProviderCredentialValidation validation =
                new ProviderCredentialValidation(catalog(groq, openrouter), environment);

        assertEquals(List.of("GROQ_API_KEY", "GROQ_API_KEY_2"), groq.credentialEnvs());
        assertEquals(List.of("openrouter (OPENROUTER_API_KEY, OPENROUTER_API_KEY_2)"), validation.missingCredentials());
    }

    @Test
    void treatsBlankKeyAsMissing() {
        ProviderCatalogProperties catalog = catalog(entry("groq", "https://api.groq.com/openai/v1", "GROQ_API_KEY"));
        MockEnvironment environment = new MockEnvironment().withProperty("GROQ_API_KEY", " ");

        ProviderCredentialValidation validation = new ProviderCredentialValidation(catalog, environment);

        assertEquals(1, validation.missingCredentials().size());
    }
}
