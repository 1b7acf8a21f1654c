package com.williamcallahan.inference.client;

/**
 * Single call contract for a vendor model API.
 *
 * <p>Implementations block until the upstream answers; callers run them off the request thread and bound
 * them with their own deadline.</p>
 */
public interface InferenceClient {

    /**
     * Returns the catalogue name of the provider this client talks to.
     */
    String providerName();

    /**
     * Generates text for the request.
     *
     * @param request prompt, optional image and target model
     * @return generated text
     * @throws ProviderCallException when the provider rejects or fails the call
     */
    String generate(InferenceRequest request);
}
