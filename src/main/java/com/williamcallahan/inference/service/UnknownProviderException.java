package com.williamcallahan.inference.service;

/**
 * Raised when an operation names a provider that is not in the catalogue.
 */
public class UnknownProviderException extends RuntimeException {

    private final String provider;

    public UnknownProviderException(String provider) {
        super("Unknown provider: " + provider);
        this.provider = provider;
    }

    public String provider() {
        return provider;
    }
}
