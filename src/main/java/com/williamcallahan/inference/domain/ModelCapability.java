package com.williamcallahan.inference.domain;

import com.williamcallahan.inference.support.AsciiTextNormalizer;

/**
 * Declares a property a model must have to be eligible for a request.
 */
public enum ModelCapability {
    /** Accepts image input alongside the prompt. */
    VISION,
    /** Tuned for multi-step reasoning output. */
    REASONING,
    /** Suitable for clinical and medical content. */
    MEDICAL,
    /** Can ground answers with live web search. */
    WEB_SEARCH;

    /**
     * Parses a capability name leniently (case-insensitive, dashes allowed).
     *
     * @param rawName configured or requested capability name
     * @return matching capability
     * @throws IllegalArgumentException when the name is blank or unknown
     */
    public static ModelCapability fromName(String rawName) {
        if (rawName == null || rawName.isBlank()) {
            throw new IllegalArgumentException("Capability name is required");
        }
        String normalized = AsciiTextNormalizer.toLowerAscii(rawName.trim()).replace('-', '_');
        for (ModelCapability capability : values()) {
            if (AsciiTextNormalizer.toLowerAscii(capability.name()).equals(normalized)) {
                return capability;
            }
        }
        throw new IllegalArgumentException("Unknown model capability: " + rawName);
    }
}
