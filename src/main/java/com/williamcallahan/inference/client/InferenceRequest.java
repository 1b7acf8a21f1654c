package com.williamcallahan.inference.client;

import java.util.Objects;

/**
 * One generation call: a prompt for a specific model, optionally with an image.
 *
 * @param model upstream model identifier
 * @param prompt prompt text
 * @param imageData base64-encoded image, or null for text-only calls
 * @param imageMimeType image media type such as {@code image/png}, required when image data is present
 * @param credentialIndex zero-based index of the provider credential to authenticate with
 */
public record InferenceRequest(
        String model, String prompt, String imageData, String imageMimeType, int credentialIndex) {

    public InferenceRequest {
        Objects.requireNonNull(prompt, "prompt");
        if (imageData != null && (imageMimeType == null || imageMimeType.isBlank())) {
            throw new IllegalArgumentException("imageMimeType is required when imageData is present");
        }
        if (credentialIndex < 0) {
            throw new IllegalArgumentException("credentialIndex must be >= 0");
        }
    }

    public static InferenceRequest text(String prompt) {
        return new InferenceRequest(null, prompt, null, null, 0);
    }

    public static InferenceRequest withImage(String prompt, String imageData, String imageMimeType) {
        return new InferenceRequest(null, prompt, imageData, imageMimeType, 0);
    }

    /** Returns a copy addressed to the given model. */
    public InferenceRequest forModel(String modelId) {
        return new InferenceRequest(modelId, prompt, imageData, imageMimeType, credentialIndex);
    }

    /** Returns a copy authenticated with the given provider credential. */
    public InferenceRequest withCredential(int index) {
        return new InferenceRequest(model, prompt, imageData, imageMimeType, index);
    }

    public boolean hasImage() {
        return imageData != null && !imageData.isEmpty();
    }
}
