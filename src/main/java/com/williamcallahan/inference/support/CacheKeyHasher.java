package com.williamcallahan.inference.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds stable SHA-256 keys for cached provider responses.
 *
 * <p>Parameters are converted to plain JSON values with object keys sorted, so two parameter maps with the
 * same content hash identically regardless of insertion order.</p>
 */
public final class CacheKeyHasher {

    private final ObjectMapper objectMapper;
    private final int truncationLength;

    /**
     * Creates a hasher.
     *
     * @param truncationLength prefix length long string parameters are cut to before hashing, 0 to keep them whole
     */
    public CacheKeyHasher(int truncationLength) {
        if (truncationLength < 0) {
            throw new IllegalArgumentException("truncationLength must be >= 0");
        }
        this.truncationLength = truncationLength;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    /**
     * Hashes provider, operation and normalized parameters into a hex key.
     *
     * @param provider provider scope
     * @param method logical operation name
     * @param params request parameters, may be null
     * @return 64-character lowercase hex digest
     * @throws IllegalArgumentException when parameters cannot be serialized
     */
    public String cacheKey(String provider, String method, Object params) {
        return sha256(provider + ":" + method + ":" + canonicalJson(params));
    }

    /**
     * Renders parameters as canonical JSON.
     */
    public String canonicalJson(Object params) {
        if (params == null) {
            return "null";
        }
        try {
            Object plain = objectMapper.convertValue(params, Object.class);
            return objectMapper.writeValueAsString(canonicalize(plain));
        } catch (JsonProcessingException | IllegalArgumentException serializationFailure) {
            throw new IllegalArgumentException(
                    "Cache parameters are not serializable: " + serializationFailure.getMessage(), serializationFailure);
        }
    }

    private Object canonicalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((key, nested) -> sorted.put(String.valueOf(key), canonicalize(nested)));
            return sorted;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            collection.forEach(item -> items.add(canonicalize(item)));
            return items;
        }
        if (value instanceof String text && truncationLength > 0 && text.length() > truncationLength) {
            return text.substring(0, truncationLength);
        }
        return value;
    }

    /**
     * Generates a SHA-256 hex digest of UTF-8 text.
     */
    public static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
