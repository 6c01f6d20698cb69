package com.example.pdp.common.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.lang.NonNull;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Utility methods for decision cache keys.
 *
 * <p>A key is a prefix naming the query shape plus a fingerprint of the whole query, so the
 * acting user and every filter take part in the key.</p>
 */
public final class CacheKeyUtils {

    private CacheKeyUtils() {}

    /**
     * Builds {@code <prefix>:<fingerprint>} where the fingerprint is the hex SHA-256
     * of the query's canonical JSON (keys sorted).
     */
    @NonNull
    public static String key(@NonNull String prefix, @NonNull Object query, @NonNull ObjectMapper objectMapper) {
        return sanitize(prefix) + ":" + fingerprint(query, objectMapper);
    }

    @NonNull
    public static String fingerprint(@NonNull Object query, @NonNull ObjectMapper objectMapper) {
        try {
            JsonNode tree = objectMapper.valueToTree(query);
            Object canonical = objectMapper.treeToValue(tree, Object.class);
            byte[] json = objectMapper.writer()
                    .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                    .writeValueAsBytes(canonical);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json);
            return HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize query for cache key", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Sanitizes a key part by replacing whitespace and control characters.
     *
     * @throws IllegalArgumentException if the part is null or blank
     */
    @NonNull
    public static String sanitize(@NonNull String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Cache key cannot be null or blank");
        }
        return key.replaceAll("[\\s\\n\\r\\t]", "_");
    }
}
