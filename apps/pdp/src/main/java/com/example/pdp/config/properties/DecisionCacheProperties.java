package com.example.pdp.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Decision cache settings. The store is one of {@code memory}, {@code redis} or {@code none}.
 */
@ConfigurationProperties(prefix = "pdp.cache")
public record DecisionCacheProperties(
        boolean enabled,
        String store,
        Duration ttl,
        Integer maxEntries
) {
    public static final String STORE_MEMORY = "memory";
    public static final String STORE_REDIS = "redis";
    public static final String STORE_NONE = "none";

    public DecisionCacheProperties {
        if (store == null || store.isBlank()) {
            store = STORE_MEMORY;
        }
        if (ttl == null) {
            ttl = Duration.ofHours(1);
        }
        if (maxEntries == null || maxEntries <= 0) {
            maxEntries = 10_000;
        }
    }

    public static DecisionCacheProperties defaults() {
        return new DecisionCacheProperties(false, null, null, null);
    }
}
