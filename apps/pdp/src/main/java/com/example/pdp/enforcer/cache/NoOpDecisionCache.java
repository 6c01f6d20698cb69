package com.example.pdp.enforcer.cache;

import com.example.pdp.config.properties.DecisionCacheProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

/**
 * Cache that never holds anything. Used when caching is disabled.
 */
public class NoOpDecisionCache implements DecisionCache {

    @Override
    @NonNull
    public Mono<JsonNode> get(@NonNull String key) {
        return Mono.empty();
    }

    @Override
    @NonNull
    public Mono<Void> put(@NonNull String key, @NonNull JsonNode result) {
        return Mono.empty();
    }

    @Override
    @NonNull
    public Mono<Void> invalidate(@NonNull String key) {
        return Mono.empty();
    }

    @Override
    @NonNull
    public String store() {
        return DecisionCacheProperties.STORE_NONE;
    }
}
