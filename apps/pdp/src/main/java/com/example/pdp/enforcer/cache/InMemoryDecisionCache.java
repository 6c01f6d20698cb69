package com.example.pdp.enforcer.cache;

import com.example.pdp.config.properties.DecisionCacheProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

/**
 * Process-local decision cache for single-instance deployments.
 */
@Slf4j
public class InMemoryDecisionCache implements DecisionCache {

    private final Cache<String, JsonNode> cache;

    public InMemoryDecisionCache(DecisionCacheProperties properties) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(properties.ttl())
                .maximumSize(properties.maxEntries())
                .build();
        log.info("In-memory decision cache initialized (ttl={}, max-entries={})",
                properties.ttl(), properties.maxEntries());
    }

    @Override
    @NonNull
    public Mono<JsonNode> get(@NonNull String key) {
        return Mono.fromCallable(() -> cache.getIfPresent(key));
    }

    @Override
    @NonNull
    public Mono<Void> put(@NonNull String key, @NonNull JsonNode result) {
        return Mono.fromRunnable(() -> cache.put(key, result.deepCopy()));
    }

    @Override
    @NonNull
    public Mono<Void> invalidate(@NonNull String key) {
        return Mono.fromRunnable(() -> cache.invalidate(key));
    }

    @Override
    @NonNull
    public String store() {
        return DecisionCacheProperties.STORE_MEMORY;
    }

    long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
