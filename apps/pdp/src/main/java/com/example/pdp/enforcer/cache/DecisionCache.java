package com.example.pdp.enforcer.cache;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

/**
 * Store of policy engine results keyed by query fingerprint.
 */
public interface DecisionCache {

    /**
     * @return the cached engine result, or empty on a miss
     */
    @NonNull
    Mono<JsonNode> get(@NonNull String key);

    @NonNull
    Mono<Void> put(@NonNull String key, @NonNull JsonNode result);

    @NonNull
    Mono<Void> invalidate(@NonNull String key);

    /**
     * Short store name used in logs, e.g. {@code memory}.
     */
    @NonNull
    String store();
}
