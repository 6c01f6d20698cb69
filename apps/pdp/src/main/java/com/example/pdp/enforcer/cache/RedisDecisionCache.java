package com.example.pdp.enforcer.cache;

import com.example.pdp.config.properties.DecisionCacheProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Decision cache shared by every instance through Redis.
 */
@Slf4j
public class RedisDecisionCache implements DecisionCache {

    private final ReactiveRedisTemplate<String, JsonNode> redisTemplate;
    private final Duration ttl;

    public RedisDecisionCache(ReactiveRedisTemplate<String, JsonNode> redisTemplate,
                              DecisionCacheProperties properties) {
        this.redisTemplate = redisTemplate;
        this.ttl = properties.ttl();
        log.info("Redis decision cache initialized (ttl={})", ttl);
    }

    @Override
    @NonNull
    public Mono<JsonNode> get(@NonNull String key) {
        return redisTemplate.opsForValue()
                .get(key)
                .doOnNext(v -> log.debug("Cache hit in Redis for key: {}", key));
    }

    @Override
    @NonNull
    public Mono<Void> put(@NonNull String key, @NonNull JsonNode result) {
        return redisTemplate.opsForValue()
                .set(key, result, ttl)
                .doOnNext(stored -> {
                    if (!Boolean.TRUE.equals(stored)) {
                        log.warn("Redis did not store decision for key: {}", key);
                    }
                })
                .then();
    }

    @Override
    @NonNull
    public Mono<Void> invalidate(@NonNull String key) {
        return redisTemplate.delete(key)
                .doOnSuccess(count -> log.debug("Invalidated decision in Redis for key: {}", key))
                .then();
    }

    @Override
    @NonNull
    public String store() {
        return DecisionCacheProperties.STORE_REDIS;
    }
}
