package com.example.pdp.config;

import com.example.pdp.config.properties.DecisionCacheProperties;
import com.example.pdp.enforcer.cache.DecisionCache;
import com.example.pdp.enforcer.cache.InMemoryDecisionCache;
import com.example.pdp.enforcer.cache.NoOpDecisionCache;
import com.example.pdp.enforcer.cache.RedisDecisionCache;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Selects the decision cache store from {@code pdp.cache.*}.
 */
@Slf4j
@Configuration
public class DecisionCacheConfig {

    public static final String DECISION_CACHE_TEMPLATE = "decisionCacheTemplate";

    /**
     * Template for the redis store. Values are plain JSON trees, no type metadata is written.
     */
    @Bean(DECISION_CACHE_TEMPLATE)
    @ConditionalOnProperty(name = "pdp.cache.store", havingValue = DecisionCacheProperties.STORE_REDIS)
    public ReactiveRedisTemplate<String, JsonNode> decisionCacheTemplate(
            ReactiveRedisConnectionFactory connectionFactory,
            ObjectMapper objectMapper) {

        StringRedisSerializer keySerializer = new StringRedisSerializer();
        Jackson2JsonRedisSerializer<JsonNode> valueSerializer =
                new Jackson2JsonRedisSerializer<>(objectMapper, JsonNode.class);

        RedisSerializationContext<String, JsonNode> serializationContext =
                RedisSerializationContext.<String, JsonNode>newSerializationContext(keySerializer)
                        .key(keySerializer)
                        .value(valueSerializer)
                        .hashKey(keySerializer)
                        .hashValue(valueSerializer)
                        .build();

        return new ReactiveRedisTemplate<>(connectionFactory, serializationContext);
    }

    @Bean
    public DecisionCache decisionCache(
            DecisionCacheProperties properties,
            @Qualifier(DECISION_CACHE_TEMPLATE) ObjectProvider<ReactiveRedisTemplate<String, JsonNode>> redisTemplate) {

        if (!properties.enabled()) {
            log.info("Decision cache disabled");
            return new NoOpDecisionCache();
        }

        return switch (properties.store()) {
            case DecisionCacheProperties.STORE_MEMORY -> new InMemoryDecisionCache(properties);
            case DecisionCacheProperties.STORE_REDIS -> {
                ReactiveRedisTemplate<String, JsonNode> template = redisTemplate.getIfAvailable();
                if (template == null) {
                    throw new IllegalStateException("pdp.cache.store=redis requires a Redis connection");
                }
                yield new RedisDecisionCache(template, properties);
            }
            case DecisionCacheProperties.STORE_NONE -> new NoOpDecisionCache();
            default -> throw new IllegalStateException("Unknown decision cache store: " + properties.store());
        };
    }
}
