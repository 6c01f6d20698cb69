package com.example.pdp.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Where URL mapping rules come from: a static JSON catalog ({@code static}) or the engine's
 * {@code mapping_rules} document ({@code policy-engine}).
 */
@ConfigurationProperties(prefix = "pdp.mapping-rules")
public record MappingRulesProperties(
        String source,
        String path,
        Duration refreshInterval
) {
    public static final String SOURCE_STATIC = "static";
    public static final String SOURCE_POLICY_ENGINE = "policy-engine";

    public MappingRulesProperties {
        if (source == null || source.isBlank()) {
            source = SOURCE_STATIC;
        }
        if (path == null || path.isBlank()) {
            path = "classpath:mapping-rules.json";
        }
        if (refreshInterval == null) {
            refreshInterval = Duration.ofSeconds(30);
        }
    }
}
