package com.example.pdp.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for the local policy engine.
 *
 * @param url            base URL of the engine, e.g. {@code http://localhost:8181}
 * @param timeout        timeout for a single query; exceeding it resolves to the fallback decision
 * @param connectTimeout TCP connect timeout
 * @param token          optional bearer token sent to the engine
 */
@ConfigurationProperties(prefix = "pdp.policy-engine")
public record PolicyEngineProperties(
        String url,
        Duration timeout,
        Duration connectTimeout,
        String token
) {
    public PolicyEngineProperties {
        if (url == null || url.isBlank()) {
            url = "http://localhost:8181";
        }
        if (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(1);
        }
        if (connectTimeout == null) {
            connectTimeout = Duration.ofSeconds(1);
        }
    }

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }

    public static PolicyEngineProperties defaults() {
        return new PolicyEngineProperties(null, null, null, null);
    }
}
