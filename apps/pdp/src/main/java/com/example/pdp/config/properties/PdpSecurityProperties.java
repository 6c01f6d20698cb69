package com.example.pdp.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Bearer-token protection of the decision endpoints.
 *
 * @param apiKey      token SDKs must present as {@code Authorization: Bearer <apiKey>}
 * @param publicPaths path prefixes served without a token
 */
@ConfigurationProperties(prefix = "pdp.security")
public record PdpSecurityProperties(
        String apiKey,
        List<String> publicPaths
) {
    public PdpSecurityProperties {
        if (publicPaths == null || publicPaths.isEmpty()) {
            publicPaths = List.of("/health", "/healthy", "/ready", "/actuator", "/kong");
        }
    }
}
