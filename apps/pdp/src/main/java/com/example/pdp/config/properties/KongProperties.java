package com.example.pdp.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Kong gateway integration.
 *
 * @param enabled    serve the {@code /kong} callback
 * @param debug      log every Kong input and decision
 * @param routesPath JSON list of {@code [regex, resource]} pairs
 */
@ConfigurationProperties(prefix = "pdp.kong")
public record KongProperties(
        boolean enabled,
        boolean debug,
        String routesPath
) {
    public KongProperties {
        if (routesPath == null || routesPath.isBlank()) {
            routesPath = "classpath:kong-routes.json";
        }
    }
}
