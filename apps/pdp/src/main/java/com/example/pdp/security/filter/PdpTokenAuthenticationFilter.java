package com.example.pdp.security.filter;

import com.example.pdp.common.filter.FilterResponseUtils;
import com.example.pdp.config.properties.PdpSecurityProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Requires {@code Authorization: Bearer <api-key>} on every non-public path.
 * Rejected requests never reach a controller, so no engine call is made for them.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class PdpTokenAuthenticationFilter implements WebFilter {

    private static final String BEARER_SCHEME = "bearer";

    private final PdpSecurityProperties properties;
    private final ObjectMapper objectMapper;

    public PdpTokenAuthenticationFilter(PdpSecurityProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        if (!hasApiKey()) {
            log.warn("pdp.security.api-key is not set, all protected endpoints will answer 401");
        }
    }

    @Override
    @NonNull
    public Mono<Void> filter(@NonNull ServerWebExchange exchange, @NonNull WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();

        if (isPublicPath(path)) {
            return chain.filter(exchange);
        }

        String authorization = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization == null || authorization.isBlank()) {
            log.warn("Missing authorization header: path={}", path);
            return FilterResponseUtils.unauthorized(exchange, "MISSING_TOKEN",
                    "Missing Authorization header", objectMapper);
        }

        String token = extractBearerToken(authorization);
        if (token == null) {
            log.warn("Malformed authorization header: path={}", path);
            return FilterResponseUtils.unauthorized(exchange, "BAD_AUTHZ_HEADER",
                    "Authorization header must be 'Bearer <token>'", objectMapper);
        }

        if (!hasApiKey() || !tokenMatches(token)) {
            log.warn("Invalid PDP token: path={}", path);
            return FilterResponseUtils.unauthorized(exchange, "INVALID_TOKEN",
                    "Invalid PDP token", objectMapper);
        }

        return chain.filter(exchange);
    }

    @Nullable
    private String extractBearerToken(@NonNull String authorization) {
        String[] parts = authorization.trim().split("\\s+");
        if (parts.length != 2 || !BEARER_SCHEME.equalsIgnoreCase(parts[0])) {
            return null;
        }
        return parts[1];
    }

    private boolean tokenMatches(@NonNull String token) {
        return MessageDigest.isEqual(
                token.getBytes(StandardCharsets.UTF_8),
                properties.apiKey().getBytes(StandardCharsets.UTF_8));
    }

    private boolean hasApiKey() {
        return properties.apiKey() != null && !properties.apiKey().isBlank();
    }

    private boolean isPublicPath(@NonNull String path) {
        return properties.publicPaths().stream()
                .anyMatch(prefix -> path.equals(prefix) || path.startsWith(prefix + "/"));
    }
}
