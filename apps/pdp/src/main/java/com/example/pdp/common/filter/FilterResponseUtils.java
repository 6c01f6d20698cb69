package com.example.pdp.common.filter;

import com.example.pdp.common.util.StringSanitizer;
import com.example.pdp.exception.ErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Utility methods for building standardized error responses in WebFilters.
 * Uses ObjectMapper for safe JSON serialization to prevent injection attacks.
 */
@Slf4j
public final class FilterResponseUtils {

    private FilterResponseUtils() {}

    /**
     * Returns a 401 Unauthorized response with the given error details.
     */
    @NonNull
    public static Mono<Void> unauthorized(
            @NonNull ServerWebExchange exchange,
            @NonNull String code,
            @NonNull String message,
            @Nullable ObjectMapper objectMapper) {
        return error(exchange, HttpStatus.UNAUTHORIZED, ErrorResponse.Categories.AUTHENTICATION_REQUIRED,
                code, message, objectMapper);
    }

    /**
     * Returns an error response with full control over parameters.
     */
    @NonNull
    public static Mono<Void> error(
            @NonNull ServerWebExchange exchange,
            @NonNull HttpStatus status,
            @NonNull String error,
            @NonNull String code,
            @NonNull String message,
            @Nullable ObjectMapper objectMapper) {

        exchange.getResponse().setStatusCode(status);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);

        String path = exchange.getRequest().getPath().value();

        if (objectMapper != null) {
            try {
                ErrorResponse errorResponse = ErrorResponse.of(status.value(), error, message, path, code);
                String body = objectMapper.writeValueAsString(errorResponse);
                return writeResponse(exchange, body);
            } catch (Exception e) {
                log.warn("Failed to serialize error response with ObjectMapper: {}", e.getMessage());
                // Fall through to manual JSON building
            }
        }

        String body = buildSafeJson(status.value(), error, code, message);
        return writeResponse(exchange, body);
    }

    /**
     * Builds a minimal safe JSON response using StringSanitizer.escapeJson().
     */
    @NonNull
    private static String buildSafeJson(int status, @NonNull String error, @NonNull String code, @NonNull String message) {
        return "{\"status\":" + status
                + ",\"error\":\"" + StringSanitizer.escapeJson(error) + "\""
                + ",\"code\":\"" + StringSanitizer.escapeJson(code) + "\""
                + ",\"message\":\"" + StringSanitizer.escapeJson(message) + "\"}";
    }

    @NonNull
    private static Mono<Void> writeResponse(@NonNull ServerWebExchange exchange, @NonNull String body) {
        return exchange.getResponse()
                .writeWith(Mono.just(exchange.getResponse()
                        .bufferFactory()
                        .wrap(body.getBytes(StandardCharsets.UTF_8))));
    }
}
