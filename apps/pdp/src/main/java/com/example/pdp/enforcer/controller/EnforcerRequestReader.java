package com.example.pdp.enforcer.controller;

import com.example.pdp.exception.OutdatedSdkException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebInputException;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Binds raw request bodies to query records. Bodies in the legacy v1 shape, where {@code user}
 * is a plain string, are rejected before binding.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnforcerRequestReader {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    @NonNull
    public <T> T read(@Nullable JsonNode body, @NonNull Class<T> type) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            throw new ServerWebInputException("Request body is required");
        }
        rejectLegacyShape(body);
        T query = bind(body, type);
        validate(query);
        return query;
    }

    /**
     * @throws OutdatedSdkException if the body, or any element of a body list, has a string {@code user}
     */
    void rejectLegacyShape(@NonNull JsonNode body) {
        if (isLegacy(body)) {
            throw new OutdatedSdkException();
        }
        JsonNode elements = body.isArray() ? body : body.path("checks");
        for (JsonNode element : elements) {
            if (isLegacy(element)) {
                throw new OutdatedSdkException();
            }
        }
    }

    private static boolean isLegacy(JsonNode node) {
        return node.isObject() && node.path("user").isTextual();
    }

    private <T> T bind(JsonNode body, Class<T> type) {
        try {
            T query = objectMapper.treeToValue(body, type);
            if (query == null) {
                throw new ServerWebInputException("Request body is required");
            }
            return query;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Cannot bind {} body: {}", type.getSimpleName(), e.getMessage());
            throw new ServerWebInputException("Invalid " + type.getSimpleName() + " body", null, e);
        }
    }

    private <T> void validate(T query) {
        Set<ConstraintViolation<T>> violations = validator.validate(query);
        if (!violations.isEmpty()) {
            String errors = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .collect(Collectors.joining(", "));
            throw new ServerWebInputException("Validation failed: " + errors);
        }
    }
}
