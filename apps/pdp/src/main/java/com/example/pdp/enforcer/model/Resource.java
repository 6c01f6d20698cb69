package com.example.pdp.enforcer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Resource(
        @NotBlank String type,
        String key,
        String tenant,
        Map<String, Object> attributes,
        Map<String, Object> context
) {
    public Resource {
        attributes = attributes == null ? Map.of() : attributes;
        context = context == null ? Map.of() : context;
    }

    public static Resource ofType(String type) {
        return new Resource(type, null, null, Map.of(), Map.of());
    }
}
