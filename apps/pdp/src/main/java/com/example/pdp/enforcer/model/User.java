package com.example.pdp.enforcer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record User(
        @NotBlank String key,
        @JsonProperty("firstName") String firstName,
        @JsonProperty("lastName") String lastName,
        String email,
        Map<String, Object> attributes
) {
    public User {
        attributes = attributes == null ? Map.of() : attributes;
    }

    public static User of(String key) {
        return new User(key, null, null, null, Map.of());
    }
}
