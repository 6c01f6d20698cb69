package com.example.pdp.enforcer.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

public record UserTenantsQuery(
        @NotNull @Valid User user,
        Map<String, Object> context
) {
    public UserTenantsQuery {
        context = context == null ? Map.of() : context;
    }
}
