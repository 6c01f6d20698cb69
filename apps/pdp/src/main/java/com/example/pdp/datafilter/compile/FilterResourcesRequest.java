package com.example.pdp.datafilter.compile;

import com.example.pdp.enforcer.model.User;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * Which resources of {@code resource.type} may {@code user} perform {@code action} on?
 */
public record FilterResourcesRequest(
        @NotNull @Valid User user,
        @NotBlank String action,
        @NotNull @Valid ResourceType resource,
        Map<String, Object> context
) {
    public FilterResourcesRequest {
        context = context == null ? Map.of() : context;
    }

    public record ResourceType(@NotBlank String type) {
    }
}
