package com.example.pdp.enforcer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserPermissionsQuery(
        @NotNull @Valid User user,
        List<String> tenants,
        List<String> resources,
        @JsonProperty("resource_types") List<String> resourceTypes,
        Map<String, Object> context
) {
    public UserPermissionsQuery {
        context = context == null ? Map.of() : context;
    }
}
