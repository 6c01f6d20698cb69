package com.example.pdp.enforcer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Tenants in which the check is allowed; each entry carries {@code tenant} plus the decision fields.
 */
public record AllTenantsAuthorizationResult(
        @JsonProperty("allowed_tenants") List<JsonNode> allowedTenants
) {
    public AllTenantsAuthorizationResult {
        allowedTenants = List.copyOf(allowedTenants);
    }

    public static AllTenantsAuthorizationResult none() {
        return new AllTenantsAuthorizationResult(List.of());
    }
}
