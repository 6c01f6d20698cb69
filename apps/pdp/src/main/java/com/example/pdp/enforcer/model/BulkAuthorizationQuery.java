package com.example.pdp.enforcer.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.stream.Collectors;

public record BulkAuthorizationQuery(
        @NotNull List<@Valid @NotNull AuthorizationQuery> checks
) {
    public String describe() {
        return checks.stream()
                .map(AuthorizationQuery::describe)
                .collect(Collectors.joining(" | "));
    }
}
