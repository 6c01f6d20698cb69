package com.example.pdp.enforcer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * A single check: may {@code user} perform {@code action} on {@code resource}?
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthorizationQuery(
        @NotNull @Valid User user,
        @NotBlank String action,
        @NotNull @Valid Resource resource,
        Map<String, Object> context,
        String sdk
) {
    public AuthorizationQuery {
        context = context == null ? Map.of() : context;
    }

    /**
     * Short form used in decision logs: {@code (user, action, resourceType)}.
     */
    public String describe() {
        return "(" + user.key() + ", " + action + ", " + resource.type() + ")";
    }
}
