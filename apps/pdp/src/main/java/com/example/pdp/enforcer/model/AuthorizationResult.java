package com.example.pdp.enforcer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Decision for a single check. {@code result} mirrors {@code allow} for older SDKs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthorizationResult(
        boolean allow,
        JsonNode query,
        JsonNode debug,
        boolean result
) {
    public static AuthorizationResult denied() {
        return new AuthorizationResult(false, null, null, false);
    }

    public static AuthorizationResult denied(JsonNode debug) {
        return new AuthorizationResult(false, null, debug, false);
    }
}
