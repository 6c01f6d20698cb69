package com.example.pdp.enforcer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * A check expressed as an HTTP request; resolved to a resource and action through mapping rules.
 */
public record UrlAuthorizationQuery(
        @NotNull @Valid User user,
        @NotBlank @JsonProperty("http_method") String httpMethod,
        @NotBlank String url,
        @NotBlank String tenant,
        Map<String, Object> context,
        String sdk
) {
    public UrlAuthorizationQuery {
        context = context == null ? Map.of() : context;
    }
}
