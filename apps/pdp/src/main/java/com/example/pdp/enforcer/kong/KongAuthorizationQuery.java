package com.example.pdp.enforcer.kong;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * Body Kong's OPA plugin posts for every proxied request. Only the fields used for the decision
 * are typed; service and route are kept as raw JSON.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KongAuthorizationQuery(@NotNull @Valid Input input) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Input(
            @NotNull @Valid Request request,
            @JsonProperty("client_ip") String clientIp,
            JsonNode service,
            JsonNode route,
            Consumer consumer
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Request(@NotNull @Valid Http http) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Http(
            String host,
            Integer port,
            @NotBlank String method,
            String scheme,
            @NotBlank String path,
            Map<String, Object> querystring,
            Map<String, Object> headers
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Consumer(String id, String username) {
    }
}
