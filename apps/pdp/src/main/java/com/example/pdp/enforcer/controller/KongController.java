package com.example.pdp.enforcer.controller;

import com.example.pdp.config.properties.KongProperties;
import com.example.pdp.enforcer.kong.KongAuthorizationQuery;
import com.example.pdp.enforcer.kong.KongAuthorizationResult;
import com.example.pdp.enforcer.kong.KongAuthorizationService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Callback for Kong's OPA plugin. The gateway authenticates itself, so no PDP token is checked.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class KongController {

    private final KongAuthorizationService kongService;
    private final EnforcerRequestReader reader;
    private final KongProperties properties;

    @PostMapping("/kong")
    public Mono<KongAuthorizationResult> isAllowedKong(@RequestBody JsonNode body) {
        if (!properties.enabled()) {
            log.warn("Kong request received but the Kong integration is disabled");
            return Mono.error(new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE,
                    "Kong integration is disabled, set pdp.kong.enabled=true"));
        }
        return Mono.fromCallable(() -> reader.read(body, KongAuthorizationQuery.class))
                .flatMap(kongService::isAllowed);
    }
}
