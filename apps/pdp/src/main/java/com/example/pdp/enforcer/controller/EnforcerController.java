package com.example.pdp.enforcer.controller;

import com.example.pdp.enforcer.model.AllTenantsAuthorizationResult;
import com.example.pdp.enforcer.model.AuthorizationQuery;
import com.example.pdp.enforcer.model.AuthorizationResult;
import com.example.pdp.enforcer.model.BulkAuthorizationQuery;
import com.example.pdp.enforcer.model.BulkAuthorizationResult;
import com.example.pdp.enforcer.model.CacheDirectives;
import com.example.pdp.enforcer.model.UrlAuthorizationQuery;
import com.example.pdp.enforcer.model.UserPermissionsQuery;
import com.example.pdp.enforcer.model.UserTenantsQuery;
import com.example.pdp.enforcer.service.AuthorizationRouter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequiredArgsConstructor
public class EnforcerController {

    private final AuthorizationRouter router;
    private final EnforcerRequestReader reader;

    @PostMapping("/allowed")
    public Mono<AuthorizationResult> isAllowed(
            @RequestBody JsonNode body,
            @RequestHeader(value = HttpHeaders.CACHE_CONTROL, required = false) String cacheControl) {

        return Mono.fromCallable(() -> reader.read(body, AuthorizationQuery.class))
                .flatMap(query -> router.isAllowed(query, CacheDirectives.fromHeader(cacheControl)));
    }

    /**
     * Accepts {@code {"checks": [...]}} or a bare list of checks.
     */
    @PostMapping("/allowed/bulk")
    public Mono<BulkAuthorizationResult> isAllowedBulk(
            @RequestBody JsonNode body,
            @RequestHeader(value = HttpHeaders.CACHE_CONTROL, required = false) String cacheControl) {

        return Mono.fromCallable(() -> reader.read(wrapChecks(body), BulkAuthorizationQuery.class))
                .flatMap(query -> router.isAllowedBulk(query, CacheDirectives.fromHeader(cacheControl)));
    }

    @PostMapping("/allowed/all-tenants")
    public Mono<AllTenantsAuthorizationResult> isAllowedAllTenants(
            @RequestBody JsonNode body,
            @RequestHeader(value = HttpHeaders.CACHE_CONTROL, required = false) String cacheControl) {

        return Mono.fromCallable(() -> reader.read(body, AuthorizationQuery.class))
                .flatMap(query -> router.isAllowedAllTenants(query, CacheDirectives.fromHeader(cacheControl)));
    }

    @PostMapping("/allowed_url")
    public Mono<AuthorizationResult> isAllowedUrl(
            @RequestBody JsonNode body,
            @RequestHeader(value = HttpHeaders.CACHE_CONTROL, required = false) String cacheControl) {

        return Mono.fromCallable(() -> reader.read(body, UrlAuthorizationQuery.class))
                .flatMap(query -> router.isAllowedUrl(query, CacheDirectives.fromHeader(cacheControl)));
    }

    @PostMapping("/user-permissions")
    public Mono<JsonNode> userPermissions(
            @RequestBody JsonNode body,
            @RequestHeader(value = HttpHeaders.CACHE_CONTROL, required = false) String cacheControl) {

        return Mono.fromCallable(() -> reader.read(body, UserPermissionsQuery.class))
                .flatMap(query -> router.userPermissions(query, CacheDirectives.fromHeader(cacheControl)));
    }

    @PostMapping("/user-tenants")
    public Mono<JsonNode> userTenants(
            @RequestBody JsonNode body,
            @RequestHeader(value = HttpHeaders.CACHE_CONTROL, required = false) String cacheControl) {

        return Mono.fromCallable(() -> reader.read(body, UserTenantsQuery.class))
                .flatMap(query -> router.userTenants(query, CacheDirectives.fromHeader(cacheControl)));
    }

    private static JsonNode wrapChecks(JsonNode body) {
        if (body == null || !body.isArray()) {
            return body;
        }
        ObjectNode wrapped = JsonNodeFactory.instance.objectNode();
        wrapped.set("checks", body);
        return wrapped;
    }
}
