package com.example.pdp.util;

import com.example.pdp.enforcer.model.AuthorizationQuery;
import com.example.pdp.enforcer.model.Resource;
import com.example.pdp.enforcer.model.User;

import java.util.HashMap;
import java.util.Map;

/**
 * Test builder for AuthorizationQuery.
 */
public class AuthorizationQueryTestBuilder {

    private String userKey = "user1";
    private String action = "read";
    private String resourceType = "document";
    private String resourceKey;
    private String tenant = "default";
    private Map<String, Object> attributes = new HashMap<>();
    private Map<String, Object> context = new HashMap<>();

    public static AuthorizationQueryTestBuilder aQuery() {
        return new AuthorizationQueryTestBuilder();
    }

    public AuthorizationQueryTestBuilder withUser(String userKey) {
        this.userKey = userKey;
        return this;
    }

    public AuthorizationQueryTestBuilder withAction(String action) {
        this.action = action;
        return this;
    }

    public AuthorizationQueryTestBuilder withResourceType(String resourceType) {
        this.resourceType = resourceType;
        return this;
    }

    public AuthorizationQueryTestBuilder withResourceKey(String resourceKey) {
        this.resourceKey = resourceKey;
        return this;
    }

    public AuthorizationQueryTestBuilder withTenant(String tenant) {
        this.tenant = tenant;
        return this;
    }

    public AuthorizationQueryTestBuilder withAttribute(String name, Object value) {
        this.attributes.put(name, value);
        return this;
    }

    public AuthorizationQueryTestBuilder withContext(String name, Object value) {
        this.context.put(name, value);
        return this;
    }

    public AuthorizationQuery build() {
        return new AuthorizationQuery(
                User.of(userKey),
                action,
                new Resource(resourceType, resourceKey, tenant, Map.copyOf(attributes), Map.of()),
                Map.copyOf(context),
                null);
    }
}
