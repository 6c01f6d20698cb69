package com.example.pdp.enforcer.model;

import java.util.List;

public record BulkAuthorizationResult(List<AuthorizationResult> allow) {

    public BulkAuthorizationResult {
        allow = List.copyOf(allow);
    }
}
