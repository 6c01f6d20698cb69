package com.example.pdp.enforcer.kong;

public record KongAuthorizationResult(boolean result) {

    public static KongAuthorizationResult denied() {
        return new KongAuthorizationResult(false);
    }
}
