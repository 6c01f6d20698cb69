package com.example.pdp.datafilter.expression;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResidualPolicyType {
    ALWAYS_ALLOW("always_allow"),
    ALWAYS_DENY("always_deny"),
    CONDITIONAL("conditional");

    private final String value;

    ResidualPolicyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
