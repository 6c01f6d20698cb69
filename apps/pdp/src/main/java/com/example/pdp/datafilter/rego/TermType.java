package com.example.pdp.datafilter.rego;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Arrays;

/**
 * Type tags used by the policy engine for terms in a compiled query.
 */
public enum TermType {
    NULL("null"),
    BOOLEAN("boolean"),
    NUMBER("number"),
    STRING("string"),
    VAR("var"),
    REF("ref"),
    CALL("call");

    private final String tag;

    TermType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    @NonNull
    public static TermType fromTag(@Nullable String tag) {
        return Arrays.stream(values())
                .filter(t -> t.tag.equals(tag))
                .findFirst()
                .orElseThrow(() -> new RegoParseException("Unknown term type: " + tag));
    }
}
