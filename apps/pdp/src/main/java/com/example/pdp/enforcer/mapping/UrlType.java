package com.example.pdp.enforcer.mapping;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum UrlType {
    /**
     * Path template with {@code {name}} placeholders, matched segment by segment.
     */
    TEMPLATE("template"),
    /**
     * Regular expression matched against the full request path.
     */
    REGEX("regex");

    private final String value;

    UrlType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static UrlType fromValue(String value) {
        if (value == null) {
            return TEMPLATE;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "regex" -> REGEX;
            case "template", "default", "" -> TEMPLATE;
            default -> throw new IllegalArgumentException("Unknown url type: " + value);
        };
    }
}
