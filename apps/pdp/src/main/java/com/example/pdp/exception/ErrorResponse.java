package com.example.pdp.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Error body for all non-decision failures.
 *
 * @param timestamp when the error occurred
 * @param status    HTTP status code
 * @param error     stable error category, e.g. {@code authentication_required}
 * @param message   human-readable message
 * @param path      request path that triggered the error
 * @param code      specific error code, when one applies
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        String code
) {
    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(Instant.now(), status, error, message, path, null);
    }

    public static ErrorResponse of(int status, String error, String message, String path, String code) {
        return new ErrorResponse(Instant.now(), status, error, message, path, code);
    }

    /**
     * Common error categories.
     */
    public static final class Categories {
        public static final String AUTHENTICATION_REQUIRED = "authentication_required";
        public static final String OUTDATED_SDK = "outdated_sdk";
        public static final String UNSUPPORTED_POLICY = "unsupported_policy";
        public static final String POLICY_ENGINE_UNAVAILABLE = "policy_engine_unavailable";
        public static final String VALIDATION_ERROR = "validation_error";
        public static final String SERVER_ERROR = "server_error";

        private Categories() {
        }
    }
}
