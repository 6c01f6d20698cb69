package com.example.pdp.exception;

import org.springframework.http.HttpStatusCode;

/**
 * Raised for queries in the legacy (v1) shape, which are never reinterpreted.
 */
public class OutdatedSdkException extends RuntimeException {

    /**
     * 421 Misdirected Request.
     */
    public static final HttpStatusCode STATUS = HttpStatusCode.valueOf(421);

    public OutdatedSdkException() {
        super("Mismatch between client version and PDP version, required v2 request body, got v1. "
                + "hint: try to update your client version to v2");
    }
}
