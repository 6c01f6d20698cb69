package com.example.pdp.datafilter;

/**
 * Base type for failures of the data-filter pipeline.
 * These errors are local to a single compile call and are never turned into an empty predicate.
 */
public class DataFilterException extends RuntimeException {

    private final String code;

    public DataFilterException(String code, String message) {
        super(message);
        this.code = code;
    }

    public DataFilterException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
