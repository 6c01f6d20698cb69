package com.example.pdp.datafilter.rego;

import com.example.pdp.datafilter.DataFilterException;

/**
 * Raised when a compile response does not have the shape of a residual program.
 */
public class RegoParseException extends DataFilterException {

    public RegoParseException(String message) {
        super("PARSE_ERROR", message);
    }

    public RegoParseException(String message, Throwable cause) {
        super("PARSE_ERROR", message, cause);
    }
}
