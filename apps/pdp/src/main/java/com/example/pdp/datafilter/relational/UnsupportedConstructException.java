package com.example.pdp.datafilter.relational;

import com.example.pdp.datafilter.DataFilterException;

/**
 * Raised for residual constructs that have no relational equivalent, such as function calls.
 */
public class UnsupportedConstructException extends DataFilterException {

    private final String operator;

    public UnsupportedConstructException(String operator, String message) {
        super("NOT_IMPLEMENTED", message);
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
