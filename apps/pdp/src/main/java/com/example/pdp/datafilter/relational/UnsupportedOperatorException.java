package com.example.pdp.datafilter.relational;

import com.example.pdp.datafilter.DataFilterException;

public class UnsupportedOperatorException extends DataFilterException {

    private final String operator;

    public UnsupportedOperatorException(String operator) {
        super("UNSUPPORTED_OPERATOR", "Unrecognised comparison operator: " + operator);
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
