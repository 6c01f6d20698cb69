package com.example.pdp.datafilter.relational;

import com.example.pdp.datafilter.DataFilterException;

public class MissingMappingException extends DataFilterException {

    private final String variable;

    public MissingMappingException(String variable) {
        super("MISSING_MAPPING", "Residual variable does not exist in the reference mapping: " + variable);
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
