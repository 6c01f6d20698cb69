package com.example.pdp.datafilter.expression;

import com.example.pdp.datafilter.DataFilterException;

public class ResidualTranslationException extends DataFilterException {

    public ResidualTranslationException(String message) {
        super("TRANSLATION_ERROR", message);
    }
}
