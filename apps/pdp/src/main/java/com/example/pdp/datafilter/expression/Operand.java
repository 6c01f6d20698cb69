package com.example.pdp.datafilter.expression;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operand of a boolean expression: a literal {@link Value}, a {@link Variable} path or a nested
 * {@link BooleanExpression}.
 */
public sealed interface Operand permits Operand.Value, Operand.Variable, Operand.BooleanExpression {

    record Value(Object value) implements Operand {
        @JsonValue
        public Map<String, Object> toJson() {
            return Collections.singletonMap("value", value);
        }
    }

    record Variable(String variable) implements Operand {
        @JsonValue
        public Map<String, Object> toJson() {
            return Map.of("variable", variable);
        }
    }

    record BooleanExpression(String operator, List<Operand> operands) implements Operand {

        public static final String AND = "and";
        public static final String OR = "or";
        public static final String NOT = "not";
        public static final String CALL = "call";

        public BooleanExpression {
            operands = List.copyOf(operands);
        }

        @JsonValue
        public Map<String, Object> toJson() {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("operator", operator);
            body.put("operands", operands);
            return Map.of("expression", body);
        }
    }
}
