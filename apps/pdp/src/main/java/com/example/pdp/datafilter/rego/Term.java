package com.example.pdp.datafilter.rego;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.lang.NonNull;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * An atomic part of a compiled expression: a literal, a variable, a reference into the
 * document tree, or a function call.
 *
 * <p>Terms arrive tagged as {@code {"type": "ref", "value": [...]}} and are parsed by
 * {@link #parse(JsonNode)}, which dispatches exhaustively on {@link TermType}.</p>
 */
public sealed interface Term
        permits Term.NullTerm, Term.BooleanTerm, Term.NumberTerm, Term.StringTerm,
        Term.VarTerm, Term.RefTerm, Term.CallTerm {

    TermType type();

    @NonNull
    static Term parse(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new RegoParseException("Term must be an object, got: " + node);
        }
        TermType type = TermType.fromTag(node.path("type").asText(null));
        JsonNode value = node.get("value");

        return switch (type) {
            case NULL -> new NullTerm();
            case BOOLEAN -> new BooleanTerm(requireValue(type, value, value != null && value.isBoolean()).booleanValue());
            case NUMBER -> new NumberTerm(requireValue(type, value, value != null && value.isNumber()).decimalValue());
            case STRING -> new StringTerm(requireValue(type, value, value != null && value.isTextual()).asText());
            case VAR -> new VarTerm(requireValue(type, value, value != null && value.isTextual()).asText());
            case REF -> RefTerm.parse(requireValue(type, value, value != null && value.isArray()));
            case CALL -> CallTerm.parse(requireValue(type, value, value != null && value.isArray()));
        };
    }

    private static JsonNode requireValue(TermType type, JsonNode value, boolean valid) {
        if (!valid) {
            throw new RegoParseException("Invalid value for " + type.getTag() + " term: " + value);
        }
        return value;
    }

    record NullTerm() implements Term {
        @Override
        public TermType type() {
            return TermType.NULL;
        }
    }

    record BooleanTerm(boolean value) implements Term {
        @Override
        public TermType type() {
            return TermType.BOOLEAN;
        }
    }

    record NumberTerm(BigDecimal value) implements Term {
        @Override
        public TermType type() {
            return TermType.NUMBER;
        }
    }

    record StringTerm(String value) implements Term {
        @Override
        public TermType type() {
            return TermType.STRING;
        }
    }

    record VarTerm(String name) implements Term {
        @Override
        public TermType type() {
            return TermType.VAR;
        }
    }

    /**
     * A reference to a document in the engine's document tree, e.g. {@code input.resource.tenant}.
     * The first part is always a variable name, the rest are string keys.
     */
    record RefTerm(List<String> parts) implements Term {

        public RefTerm {
            parts = List.copyOf(parts);
        }

        @Override
        public TermType type() {
            return TermType.REF;
        }

        public String path() {
            return String.join(".", parts);
        }

        static RefTerm parse(JsonNode values) {
            if (values.isEmpty()) {
                throw new RegoParseException("Reference must contain at least one term");
            }
            List<String> parts = new ArrayList<>(values.size());
            for (int i = 0; i < values.size(); i++) {
                Term part = Term.parse(values.get(i));
                if (i == 0) {
                    if (!(part instanceof VarTerm var)) {
                        throw new RegoParseException(
                                "First term of a reference must be a variable, got: " + part.type().getTag());
                    }
                    parts.add(var.name());
                } else if (part instanceof StringTerm str) {
                    parts.add(str.value());
                } else {
                    throw new RegoParseException(
                            "Reference parts must be strings, got: " + part.type().getTag());
                }
            }
            return new RefTerm(parts);
        }
    }

    /**
     * A function call; the function is identified by a reference, e.g. {@code startswith}.
     */
    record CallTerm(RefTerm function, List<Term> arguments) implements Term {

        public CallTerm {
            arguments = List.copyOf(arguments);
        }

        @Override
        public TermType type() {
            return TermType.CALL;
        }

        public String functionName() {
            return function.path();
        }

        static CallTerm parse(JsonNode values) {
            if (values.isEmpty()) {
                throw new RegoParseException("Call must contain at least the function reference");
            }
            Term function = Term.parse(values.get(0));
            if (!(function instanceof RefTerm ref)) {
                throw new RegoParseException(
                        "First term of a call must be a reference, got: " + function.type().getTag());
            }
            List<Term> arguments = new ArrayList<>(values.size() - 1);
            for (int i = 1; i < values.size(); i++) {
                arguments.add(Term.parse(values.get(i)));
            }
            return new CallTerm(ref, arguments);
        }
    }
}
