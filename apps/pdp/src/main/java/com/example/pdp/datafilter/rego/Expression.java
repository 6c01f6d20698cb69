package com.example.pdp.datafilter.rego;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.lang.NonNull;

import java.util.ArrayList;
import java.util.List;

/**
 * One line of residual policy code. The first term is the operator and the remaining terms
 * are its operands, except for a bare function call, which is kept as the only term.
 */
public record Expression(List<Term> terms) {

    public Expression {
        if (terms == null || terms.isEmpty()) {
            throw new RegoParseException("Expression must contain at least one term");
        }
        terms = List.copyOf(terms);
    }

    @NonNull
    public static Expression parse(JsonNode node) {
        JsonNode terms = node == null ? null : node.get("terms");
        if (terms == null || terms.isNull()) {
            throw new RegoParseException("Expression is missing its terms");
        }
        if (terms.isObject()) {
            return new Expression(List.of(Term.parse(terms)));
        }
        if (!terms.isArray()) {
            throw new RegoParseException("Expression terms must be an object or an array");
        }
        List<Term> parsed = new ArrayList<>(terms.size());
        terms.forEach(t -> parsed.add(Term.parse(t)));
        return new Expression(parsed);
    }

    public Term operator() {
        return terms.get(0);
    }

    public List<Term> operands() {
        return terms.subList(1, terms.size());
    }

    /**
     * True when the expression is a lone function call with no explicit boolean operator.
     */
    public boolean isCall() {
        return terms.size() == 1 && terms.get(0) instanceof Term.CallTerm;
    }
}
