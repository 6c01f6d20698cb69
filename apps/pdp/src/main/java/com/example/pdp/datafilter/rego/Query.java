package com.example.pdp.datafilter.rego;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.lang.NonNull;

import java.util.ArrayList;
import java.util.List;

/**
 * A conjunction of expressions. A query without expressions is trivially true.
 */
public record Query(List<Expression> expressions) {

    public Query {
        expressions = List.copyOf(expressions);
    }

    @NonNull
    public static Query parse(JsonNode node) {
        if (node == null || !node.isArray()) {
            throw new RegoParseException("Query must be an array of expressions");
        }
        List<Expression> expressions = new ArrayList<>(node.size());
        node.forEach(e -> expressions.add(Expression.parse(e)));
        return new Query(expressions);
    }

    public boolean isAlwaysTrue() {
        return expressions.isEmpty();
    }
}
