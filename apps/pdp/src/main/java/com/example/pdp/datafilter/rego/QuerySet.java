package com.example.pdp.datafilter.rego;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.lang.NonNull;

import java.util.ArrayList;
import java.util.List;

/**
 * The result of partial evaluation: a disjunction of queries, each a conjunction of expressions.
 *
 * <pre>{@code
 * policy = query_1 OR query_2 OR ... OR query_n
 * query_i = expr_i_1 AND ... AND expr_i_m
 * }</pre>
 */
public record QuerySet(List<Query> queries) {

    public QuerySet {
        queries = List.copyOf(queries);
    }

    /**
     * Parses the {@code result} object of a compile response, i.e. {@code {"queries": [[...]], "support": [...]}}.
     * Support modules are not used.
     */
    @NonNull
    public static QuerySet parse(JsonNode result) {
        if (result == null || result.isNull() || result.isMissingNode()) {
            return new QuerySet(List.of());
        }
        JsonNode queries = result.get("queries");
        if (queries == null || queries.isNull()) {
            return new QuerySet(List.of());
        }
        if (!queries.isArray()) {
            throw new RegoParseException("Compile result queries must be an array");
        }
        List<Query> parsed = new ArrayList<>(queries.size());
        queries.forEach(q -> parsed.add(Query.parse(q)));
        return new QuerySet(parsed);
    }

    public boolean isAlwaysFalse() {
        return queries.isEmpty();
    }

    public boolean isAlwaysTrue() {
        return queries.stream().anyMatch(Query::isAlwaysTrue);
    }

    public boolean isConditional() {
        return !isAlwaysFalse() && !isAlwaysTrue();
    }
}
