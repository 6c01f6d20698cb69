package com.example.pdp.datafilter.relational;

import com.example.pdp.datafilter.expression.ResidualPolicyType;
import org.springframework.data.relational.core.sql.Condition;
import org.springframework.data.relational.core.sql.Conditions;
import org.springframework.data.relational.core.sql.Select;
import org.springframework.data.relational.core.sql.SelectBuilder;
import org.springframework.data.relational.core.sql.Table;
import org.springframework.data.relational.core.sql.render.SqlRenderer;
import org.springframework.lang.NonNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relational form of a residual policy: a predicate over the target table plus the joins it needs.
 *
 * @param bindings values for the named bind markers in {@code condition}, keyed by marker name
 *                 without the leading colon, in rendering order
 */
public record RelationalFilter(
        ResidualPolicyType type,
        Table table,
        Condition condition,
        List<JoinCondition> joins,
        Map<String, Object> bindings
) {
    static final String TRUE = "TRUE";
    static final String FALSE = "FALSE";

    public RelationalFilter {
        joins = List.copyOf(joins);
        bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    static RelationalFilter selectAll(Table table) {
        return new RelationalFilter(ResidualPolicyType.ALWAYS_ALLOW, table, Conditions.just(TRUE), List.of(), Map.of());
    }

    static RelationalFilter selectNone(Table table) {
        return new RelationalFilter(ResidualPolicyType.ALWAYS_DENY, table, Conditions.just(FALSE), List.of(), Map.of());
    }

    public boolean isUnrestricted() {
        return type == ResidualPolicyType.ALWAYS_ALLOW;
    }

    /**
     * Builds {@code SELECT table.* FROM table [JOIN ...] [WHERE condition]}.
     * An unrestricted filter has no WHERE clause.
     */
    @NonNull
    public Select toSelect() {
        SelectBuilder.SelectFromAndJoin from = Select.builder()
                .select(table.asterisk())
                .from(table);

        SelectBuilder.SelectWhere query = from;
        SelectBuilder.SelectJoin joinable = from;
        for (JoinCondition join : joins) {
            SelectBuilder.SelectFromAndJoinCondition joined = joinable.join(join.table())
                    .on(join.left()).equals(join.right());
            query = joined;
            joinable = joined;
        }

        if (isUnrestricted()) {
            return query.build();
        }
        return query.where(condition).build();
    }

    /**
     * Renders the select with named bind markers; pass {@link #bindings()} as the parameters.
     */
    @NonNull
    public String toSql() {
        return SqlRenderer.toString(toSelect());
    }
}
