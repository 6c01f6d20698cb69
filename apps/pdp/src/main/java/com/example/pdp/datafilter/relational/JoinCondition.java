package com.example.pdp.datafilter.relational;

import org.springframework.data.relational.core.sql.Column;
import org.springframework.data.relational.core.sql.Table;

import java.util.Objects;

/**
 * Declares how a foreign table is joined to the filtered table: {@code JOIN table ON left = right}.
 */
public record JoinCondition(Table table, Column left, Column right) {

    public JoinCondition {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    public String tableName() {
        return RelationalCompiler.tableName(table);
    }
}
