package com.example.pdp.datafilter.relational;

import com.example.pdp.datafilter.expression.Operand;
import com.example.pdp.datafilter.expression.Operand.BooleanExpression;
import com.example.pdp.datafilter.expression.Operand.Value;
import com.example.pdp.datafilter.expression.Operand.Variable;
import com.example.pdp.datafilter.expression.ResidualPolicy;
import org.springframework.data.relational.core.sql.Column;
import org.springframework.data.relational.core.sql.Condition;
import org.springframework.data.relational.core.sql.Conditions;
import org.springframework.data.relational.core.sql.Expression;
import org.springframework.data.relational.core.sql.SQL;
import org.springframework.data.relational.core.sql.Table;
import org.springframework.data.relational.core.sql.TableLike;
import org.springframework.lang.NonNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Lowers a {@link ResidualPolicy} into a spring-data-relational {@link Condition} over a target table.
 *
 * <p>Residual variables are resolved through a caller-supplied mapping of variable path to column.
 * Columns that belong to other tables require a matching {@link JoinCondition}; all missing joins
 * are reported together before any lowering happens.</p>
 *
 * <p>Values never appear in the rendered SQL. Each one becomes a named bind marker
 * ({@code :p0}, {@code :p1}, ...) and is returned in {@link RelationalFilter#bindings()}.</p>
 *
 * <pre>{@code
 * Table task = Table.create("task");
 * Table tenant = Table.create("tenant");
 * RelationalFilter filter = new RelationalCompiler(
 *         task,
 *         Map.of("input.resource.tenant", tenant.column("key")),
 *         List.of(new JoinCondition(tenant, task.column("tenant_id"), tenant.column("id"))))
 *     .compile(policy);
 * }</pre>
 */
public class RelationalCompiler {

    static final String BIND_PREFIX = "p";

    private final Table table;
    private final Map<String, Column> refs;
    private final List<JoinCondition> joins;

    public RelationalCompiler(@NonNull Table table, @NonNull Map<String, Column> refs, @NonNull List<JoinCondition> joins) {
        this.table = Objects.requireNonNull(table, "table");
        this.refs = Map.copyOf(refs);
        this.joins = List.copyOf(joins);
    }

    public RelationalCompiler(@NonNull Table table, @NonNull Map<String, Column> refs) {
        this(table, refs, List.of());
    }

    @NonNull
    public RelationalFilter compile(@NonNull ResidualPolicy policy) {
        return switch (policy.type()) {
            case ALWAYS_ALLOW -> RelationalFilter.selectAll(table);
            case ALWAYS_DENY -> RelationalFilter.selectNone(table);
            case CONDITIONAL -> {
                verifyJoins();
                Map<String, Object> bindings = new LinkedHashMap<>();
                Condition condition = lower(policy.condition(), bindings);
                yield new RelationalFilter(policy.type(), table, condition, joins, bindings);
            }
        };
    }

    private void verifyJoins() {
        String target = tableName(table);
        Set<String> required = refs.values().stream()
                .map(RelationalCompiler::columnTableName)
                .filter(name -> name != null && !name.equals(target))
                .collect(Collectors.toCollection(TreeSet::new));

        Set<String> declared = joins.stream()
                .map(JoinCondition::tableName)
                .collect(Collectors.toSet());

        List<String> missing = required.stream()
                .filter(name -> !declared.contains(name))
                .toList();

        if (!missing.isEmpty()) {
            throw new MissingJoinException(missing);
        }
    }

    private Condition lower(BooleanExpression expression, Map<String, Object> bindings) {
        String operator = expression.operator();
        List<Operand> operands = expression.operands();

        return switch (operator) {
            case BooleanExpression.AND -> combine(operator, operands, true, bindings);
            case BooleanExpression.OR -> combine(operator, operands, false, bindings);
            case BooleanExpression.NOT -> {
                if (operands.size() != 1) {
                    throw new UnsupportedConstructException(operator,
                            "'not' expects exactly one operand, got " + operands.size());
                }
                yield Conditions.not(lowerOperand(operator, operands.get(0), bindings));
            }
            case BooleanExpression.CALL -> throw new UnsupportedConstructException(operator,
                    "Function calls cannot be translated to a relational predicate: " + describeCall(operands));
            default -> comparison(operator, operands, bindings);
        };
    }

    private Condition combine(String operator, List<Operand> operands, boolean conjunction,
                              Map<String, Object> bindings) {
        if (operands.isEmpty()) {
            throw new UnsupportedConstructException(operator, "'" + operator + "' requires at least one operand");
        }
        Condition result = null;
        for (Operand operand : operands) {
            Condition next = lowerOperand(operator, operand, bindings);
            if (result == null) {
                result = next;
            } else {
                result = conjunction ? result.and(next) : result.or(next);
            }
        }
        return operands.size() == 1 ? result : Conditions.nest(result);
    }

    private Condition lowerOperand(String parent, Operand operand, Map<String, Object> bindings) {
        if (operand instanceof BooleanExpression nested) {
            return lower(nested, bindings);
        }
        throw new UnsupportedConstructException(parent,
                "Operands of '" + parent + "' must be expressions, got: " + operand);
    }

    private Condition comparison(String operator, List<Operand> operands, Map<String, Object> bindings) {
        List<Variable> variables = new ArrayList<>();
        List<Value> values = new ArrayList<>();
        for (Operand operand : operands) {
            if (operand instanceof Variable variable) {
                variables.add(variable);
            } else if (operand instanceof Value value) {
                values.add(value);
            }
        }
        if (operands.size() != 2 || variables.size() != 1 || values.size() != 1) {
            throw new UnsupportedConstructException(operator,
                    "Comparison '" + operator + "' must compare exactly one variable with one value");
        }

        String path = variables.get(0).variable();
        Column column = refs.get(path);
        if (column == null) {
            throw new MissingMappingException(path);
        }

        boolean valueFirst = operands.get(0) instanceof Value;
        ComparisonOperator comparator = ComparisonOperator.fromName(operator);
        if (valueFirst) {
            comparator = comparator.mirrored();
        }
        Object value = values.get(0).value();
        if (value == null) {
            return comparator.applyNull(column);
        }
        return comparator.apply(column, bind(value, bindings));
    }

    private static Expression bind(Object value, Map<String, Object> bindings) {
        String name = BIND_PREFIX + bindings.size();
        bindings.put(name, value);
        return SQL.bindMarker(":" + name);
    }

    private static String describeCall(List<Operand> operands) {
        if (!operands.isEmpty() && operands.get(0) instanceof BooleanExpression call) {
            return call.operator();
        }
        return "unknown";
    }

    static String tableName(TableLike table) {
        if (table == null) {
            return null;
        }
        return table.getName().getReference();
    }

    static String columnTableName(Column column) {
        return tableName(column.getTable());
    }

    /**
     * Comparison operators as emitted by the policy engine.
     */
    enum ComparisonOperator {
        EQ, NE, LT, GT, LE, GE;

        static ComparisonOperator fromName(String name) {
            return switch (name) {
                case "eq", "equal" -> EQ;
                case "ne", "neq" -> NE;
                case "lt" -> LT;
                case "gt" -> GT;
                case "lte", "le" -> LE;
                case "gte", "ge" -> GE;
                default -> throw new UnsupportedOperatorException(name);
            };
        }

        ComparisonOperator mirrored() {
            return switch (this) {
                case LT -> GT;
                case GT -> LT;
                case LE -> GE;
                case GE -> LE;
                default -> this;
            };
        }

        Condition applyNull(Column column) {
            return switch (this) {
                case EQ -> Conditions.isNull(column);
                case NE -> Conditions.not(Conditions.isNull(column));
                default -> throw new UnsupportedConstructException(name().toLowerCase(),
                        "Null can only be compared for equality");
            };
        }

        Condition apply(Column column, Expression marker) {
            return switch (this) {
                case EQ -> Conditions.isEqual(column, marker);
                case NE -> Conditions.isNotEqual(column, marker);
                case LT -> Conditions.isLess(column, marker);
                case GT -> Conditions.isGreater(column, marker);
                case LE -> Conditions.isLessOrEqualTo(column, marker);
                case GE -> Conditions.isGreaterOrEqualTo(column, marker);
            };
        }
    }
}
