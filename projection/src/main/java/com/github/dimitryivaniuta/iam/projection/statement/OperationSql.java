package com.github.dimitryivaniuta.iam.projection.statement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders an {@link Operation} against a projection table into named-parameter SQL.
 * {@code null} values are inlined as {@code NULL}, never bound.
 */
public final class OperationSql {

    /** SQL plus its bind values. */
    public record Rendered(String sql, Map<String, Object> binds) {}

    private OperationSql() {}

    public static String table(String projectionName, String tableSuffix) {
        Identifiers.requireValidTable(projectionName);
        return tableSuffix == null ? projectionName : projectionName + "_" + tableSuffix;
    }

    /** One entry per SQL command; empty for {@link Operation.NoOp}. */
    public static List<Rendered> render(String projectionName, Operation operation) {
        List<Rendered> out = new ArrayList<>();
        render(projectionName, operation, out);
        return out;
    }

    private static void render(String projectionName, Operation operation, List<Rendered> out) {
        switch (operation.kind()) {
            case CREATE -> out.add(create(projectionName, (Operation.Create) operation));
            case UPDATE -> out.add(update(projectionName, (Operation.Update) operation));
            case DELETE -> out.add(delete(projectionName, (Operation.Delete) operation));
            case MULTI -> ((Operation.Multi) operation).operations().forEach(op -> render(projectionName, op, out));
            case NO_OP -> {
            }
        }
    }

    private static Rendered create(String projectionName, Operation.Create op) {
        Map<String, Object> binds = new LinkedHashMap<>();
        String names = op.columns().stream().map(Column::name).collect(Collectors.joining(", "));
        String values = op.columns().stream().map(c -> value(binds, c.value())).collect(Collectors.joining(", "));

        StringBuilder sql = new StringBuilder("INSERT INTO ")
                .append(table(projectionName, op.tableSuffix()))
                .append(" (").append(names).append(") VALUES (").append(values).append(')');

        if (!op.conflictColumns().isEmpty()) {
            List<String> updates = op.columns().stream()
                    .map(Column::name)
                    .filter(name -> !op.conflictColumns().contains(name))
                    .map(name -> name + " = EXCLUDED." + name)
                    .toList();
            sql.append(" ON CONFLICT (").append(String.join(", ", op.conflictColumns())).append(')');
            sql.append(updates.isEmpty() ? " DO NOTHING" : " DO UPDATE SET " + String.join(", ", updates));
        }
        return new Rendered(sql.toString(), binds);
    }

    private static Rendered update(String projectionName, Operation.Update op) {
        Map<String, Object> binds = new LinkedHashMap<>();
        String set = op.values().stream()
                .map(c -> c.name() + " = " + value(binds, c.value()))
                .collect(Collectors.joining(", "));
        String sql = "UPDATE " + table(projectionName, op.tableSuffix())
                + " SET " + set
                + where(binds, op.conditions());
        return new Rendered(sql, binds);
    }

    private static Rendered delete(String projectionName, Operation.Delete op) {
        Map<String, Object> binds = new LinkedHashMap<>();
        String sql = "DELETE FROM " + table(projectionName, op.tableSuffix()) + where(binds, op.conditions());
        return new Rendered(sql, binds);
    }

    private static String where(Map<String, Object> binds, List<Condition> conditions) {
        return " WHERE " + conditions.stream()
                .map(c -> c.value() == null ? c.name() + " IS NULL" : c.name() + " = " + value(binds, c.value()))
                .collect(Collectors.joining(" AND "));
    }

    private static String value(Map<String, Object> binds, Object value) {
        if (value == null) {
            return "NULL";
        }
        String name = "p" + binds.size();
        binds.put(name, value);
        return ":" + name;
    }
}
