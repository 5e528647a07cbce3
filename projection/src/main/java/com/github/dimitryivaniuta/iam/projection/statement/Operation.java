package com.github.dimitryivaniuta.iam.projection.statement;

import java.util.List;

/**
 * SQL work carried by a {@link Statement}. Each variant holds only what its kind needs;
 * {@link OperationSql} dispatches on {@link #kind()}.
 *
 * <p>{@code tableSuffix} selects a sub-table {@code <projection>_<suffix>}; {@code null} targets
 * the projection table itself.
 */
public interface Operation {

    enum Kind { CREATE, UPDATE, DELETE, NO_OP, MULTI }

    Kind kind();

    /** Insert; with {@code conflictColumns} an upsert on that unique key. */
    record Create(String tableSuffix, List<Column> columns, List<String> conflictColumns) implements Operation {
        public Create {
            if (tableSuffix != null) Identifiers.requireValid(tableSuffix);
            if (columns == null || columns.isEmpty()) {
                throw new IllegalArgumentException("create needs at least one column");
            }
            columns = List.copyOf(columns);
            conflictColumns = conflictColumns == null ? List.of() : List.copyOf(conflictColumns);
            conflictColumns.forEach(Identifiers::requireValid);
        }

        @Override
        public Kind kind() {
            return Kind.CREATE;
        }
    }

    record Update(String tableSuffix, List<Column> values, List<Condition> conditions) implements Operation {
        public Update {
            if (tableSuffix != null) Identifiers.requireValid(tableSuffix);
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("update needs at least one value");
            }
            if (conditions == null || conditions.isEmpty()) {
                throw new IllegalArgumentException("update needs at least one condition");
            }
            values = List.copyOf(values);
            conditions = List.copyOf(conditions);
        }

        @Override
        public Kind kind() {
            return Kind.UPDATE;
        }
    }

    record Delete(String tableSuffix, List<Condition> conditions) implements Operation {
        public Delete {
            if (tableSuffix != null) Identifiers.requireValid(tableSuffix);
            if (conditions == null || conditions.isEmpty()) {
                throw new IllegalArgumentException("delete needs at least one condition");
            }
            conditions = List.copyOf(conditions);
        }

        @Override
        public Kind kind() {
            return Kind.DELETE;
        }
    }

    /** Advances the sequence without touching projection tables. */
    record NoOp() implements Operation {
        @Override
        public Kind kind() {
            return Kind.NO_OP;
        }
    }

    /** Several operations applied together under one savepoint. */
    record Multi(List<Operation> operations) implements Operation {
        public Multi {
            if (operations == null || operations.isEmpty()) {
                throw new IllegalArgumentException("multi needs at least one operation");
            }
            operations = List.copyOf(operations);
        }

        @Override
        public Kind kind() {
            return Kind.MULTI;
        }
    }
}
