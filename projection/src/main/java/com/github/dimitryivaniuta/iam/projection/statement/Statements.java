package com.github.dimitryivaniuta.iam.projection.statement;

import com.github.dimitryivaniuta.iam.eventstore.Event;

import java.util.Arrays;
import java.util.List;

/**
 * Factory methods used by reducers to build statements from the event they reduce.
 *
 * <pre>
 * Statements.create(event,
 *         Statements.col("id", event.aggregateId()),
 *         Statements.col("name", payload.name()));
 * </pre>
 */
public final class Statements {

    private Statements() {}

    public static Column col(String name, Object value) {
        return new Column(name, value);
    }

    public static Condition where(String name, Object value) {
        return new Condition(name, value);
    }

    public static Statement of(Event event, Operation operation) {
        return new Statement(
                event.aggregateType(),
                event.aggregateId(),
                event.instanceId(),
                event.sequence(),
                event.previousAggregateTypeSequence(),
                event.creationDate(),
                operation);
    }

    public static Statement create(Event event, Column... columns) {
        return of(event, new Operation.Create(null, Arrays.asList(columns), List.of()));
    }

    public static Statement upsert(Event event, List<String> conflictColumns, Column... columns) {
        return of(event, new Operation.Create(null, Arrays.asList(columns), conflictColumns));
    }

    public static Statement update(Event event, List<Column> values, List<Condition> conditions) {
        return of(event, new Operation.Update(null, values, conditions));
    }

    public static Statement delete(Event event, Condition... conditions) {
        return of(event, new Operation.Delete(null, Arrays.asList(conditions)));
    }

    public static Statement noOp(Event event) {
        return of(event, new Operation.NoOp());
    }

    public static Statement multi(Event event, Operation... operations) {
        return of(event, new Operation.Multi(Arrays.asList(operations)));
    }

    // sub-table operations, mostly inside multi(...)

    public static Operation createIn(String tableSuffix, Column... columns) {
        return new Operation.Create(tableSuffix, Arrays.asList(columns), List.of());
    }

    public static Operation updateIn(String tableSuffix, List<Column> values, List<Condition> conditions) {
        return new Operation.Update(tableSuffix, values, conditions);
    }

    public static Operation deleteIn(String tableSuffix, Condition... conditions) {
        return new Operation.Delete(tableSuffix, Arrays.asList(conditions));
    }
}
