package com.github.dimitryivaniuta.iam.projection.handler;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * A projection: its table, the reducers feeding it and whether it also consumes events in
 * real time.
 */
@Value
@Builder
public class ProjectionDefinition {

    /** Qualified table name, also the projection name, e.g. {@code projections.orgs}. */
    @NonNull String name;

    @NonNull Reducers reducers;

    /** Sub-tables {@code <name>_<suffix>} written by the reducers. */
    @Singular List<String> subTableSuffixes;

    @Builder.Default
    boolean subscribe = true;

    /**
     * Reduce one {@link ProjectionHandler#SCHEDULED_EVENT} per sweep batch instead of reading
     * the event store. Such a projection never subscribes.
     */
    @Builder.Default
    boolean reduceScheduledEvent = false;

    /** The projection table followed by its sub-tables. */
    public List<String> tables() {
        List<String> tables = new ArrayList<>();
        tables.add(name);
        subTableSuffixes.forEach(suffix -> tables.add(name + "_" + suffix));
        return tables;
    }
}
