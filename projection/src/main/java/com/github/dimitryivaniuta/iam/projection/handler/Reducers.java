package com.github.dimitryivaniuta.iam.projection.handler;

import com.github.dimitryivaniuta.iam.eventstore.Event;
import com.github.dimitryivaniuta.iam.projection.statement.Statement;
import com.github.dimitryivaniuta.iam.projection.statement.Statements;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reducer of a projection, dispatching by aggregate type and event type.
 *
 * <p>Events of a registered aggregate type without a reducer for their event type
 * reduce to a no-op, so the sequence still moves past them.
 */
public final class Reducers implements Reducer {

    private final Map<String, Map<String, Reducer>> byAggregateType;

    private Reducers(Map<String, Map<String, Reducer>> byAggregateType) {
        this.byAggregateType = byAggregateType;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> aggregateTypes() {
        return byAggregateType.keySet();
    }

    @Override
    public Statement reduce(Event event) {
        Reducer reducer = byAggregateType.getOrDefault(event.aggregateType(), Map.of()).get(event.eventType());
        if (reducer == null) {
            return Statements.noOp(event);
        }
        Statement statement;
        try {
            statement = reducer.reduce(event);
        } catch (ReductionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ReductionException(event, e);
        }
        if (statement == null) {
            throw new ReductionException(event, "reducer returned no statement");
        }
        return statement;
    }

    public static final class Builder {
        private final Map<String, Map<String, Reducer>> byAggregateType = new LinkedHashMap<>();

        private Builder() {}

        public Builder on(String aggregateType, String eventType, Reducer reducer) {
            Reducer previous = byAggregateType
                    .computeIfAbsent(aggregateType, t -> new LinkedHashMap<>())
                    .putIfAbsent(eventType, reducer);
            if (previous != null) {
                throw new IllegalStateException("Duplicate reducer: " + aggregateType + "/" + eventType);
            }
            return this;
        }

        public Reducers build() {
            if (byAggregateType.isEmpty()) {
                throw new IllegalStateException("No reducers registered");
            }
            Map<String, Map<String, Reducer>> copy = new LinkedHashMap<>();
            byAggregateType.forEach((type, reducers) -> copy.put(type, Map.copyOf(reducers)));
            return new Reducers(Collections.unmodifiableMap(copy));
        }
    }
}
