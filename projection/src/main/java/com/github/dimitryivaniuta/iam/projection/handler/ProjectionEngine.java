package com.github.dimitryivaniuta.iam.projection.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.iam.eventstore.EventSource;
import com.github.dimitryivaniuta.iam.eventstore.EventSubscriptions;
import com.github.dimitryivaniuta.iam.projection.config.ProjectionConfig;
import com.github.dimitryivaniuta.iam.projection.config.ProjectionProperties;
import com.github.dimitryivaniuta.iam.projection.lock.R2dbcLocker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds one {@link ProjectionHandler} per {@link ProjectionDefinition} and runs them.
 * Subscribing projections are registered for the aggregate types of their reducers.
 */
@Slf4j
public class ProjectionEngine {

    private final Map<String, ProjectionHandler> handlers = new LinkedHashMap<>();
    private final Map<String, ProjectionDefinition> definitions = new LinkedHashMap<>();
    private final EventSubscriptions subscriptions;

    public ProjectionEngine(List<ProjectionDefinition> projections,
                            ProjectionProperties properties,
                            DatabaseClient db,
                            TransactionalOperator tx,
                            EventSource eventSource,
                            EventSubscriptions subscriptions,
                            ObjectMapper objectMapper,
                            Clock clock,
                            String lockerId) {
        this.subscriptions = subscriptions;
        for (ProjectionDefinition definition : projections) {
            ProjectionConfig config = properties.forProjection(definition.getName());
            StatementHandler statements = new StatementHandler(config, definition.getReducers().aggregateTypes(),
                    db, tx, eventSource, clock);
            R2dbcLocker locker = new R2dbcLocker(db, tx, definition.getName(), lockerId, clock);
            ProjectionHandler handler = new ProjectionHandler(config, definition.getReducers(), statements,
                    eventSource, locker, objectMapper, clock, definition.isSubscribe(), definition.isReduceScheduledEvent());
            if (handlers.putIfAbsent(definition.getName(), handler) != null) {
                throw new IllegalStateException("Duplicate projection: " + definition.getName());
            }
            definitions.put(definition.getName(), definition);
        }
    }

    public void start() {
        handlers.forEach((name, handler) -> {
            if (handler.subscribes()) {
                subscriptions.subscribe(handler, definitions.get(name).getReducers().aggregateTypes());
            }
            handler.start();
        });
        log.info("Projection engine started: projections={}", handlers.keySet());
    }

    public void stop() {
        handlers.values().forEach(handler -> {
            subscriptions.unsubscribe(handler);
            handler.stop();
        });
        log.info("Projection engine stopped");
    }

    public Optional<ProjectionHandler> handler(String projectionName) {
        return Optional.ofNullable(handlers.get(projectionName));
    }

    public Collection<ProjectionHandler> handlers() {
        return handlers.values();
    }

    public Optional<ProjectionDefinition> definition(String projectionName) {
        return Optional.ofNullable(definitions.get(projectionName));
    }
}
