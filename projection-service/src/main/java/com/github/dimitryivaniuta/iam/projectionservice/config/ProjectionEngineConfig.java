package com.github.dimitryivaniuta.iam.projectionservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.iam.eventstore.EventSource;
import com.github.dimitryivaniuta.iam.eventstore.EventSubscriptions;
import com.github.dimitryivaniuta.iam.eventstore.R2dbcEventSource;
import com.github.dimitryivaniuta.iam.eventstore.sql.SearchQuerySql;
import com.github.dimitryivaniuta.iam.projection.config.ProjectionProperties;
import com.github.dimitryivaniuta.iam.projection.handler.ProjectionDefinition;
import com.github.dimitryivaniuta.iam.projection.handler.ProjectionEngine;
import com.github.dimitryivaniuta.iam.projection.state.ProjectionStateQueries;
import com.github.dimitryivaniuta.iam.projectionservice.projections.OrgProjection;
import com.github.dimitryivaniuta.iam.projectionservice.projections.UserProjection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Slf4j
@Configuration
public class ProjectionEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TransactionalOperator transactionalOperator(ReactiveTransactionManager txManager) {
        return TransactionalOperator.create(txManager);
    }

    @Bean
    public EventSubscriptions eventSubscriptions() {
        return new EventSubscriptions();
    }

    @Bean
    public EventSource eventSource(DatabaseClient db, TransactionalOperator tx, ObjectMapper om,
                                   EventSubscriptions subscriptions, Clock clock) {
        return new R2dbcEventSource(db, tx, new SearchQuerySql(om), subscriptions, clock);
    }

    @Bean
    public ProjectionDefinition orgProjection(ObjectMapper om) {
        return new OrgProjection(om).definition();
    }

    @Bean
    public ProjectionDefinition userProjection(ObjectMapper om) {
        return new UserProjection(om).definition();
    }

    @Bean
    public ProjectionEngine projectionEngine(List<ProjectionDefinition> projections,
                                             ProjectionProperties props,
                                             DatabaseClient db,
                                             TransactionalOperator tx,
                                             EventSource eventSource,
                                             EventSubscriptions subscriptions,
                                             ObjectMapper om,
                                             Clock clock,
                                             @Value("${spring.application.name:projection-service}") String appName) {
        // unique per process
        String lockerId = appName + "-" + UUID.randomUUID();
        log.info("Projection engine configured: lockerId={} props={}", lockerId, props);
        return new ProjectionEngine(projections, props, db, tx, eventSource, subscriptions, om, clock, lockerId);
    }

    @Bean
    public ProjectionStateQueries projectionStateQueries(DatabaseClient db, TransactionalOperator tx, Clock clock,
                                                         ProjectionProperties props) {
        return new ProjectionStateQueries(db, tx, clock, props.getLockDuration());
    }
}
