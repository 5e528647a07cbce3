package com.github.dimitryivaniuta.iam.projection.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.iam.eventstore.EventSubscriptions;
import com.github.dimitryivaniuta.iam.projection.H2Projections;
import com.github.dimitryivaniuta.iam.projection.config.ProjectionProperties;
import com.github.dimitryivaniuta.iam.projection.statement.Statements;
import io.r2dbc.spi.ConnectionFactory;
import org.junit.jupiter.api.Test;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProjectionEngineTest {

    private final ConnectionFactory cf = H2Projections.connectionFactory("engine-test");

    @Test
    void buildsOneHandlerPerProjection() {
        ProjectionProperties properties = new ProjectionProperties();
        ProjectionProperties.Customization users = new ProjectionProperties.Customization();
        users.setBulkLimit(2000);
        properties.getCustomizations().put("projections.users", users);

        ProjectionEngine engine = engine(properties, definition("projections.orgs", true),
                definition("projections.users", false));

        assertThat(engine.handlers()).extracting(ProjectionHandler::projectionName)
                .containsExactly("projections.orgs", "projections.users");
        assertThat(engine.handler("projections.orgs")).get()
                .extracting(ProjectionHandler::subscribes).isEqualTo(true);
        assertThat(engine.handler("projections.users")).get()
                .extracting(ProjectionHandler::subscribes).isEqualTo(false);
        assertThat(engine.definition("projections.users")).get()
                .extracting(ProjectionDefinition::tables).isEqualTo(List.of("projections.users"));
        assertThat(engine.handler("projections.unknown")).isEmpty();
    }

    @Test
    void scheduledEventProjectionNeverSubscribes() {
        ProjectionDefinition scheduled = ProjectionDefinition.builder()
                .name("projections.sessions")
                .reducers(Reducers.builder()
                        .on(ProjectionHandler.SCHEDULED_AGGREGATE_TYPE, ProjectionHandler.SCHEDULED_EVENT, Statements::noOp)
                        .build())
                .reduceScheduledEvent(true)
                .build();

        ProjectionEngine engine = engine(new ProjectionProperties(), scheduled);

        assertThat(scheduled.isSubscribe()).isTrue();
        assertThat(engine.handler("projections.sessions")).get()
                .extracting(ProjectionHandler::subscribes).isEqualTo(false);
    }

    @Test
    void rejectsDuplicateProjectionNames() {
        ProjectionProperties properties = new ProjectionProperties();

        assertThatThrownBy(() -> engine(properties, definition("projections.orgs", true),
                definition("projections.orgs", false)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("projections.orgs");
    }

    private ProjectionEngine engine(ProjectionProperties properties, ProjectionDefinition... definitions) {
        return new ProjectionEngine(List.of(definitions), properties, DatabaseClient.create(cf),
                TransactionalOperator.create(new R2dbcTransactionManager(cf)), new InMemoryEventSource(),
                new EventSubscriptions(), new ObjectMapper(), Clock.systemUTC(), "node-a");
    }

    private static ProjectionDefinition definition(String name, boolean subscribe) {
        return ProjectionDefinition.builder()
                .name(name)
                .reducers(Reducers.builder().on("org", "org.added", Statements::noOp).build())
                .subscribe(subscribe)
                .build();
    }
}
