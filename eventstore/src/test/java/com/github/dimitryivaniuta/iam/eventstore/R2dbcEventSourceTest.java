package com.github.dimitryivaniuta.iam.eventstore;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.iam.common.context.CallContext;
import com.github.dimitryivaniuta.iam.eventstore.sql.SearchQuerySql;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class R2dbcEventSourceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");

    private static DatabaseClient db;
    private static TransactionalOperator tx;

    private final List<Event> published = new ArrayList<>();
    private R2dbcEventSource eventSource;

    @BeforeAll
    static void schema() {
        ConnectionFactory cf = ConnectionFactories.get(
                "r2dbc:h2:mem:///event-source-test?options=DB_CLOSE_DELAY=-1;DB_CLOSE_ON_EXIT=FALSE");
        db = DatabaseClient.create(cf);
        tx = TransactionalOperator.create(new R2dbcTransactionManager(cf));
        db.sql("CREATE SCHEMA IF NOT EXISTS eventstore").then().block();
        db.sql("""
                CREATE TABLE IF NOT EXISTS eventstore.events (
                  aggregate_type VARCHAR(200) NOT NULL,
                  aggregate_id VARCHAR(200) NOT NULL,
                  instance_id VARCHAR(200) NOT NULL,
                  resource_owner VARCHAR(200),
                  event_type VARCHAR(200) NOT NULL,
                  event_sequence BIGINT NOT NULL,
                  previous_aggregate_type_sequence BIGINT NOT NULL,
                  creation_date TIMESTAMP WITH TIME ZONE NOT NULL,
                  payload VARCHAR(4000),
                  PRIMARY KEY (aggregate_type, instance_id, event_sequence)
                )
                """).then().block();
    }

    @BeforeEach
    void setUp() {
        db.sql("DELETE FROM eventstore.events").then().block();
        EventSubscriptions subscriptions = new EventSubscriptions();
        subscriptions.subscribe(new EventSubscriber() {
            @Override
            public String subscriberName() {
                return "recorder";
            }

            @Override
            public boolean offer(Event event) {
                return published.add(event);
            }
        }, Set.of("org"));
        eventSource = new R2dbcEventSource(db, tx, new SearchQuerySql(new ObjectMapper()), subscriptions,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void pushAssignsSequencesPerAggregateTypeAndInstance() {
        StepVerifier.create(eventSource.push(Event.draft("org", "o1", "i1", "org.added", "{\"name\":\"acme\"}")))
                .assertNext(e -> {
                    assertThat(e.sequence()).isEqualTo(1);
                    assertThat(e.previousAggregateTypeSequence()).isZero();
                    assertThat(e.creationDate()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
                })
                .verifyComplete();
        StepVerifier.create(eventSource.push(Event.draft("org", "o1", "i1", "org.changed", "{}")))
                .assertNext(e -> {
                    assertThat(e.sequence()).isEqualTo(2);
                    assertThat(e.previousAggregateTypeSequence()).isEqualTo(1);
                })
                .verifyComplete();
        StepVerifier.create(eventSource.push(Event.draft("org", "o2", "i2", "org.added", "{}")))
                .assertNext(e -> assertThat(e.sequence()).isEqualTo(1))
                .verifyComplete();

        assertThat(published).extracting(Event::eventType)
                .containsExactly("org.added", "org.changed", "org.added");
    }

    @Test
    void filterReturnsEventsAfterSequenceInAscendingOrder() {
        pushOrgEvents("i1", 3);

        SearchQuery query = SearchQuery.builder()
                .clause(SearchQuery.Clause.builder().aggregateType("org").instanceId("i1").sequenceGreater(1L).build())
                .limit(10)
                .build();

        StepVerifier.create(eventSource.filter(query).map(Event::sequence))
                .expectNext(2L, 3L)
                .verifyComplete();
    }

    @Test
    void filterHonoursReadTimestampOfCall() {
        pushOrgEvents("i1", 2);
        SearchQuery query = SearchQuery.builder()
                .clause(SearchQuery.Clause.builder().aggregateType("org").instanceId("i1").build())
                .allowTimeTravel(true)
                .build();
        CallContext before = CallContext.forInstance("i1", OffsetDateTime.ofInstant(NOW.minusSeconds(60), ZoneOffset.UTC));

        StepVerifier.create(eventSource.filter(query).contextWrite(before.asContext()))
                .verifyComplete();

        before.resetReadTimestamp();
        StepVerifier.create(eventSource.filter(query).contextWrite(before.asContext()))
                .expectNextCount(2)
                .verifyComplete();
    }

    @Test
    void instanceIdsSkipsExcludedInstance() {
        pushOrgEvents("i1", 1);
        pushOrgEvents("i2", 2);
        pushOrgEvents("", 1);

        SearchQuery query = SearchQuery.builder()
                .clause(SearchQuery.Clause.builder().excludedInstanceId("").build())
                .build();

        StepVerifier.create(eventSource.instanceIds(query))
                .expectNext("i1", "i2")
                .verifyComplete();
    }

    private void pushOrgEvents(String instanceId, int count) {
        for (int i = 0; i < count; i++) {
            eventSource.push(Event.draft("org", "o1", instanceId, "org.changed", "{}")).block();
        }
    }
}
