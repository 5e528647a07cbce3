package com.github.dimitryivaniuta.iam.projection.handler;

import com.github.dimitryivaniuta.iam.eventstore.Event;
import com.github.dimitryivaniuta.iam.eventstore.SearchQuery;
import com.github.dimitryivaniuta.iam.projection.H2Projections;
import com.github.dimitryivaniuta.iam.projection.config.ProjectionConfig;
import com.github.dimitryivaniuta.iam.projection.statement.Operation;
import com.github.dimitryivaniuta.iam.projection.statement.Statement;
import com.github.dimitryivaniuta.iam.projection.statement.Statements;
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
import java.util.List;
import java.util.Set;

import static com.github.dimitryivaniuta.iam.projection.statement.Statements.col;
import static com.github.dimitryivaniuta.iam.projection.statement.Statements.where;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class StatementHandlerTest {

    private static final String PROJECTION = "projections.orgs";
    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");
    private static final OffsetDateTime CREATED = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);

    private static DatabaseClient db;
    private static TransactionalOperator tx;

    private InMemoryEventSource eventSource;

    private final Reducer reducer = e -> e.eventType().equals("org.added")
            ? Statements.create(e, col("id", e.aggregateId()), col("instance_id", e.instanceId()), col("name", e.payload()))
            : Statements.update(e, List.of(col("name", e.payload())),
                    List.of(where("id", e.aggregateId()), where("instance_id", e.instanceId())));

    @BeforeAll
    static void database() {
        ConnectionFactory cf = H2Projections.connectionFactory("statement-handler-test");
        db = DatabaseClient.create(cf);
        tx = TransactionalOperator.create(new R2dbcTransactionManager(cf));
        H2Projections.createSchema(db);
    }

    @BeforeEach
    void setUp() {
        H2Projections.clear(db);
        eventSource = new InMemoryEventSource();
    }

    @Test
    void appliesAllStatementsInOrderOverEmptySequences() {
        StepVerifier.create(handler(5).update(List.of(create("i1", 5, 4), create("i1", 6, 5), create("i1", 7, 6)), reducer))
                .expectNext(2)
                .verifyComplete();

        assertThat(sequence("org", "i1")).isEqualTo(7L);
        assertThat(H2Projections.count(db, PROJECTION)).isEqualTo(3);
    }

    @Test
    void failedStatementBlocksItsPairAndCommitsThePrefix() {
        List<Statement> statements = List.of(create("i1", 5, 4), broken("i1", 6, 5), create("i1", 7, 6));

        StepVerifier.create(handler(5).update(statements, reducer))
                .expectErrorSatisfies(ex -> assertThat(ex)
                        .isInstanceOfSatisfying(StatementsFailedException.class,
                                failed -> assertThat(failed.getLastAppliedIndex()).isZero()))
                .verify();

        assertThat(sequence("org", "i1")).isEqualTo(5L);
        assertThat(failureCount("i1", 6)).isEqualTo(1);
        assertThat(names()).containsExactly("org-5");
    }

    @Test
    void otherPairsContinueAfterAFailure() {
        List<Statement> statements = List.of(broken("A", 1, 0), create("B", 1, 0));

        StepVerifier.create(handler(5).update(statements, reducer))
                .expectError(StatementsFailedException.class)
                .verify();

        assertThat(sequence("org", "A")).isNull();
        assertThat(sequence("org", "B")).isEqualTo(1L);
    }

    @Test
    void keepsOneSequencePerInstance() {
        StepVerifier.create(handler(5).update(List.of(create("A", 1, 0), create("B", 1, 0)), reducer))
                .expectNext(1)
                .verifyComplete();

        assertThat(sequence("org", "A")).isEqualTo(1L);
        assertThat(sequence("org", "B")).isEqualTo(1L);
    }

    @Test
    void alreadyAppliedStatementsAreNotExecutedAgain() {
        List<Statement> statements = List.of(create("i1", 5, 4), create("i1", 6, 5), create("i1", 7, 6));
        StatementHandler handler = handler(5);
        handler.update(statements, reducer).block();

        // the inserts would violate the primary key if they ran again
        StepVerifier.create(handler.update(statements, reducer))
                .expectNext(2)
                .verifyComplete();

        assertThat(sequence("org", "i1")).isEqualTo(7L);
        assertThat(H2Projections.count(db, "projections.failed_events")).isZero();
    }

    @Test
    void eventIsSkippedOnceItFailedMoreThanMaxFailureCount() {
        List<Statement> statements = List.of(create("i1", 5, 4), broken("i1", 6, 5), create("i1", 7, 6));
        StatementHandler handler = handler(1);

        StepVerifier.create(handler.update(statements, reducer))
                .expectError(StatementsFailedException.class)
                .verify();
        StepVerifier.create(handler.update(statements, reducer))
                .expectNext(2)
                .verifyComplete();

        assertThat(sequence("org", "i1")).isEqualTo(7L);
        assertThat(failureCount("i1", 6)).isEqualTo(2);
        assertThat(names()).containsExactlyInAnyOrder("org-5", "org-7");
    }

    @Test
    void missingEventsAreAppliedBeforeTheStatement() {
        eventSource.with(
                event("org.added", 1, 0, "first"),
                event("org.changed", 2, 1, "second"));
        Statement third = reducer.reduce(event("org.changed", 3, 2, "third"));

        StepVerifier.create(handler(5).update(List.of(third), reducer))
                .expectNext(0)
                .verifyComplete();

        assertThat(sequence("org", "i1")).isEqualTo(3L);
        assertThat(names()).containsExactly("third");
    }

    @Test
    void gapReductionFailureRollsBackEverything() {
        eventSource.with(event("org.added", 1, 0, "first"));
        Reducer failing = e -> {
            throw new IllegalStateException("cannot reduce");
        };

        StepVerifier.create(handler(5).update(List.of(create("i1", 2, 1)), failing))
                .expectError(ReductionException.class)
                .verify();

        assertThat(sequence("org", "i1")).isNull();
        assertThat(H2Projections.count(db, PROJECTION)).isZero();
    }

    @Test
    void multiStatementSharesOneSavepoint() {
        Statement multi = new Statement("org", "o1", "i1", 1, 0, CREATED, new Operation.Multi(List.of(
                new Operation.Create(null, List.of(col("id", "o1"), col("instance_id", "i1"), col("name", "acme")), List.of()),
                new Operation.Create("domains", List.of(col("org_id", "o1"), col("missing", "x")), List.of()))));

        StepVerifier.create(handler(5).update(List.of(multi), reducer))
                .expectErrorSatisfies(ex -> assertThat(((StatementsFailedException) ex).getLastAppliedIndex()).isEqualTo(-1))
                .verify();

        assertThat(H2Projections.count(db, PROJECTION)).isZero();
        assertThat(failureCount("i1", 1)).isEqualTo(1);
    }

    @Test
    void noOpAdvancesTheSequence() {
        Statement noOp = new Statement("org", "o1", "i1", 3, 2, CREATED, new Operation.NoOp());

        StepVerifier.create(handler(5).update(List.of(noOp), reducer))
                .expectNext(0)
                .verifyComplete();

        assertThat(sequence("org", "i1")).isEqualTo(3L);
    }

    @Test
    void emptyBatchAppliesNothing() {
        StepVerifier.create(handler(5).update(List.of(), reducer))
                .expectNext(-1)
                .verifyComplete();
    }

    @Test
    void searchQueryStartsAfterCurrentSequences() {
        StatementHandler handler = handler(5);
        handler.update(List.of(create("i1", 7, 6)), reducer).block();

        SearchQuery query = handler.searchQuery(List.of("i1", "i2")).block();

        assertThat(query).isNotNull();
        assertThat(query.getLimit()).isEqualTo(100);
        assertThat(query.isAllowTimeTravel()).isTrue();
        assertThat(query.getClauses())
                .extracting(SearchQuery.Clause::getInstanceId, SearchQuery.Clause::getSequenceGreater)
                .containsExactly(
                        tuple("i1", 7L),
                        tuple("i2", 0L));
    }

    private StatementHandler handler(int maxFailureCount) {
        ProjectionConfig config = ProjectionConfig.builder()
                .projectionName(PROJECTION)
                .maxFailureCount(maxFailureCount)
                .bulkLimit(100)
                .build();
        return new StatementHandler(config, Set.of("org"), db, tx, eventSource, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Statement create(String instanceId, long sequence, long previous) {
        return new Statement("org", "o" + sequence, instanceId, sequence, previous, CREATED,
                new Operation.Create(null, List.of(
                        col("id", "o" + sequence),
                        col("instance_id", instanceId),
                        col("name", "org-" + sequence)), List.of()));
    }

    // fails in the database: the column does not exist
    private static Statement broken(String instanceId, long sequence, long previous) {
        return new Statement("org", "o" + sequence, instanceId, sequence, previous, CREATED,
                new Operation.Create(null, List.of(col("id", "o" + sequence), col("missing", 1)), List.of()));
    }

    private static Event event(String eventType, long sequence, long previous, String name) {
        return new Event("org", "o1", "i1", "i1", eventType, sequence, previous, CREATED, name);
    }

    private static Long sequence(String aggregateType, String instanceId) {
        return db.sql("""
                        SELECT current_sequence FROM projections.current_sequences
                         WHERE projection_name = :p AND aggregate_type = :t AND instance_id = :i
                        """)
                .bind("p", PROJECTION)
                .bind("t", aggregateType)
                .bind("i", instanceId)
                .map((row, md) -> row.get(0, Long.class))
                .one()
                .block();
    }

    private static Integer failureCount(String instanceId, long sequence) {
        return db.sql("""
                        SELECT failure_count FROM projections.failed_events
                         WHERE projection_name = :p AND instance_id = :i AND failed_sequence = :s
                        """)
                .bind("p", PROJECTION)
                .bind("i", instanceId)
                .bind("s", sequence)
                .map((row, md) -> row.get(0, Integer.class))
                .one()
                .block();
    }

    private static List<String> names() {
        return db.sql("SELECT name FROM projections.orgs ORDER BY id")
                .map((row, md) -> row.get(0, String.class))
                .all()
                .collectList()
                .block();
    }
}
