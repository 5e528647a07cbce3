package com.github.dimitryivaniuta.iam.projection.state;

import com.github.dimitryivaniuta.iam.projection.handler.ProjectionDefinition;
import com.github.dimitryivaniuta.iam.projection.statement.Identifiers;
import io.r2dbc.spi.Row;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Read and admin access to the projection bookkeeping tables.
 */
@Slf4j
public class ProjectionStateQueries {

    static final String RESET_LOCKER = "reset";

    private final DatabaseClient db;
    private final TransactionalOperator tx;
    private final Clock clock;
    private final Duration resetLockDuration;

    public ProjectionStateQueries(DatabaseClient db, TransactionalOperator tx, Clock clock, Duration resetLockDuration) {
        this.db = requireNonNull(db, "db");
        this.tx = requireNonNull(tx, "tx");
        this.clock = requireNonNull(clock, "clock");
        this.resetLockDuration = requireNonNull(resetLockDuration, "resetLockDuration");
    }

    /** All current sequences, or those of one instance when {@code instanceId} is not {@code null}. */
    public Flux<CurrentSequence> currentSequences(String instanceId) {
        String sql = """
                SELECT projection_name, aggregate_type, instance_id, current_sequence, last_updated
                  FROM projections.current_sequences
                """
                + (instanceId == null ? "" : " WHERE instance_id = :instance_id")
                + " ORDER BY projection_name, aggregate_type, instance_id";
        DatabaseClient.GenericExecuteSpec spec = db.sql(sql);
        if (instanceId != null) {
            spec = spec.bind("instance_id", instanceId);
        }
        return spec.map((row, md) -> mapSequence(row)).all();
    }

    /** Highest sequence any of {@code projections} reached for the instance; empty if none. */
    public Mono<CurrentSequence> latestSequence(String instanceId, Collection<String> projections) {
        requireNonNull(instanceId, "instanceId");
        if (projections == null || projections.isEmpty()) {
            return Mono.empty();
        }
        return db.sql("""
                        SELECT projection_name, aggregate_type, instance_id, current_sequence, last_updated
                          FROM projections.current_sequences
                         WHERE instance_id = :instance_id
                           AND projection_name IN (:projections)
                         ORDER BY current_sequence DESC, last_updated DESC
                         LIMIT 1
                        """)
                .bind("instance_id", instanceId)
                .bind("projections", List.copyOf(projections))
                .map((row, md) -> mapSequence(row))
                .one();
    }

    public Flux<FailedEvent> failedEvents(String projectionName) {
        requireNonNull(projectionName, "projectionName");
        return db.sql("""
                        SELECT projection_name, instance_id, failed_sequence, failure_count, error, last_failed
                          FROM projections.failed_events
                         WHERE projection_name = :projection_name
                         ORDER BY instance_id, failed_sequence
                        """)
                .bind("projection_name", projectionName)
                .map((row, md) -> new FailedEvent(
                        row.get(0, String.class),
                        row.get(1, String.class),
                        Optional.ofNullable(row.get(2, Long.class)).orElse(0L),
                        Optional.ofNullable(row.get(3, Integer.class)).orElse(0),
                        row.get(4, String.class),
                        row.get(5, OffsetDateTime.class)))
                .all();
    }

    /** Forgets the failures of one event so it is retried; emits whether a row was removed. */
    public Mono<Boolean> removeFailedEvent(String projectionName, String instanceId, long sequence) {
        return db.sql("""
                        DELETE FROM projections.failed_events
                         WHERE projection_name = :projection_name
                           AND instance_id     = :instance_id
                           AND failed_sequence = :failed_sequence
                        """)
                .bind("projection_name", projectionName)
                .bind("instance_id", instanceId)
                .bind("failed_sequence", sequence)
                .fetch().rowsUpdated()
                .map(rows -> rows > 0);
    }

    /**
     * Empties the projection's tables and sets its sequences back to 0 so it is rebuilt from
     * the first event. Existing lock rows are taken over for {@code resetLockDuration} so no
     * sweep writes in between.
     */
    public Mono<Void> reset(ProjectionDefinition projection) {
        final String name = projection.getName();
        final List<String> tables = projection.tables();
        tables.forEach(Identifiers::requireValidTable);
        final OffsetDateTime now = OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);

        Mono<Void> work = db.sql("""
                        UPDATE projections.locks
                           SET locker_id    = :locker_id,
                               locked_until = :until
                         WHERE projection_name = :projection_name
                        """)
                .bind("locker_id", RESET_LOCKER)
                .bind("until", now.plus(resetLockDuration))
                .bind("projection_name", name)
                .fetch().rowsUpdated()
                .thenMany(Flux.fromIterable(tables)
                        .concatMap(table -> db.sql("DELETE FROM " + table).fetch().rowsUpdated()))
                .then(db.sql("""
                                UPDATE projections.current_sequences
                                   SET current_sequence = 0,
                                       last_updated     = :now
                                 WHERE projection_name = :projection_name
                                """)
                        .bind("now", now)
                        .bind("projection_name", name)
                        .fetch().rowsUpdated())
                .then(db.sql("DELETE FROM projections.failed_events WHERE projection_name = :projection_name")
                        .bind("projection_name", name)
                        .fetch().rowsUpdated())
                .then();

        return tx.transactional(work)
                .doOnSuccess(v -> log.info("Projection reset: projection={} tables={}", name, tables));
    }

    private static CurrentSequence mapSequence(Row row) {
        return new CurrentSequence(
                row.get(0, String.class),
                row.get(1, String.class),
                row.get(2, String.class),
                Optional.ofNullable(row.get(3, Long.class)).orElse(0L),
                row.get(4, OffsetDateTime.class));
    }
}
