package com.github.dimitryivaniuta.iam.eventstore;

import com.github.dimitryivaniuta.iam.common.context.CallContext;
import com.github.dimitryivaniuta.iam.eventstore.sql.SearchQuerySql;
import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * {@link EventSource} over the {@code eventstore.events} table.
 *
 * <p>Appended events are handed to the local {@link EventSubscriptions} once committed.
 */
@Slf4j
@RequiredArgsConstructor
public class R2dbcEventSource implements EventSource {

    private final DatabaseClient db;
    private final TransactionalOperator tx;
    private final SearchQuerySql sql;
    private final EventSubscriptions subscriptions;
    private final Clock clock;

    @Override
    public Flux<Event> filter(SearchQuery query) {
        requireNonNull(query, "query");
        return Mono.deferContextual(ctx -> Mono.just(sql.events(query, readTimestamp(ctx))))
                .flatMapMany(rendered -> bindAll(db.sql(rendered.sql()), rendered.binds())
                        .map(R2dbcEventSource::mapEvent)
                        .all())
                .doOnError(ex -> log.warn("Event filter failed", ex));
    }

    @Override
    public Flux<String> instanceIds(SearchQuery query) {
        requireNonNull(query, "query");
        return Mono.deferContextual(ctx -> Mono.just(sql.instanceIds(query, readTimestamp(ctx))))
                .flatMapMany(rendered -> bindAll(db.sql(rendered.sql()), rendered.binds())
                        .map((row, md) -> row.get(0, String.class))
                        .all());
    }

    @Override
    public Mono<Event> push(Event draft) {
        requireNonNull(draft, "event");
        final OffsetDateTime now = OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);

        Mono<Event> append = db.sql("""
                        SELECT MAX(event_sequence)
                          FROM eventstore.events
                         WHERE aggregate_type = :aggregate_type
                           AND instance_id = :instance_id
                        """)
                .bind("aggregate_type", draft.aggregateType())
                .bind("instance_id", draft.instanceId())
                .map((row, md) -> Optional.ofNullable(row.get(0, Long.class)))
                .one()
                .defaultIfEmpty(Optional.empty())
                .map(max -> max.orElse(0L))
                .flatMap(previous -> {
                    Event stored = new Event(
                            draft.aggregateType(), draft.aggregateId(), draft.instanceId(),
                            draft.resourceOwner() == null ? draft.instanceId() : draft.resourceOwner(),
                            draft.eventType(), previous + 1, previous, now, draft.payload());
                    return db.sql("""
                                    INSERT INTO eventstore.events
                                      (aggregate_type, aggregate_id, instance_id, resource_owner, event_type,
                                       event_sequence, previous_aggregate_type_sequence, creation_date, payload)
                                    VALUES
                                      (:aggregate_type, :aggregate_id, :instance_id, :resource_owner, :event_type,
                                       :event_sequence, :previous_sequence, :creation_date, :payload)
                                    """)
                            .bind("aggregate_type", stored.aggregateType())
                            .bind("aggregate_id", stored.aggregateId())
                            .bind("instance_id", stored.instanceId())
                            .bind("resource_owner", stored.resourceOwner())
                            .bind("event_type", stored.eventType())
                            .bind("event_sequence", stored.sequence())
                            .bind("previous_sequence", stored.previousAggregateTypeSequence())
                            .bind("creation_date", stored.creationDate())
                            .bind("payload", stored.payload())
                            .fetch().rowsUpdated()
                            .thenReturn(stored);
                });

        return tx.transactional(append)
                .doOnSuccess(stored -> {
                    log.debug("Event pushed: aggregateType={} aggregateId={} instance={} eventType={} sequence={}",
                            stored.aggregateType(), stored.aggregateId(), stored.instanceId(),
                            stored.eventType(), stored.sequence());
                    subscriptions.publish(List.of(stored));
                });
    }

    private static OffsetDateTime readTimestamp(ContextView ctx) {
        return CallContext.from(ctx).flatMap(CallContext::readTimestamp).orElse(null);
    }

    private static DatabaseClient.GenericExecuteSpec bindAll(DatabaseClient.GenericExecuteSpec spec, Map<String, Object> binds) {
        for (Map.Entry<String, Object> bind : binds.entrySet()) {
            spec = spec.bind(bind.getKey(), bind.getValue());
        }
        return spec;
    }

    static Event mapEvent(Row row, RowMetadata md) {
        Long sequence = row.get(5, Long.class);
        Long previous = row.get(6, Long.class);
        return new Event(
                row.get(0, String.class),
                row.get(1, String.class),
                row.get(2, String.class),
                row.get(3, String.class),
                row.get(4, String.class),
                sequence == null ? 0 : sequence,
                previous == null ? 0 : previous,
                row.get(7, OffsetDateTime.class),
                row.get(8, String.class)
        );
    }
}
