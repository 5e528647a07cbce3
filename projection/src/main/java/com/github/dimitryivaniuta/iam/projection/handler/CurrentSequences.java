package com.github.dimitryivaniuta.iam.projection.handler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Access to {@code projections.current_sequences}. Writes only make sense inside the
 * transaction that applied the statements.
 */
@Slf4j
@RequiredArgsConstructor
public class CurrentSequences {

    private final DatabaseClient db;

    /**
     * Reads the sequences of the given aggregate types and instances. Pairs without a row are absent
     * from the result. {@code forUpdate} row-locks the rows until the transaction ends.
     */
    public Mono<Map<SequenceKey, Long>> read(String projectionName,
                                             Collection<String> aggregateTypes,
                                             Collection<String> instanceIds,
                                             boolean forUpdate) {
        requireNonNull(projectionName, "projectionName");
        if (aggregateTypes.isEmpty() || instanceIds.isEmpty()) {
            return Mono.just(Map.of());
        }
        final String sql = """
                SELECT aggregate_type, instance_id, current_sequence
                  FROM projections.current_sequences
                 WHERE projection_name = :projection_name
                   AND instance_id IN (:instance_ids)
                   AND aggregate_type IN (:aggregate_types)
                """ + (forUpdate ? " FOR UPDATE" : "");

        return db.sql(sql)
                .bind("projection_name", projectionName)
                .bind("instance_ids", List.copyOf(instanceIds))
                .bind("aggregate_types", List.copyOf(aggregateTypes))
                .map((row, md) -> Map.entry(
                        new SequenceKey(row.get(0, String.class), row.get(1, String.class)),
                        requireNonNull(row.get(2, Long.class))))
                .all()
                .collectMap(Map.Entry::getKey, Map.Entry::getValue, HashMap::new);
    }

    /**
     * Stores {@code sequences}; keys in {@code existing} are updated, the others upserted.
     * An insert that finds the row already written by a concurrent transaction raises the
     * stored sequence instead, never lowering it. Every write has to hit a row.
     */
    public Mono<Void> write(String projectionName,
                            Map<SequenceKey, Long> sequences,
                            Set<SequenceKey> existing,
                            OffsetDateTime now) {
        return Flux.fromIterable(sequences.entrySet())
                .concatMap(e -> (existing.contains(e.getKey())
                        ? update(projectionName, e.getKey(), e.getValue(), now)
                        : upsert(projectionName, e.getKey(), e.getValue(), now))
                        .flatMap(rows -> rows > 0
                                ? Mono.<Void>empty()
                                : Mono.<Void>error(new SequenceUpdateException(projectionName, e.getKey(), e.getValue()))))
                .then()
                .doOnSuccess(v -> log.debug("Current sequences written: projection={} sequences={}", projectionName, sequences));
    }

    private Mono<Long> update(String projectionName, SequenceKey key, long sequence, OffsetDateTime now) {
        return db.sql("""
                        UPDATE projections.current_sequences
                           SET current_sequence = :sequence,
                               last_updated     = :now
                         WHERE projection_name = :projection_name
                           AND aggregate_type  = :aggregate_type
                           AND instance_id     = :instance_id
                        """)
                .bind("sequence", sequence)
                .bind("now", now)
                .bind("projection_name", projectionName)
                .bind("aggregate_type", key.aggregateType())
                .bind("instance_id", key.instanceId())
                .fetch().rowsUpdated();
    }

    private Mono<Long> upsert(String projectionName, SequenceKey key, long sequence, OffsetDateTime now) {
        return insert(projectionName, key, sequence, now)
                .flatMap(rows -> {
                    if (rows > 0) {
                        return Mono.just(rows);
                    }
                    log.debug("Current sequence inserted concurrently, raising it: projection={} key={} sequence={}",
                            projectionName, key, sequence);
                    return raise(projectionName, key, sequence, now);
                });
    }

    private Mono<Long> insert(String projectionName, SequenceKey key, long sequence, OffsetDateTime now) {
        return db.sql("""
                        INSERT INTO projections.current_sequences
                          (projection_name, aggregate_type, instance_id, current_sequence, last_updated)
                        VALUES
                          (:projection_name, :aggregate_type, :instance_id, :sequence, :now)
                        ON CONFLICT DO NOTHING
                        """)
                .bind("projection_name", projectionName)
                .bind("aggregate_type", key.aggregateType())
                .bind("instance_id", key.instanceId())
                .bind("sequence", sequence)
                .bind("now", now)
                .fetch().rowsUpdated();
    }

    private Mono<Long> raise(String projectionName, SequenceKey key, long sequence, OffsetDateTime now) {
        return db.sql("""
                        UPDATE projections.current_sequences
                           SET current_sequence = GREATEST(current_sequence, :sequence),
                               last_updated     = :now
                         WHERE projection_name = :projection_name
                           AND aggregate_type  = :aggregate_type
                           AND instance_id     = :instance_id
                        """)
                .bind("sequence", sequence)
                .bind("now", now)
                .bind("projection_name", projectionName)
                .bind("aggregate_type", key.aggregateType())
                .bind("instance_id", key.instanceId())
                .fetch().rowsUpdated();
    }
}
