package com.github.dimitryivaniuta.iam.projection.handler;

import com.github.dimitryivaniuta.iam.projection.statement.Statement;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;

/**
 * Failure counters in {@code projections.failed_events}.
 */
@RequiredArgsConstructor
public class FailedEvents {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final DatabaseClient db;

    /** Counts one more failure of the statement's event and returns the new count. */
    public Mono<Integer> increment(String projectionName, Statement statement, Throwable error, OffsetDateTime now) {
        final String message = errorMessage(error);
        return db.sql("""
                        SELECT failure_count
                          FROM projections.failed_events
                         WHERE projection_name = :projection_name
                           AND instance_id     = :instance_id
                           AND failed_sequence = :failed_sequence
                         FOR UPDATE
                        """)
                .bind("projection_name", projectionName)
                .bind("instance_id", statement.getInstanceId())
                .bind("failed_sequence", statement.getSequence())
                .map((row, md) -> row.get(0, Integer.class))
                .one()
                .flatMap(count -> {
                    int next = count + 1;
                    return db.sql("""
                                    UPDATE projections.failed_events
                                       SET failure_count = :failure_count,
                                           error         = :error,
                                           last_failed   = :now
                                     WHERE projection_name = :projection_name
                                       AND instance_id     = :instance_id
                                       AND failed_sequence = :failed_sequence
                                    """)
                            .bind("failure_count", next)
                            .bind("error", message)
                            .bind("now", now)
                            .bind("projection_name", projectionName)
                            .bind("instance_id", statement.getInstanceId())
                            .bind("failed_sequence", statement.getSequence())
                            .fetch().rowsUpdated()
                            .thenReturn(next);
                })
                .switchIfEmpty(Mono.defer(() -> db.sql("""
                                INSERT INTO projections.failed_events
                                  (projection_name, instance_id, failed_sequence, failure_count, error, last_failed)
                                VALUES
                                  (:projection_name, :instance_id, :failed_sequence, 1, :error, :now)
                                """)
                        .bind("projection_name", projectionName)
                        .bind("instance_id", statement.getInstanceId())
                        .bind("failed_sequence", statement.getSequence())
                        .bind("error", message)
                        .bind("now", now)
                        .fetch().rowsUpdated()
                        .thenReturn(1)));
    }

    private static String errorMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getClass().getSimpleName() + ": " + root.getMessage();
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
