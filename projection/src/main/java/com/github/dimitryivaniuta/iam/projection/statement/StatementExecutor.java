package com.github.dimitryivaniuta.iam.projection.statement;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Runs the SQL of an operation on the connection of the surrounding transaction.
 */
@Slf4j
@RequiredArgsConstructor
public class StatementExecutor {

    private final DatabaseClient db;

    public Mono<Void> execute(String projectionName, Operation operation) {
        return Flux.fromIterable(OperationSql.render(projectionName, operation))
                .concatMap(rendered -> {
                    if (log.isTraceEnabled()) {
                        log.trace("Executing projection sql: projection={} sql={}", projectionName, rendered.sql());
                    }
                    return bindAll(db.sql(rendered.sql()), rendered.binds()).fetch().rowsUpdated();
                })
                .then();
    }

    private static DatabaseClient.GenericExecuteSpec bindAll(DatabaseClient.GenericExecuteSpec spec, Map<String, Object> binds) {
        for (Map.Entry<String, Object> bind : binds.entrySet()) {
            spec = spec.bind(bind.getKey(), bind.getValue());
        }
        return spec;
    }
}
