package com.github.dimitryivaniuta.iam.projection.handler;

import com.github.dimitryivaniuta.iam.eventstore.Event;
import com.github.dimitryivaniuta.iam.eventstore.EventSource;
import com.github.dimitryivaniuta.iam.eventstore.SearchQuery;
import com.github.dimitryivaniuta.iam.projection.config.ProjectionConfig;
import com.github.dimitryivaniuta.iam.projection.statement.Statement;
import com.github.dimitryivaniuta.iam.projection.statement.StatementExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Applies reduced statements of one projection.
 *
 * <p>One {@link #update} call is one transaction:
 * <ol>
 *   <li>current sequences of the touched (aggregate type, instance) pairs are read {@code FOR UPDATE};</li>
 *   <li>missing events between the known sequence and a statement are fetched, reduced and applied first;</li>
 *   <li>statements at or below the known sequence are dropped;</li>
 *   <li>every other statement runs in its own savepoint; a failure is counted in
 *       {@code projections.failed_events} and blocks the rest of its pair for this call,
 *       unless the event failed more than {@code maxFailureCount} times, then it is skipped;</li>
 *   <li>sequences advance to the last applied statement of each pair.</li>
 * </ol>
 * A partially applied batch is committed and reported as {@link StatementsFailedException}.
 */
@Slf4j
public class StatementHandler {

    static final String SAVEPOINT = "exec_stmt";

    private final String projectionName;
    private final Set<String> aggregateTypes;
    private final int maxFailureCount;
    private final int bulkLimit;
    private final DatabaseClient db;
    private final TransactionalOperator tx;
    private final EventSource eventSource;
    private final StatementExecutor executor;
    private final CurrentSequences currentSequences;
    private final FailedEvents failedEvents;
    private final Clock clock;

    public StatementHandler(ProjectionConfig config,
                            Collection<String> aggregateTypes,
                            DatabaseClient db,
                            TransactionalOperator tx,
                            EventSource eventSource,
                            Clock clock) {
        this.projectionName = requireNonNull(config.getProjectionName(), "projectionName");
        this.aggregateTypes = Set.copyOf(aggregateTypes);
        this.maxFailureCount = config.getMaxFailureCount();
        this.bulkLimit = config.getBulkLimit();
        this.db = requireNonNull(db, "db");
        this.tx = requireNonNull(tx, "tx");
        this.eventSource = requireNonNull(eventSource, "eventSource");
        this.executor = new StatementExecutor(db);
        this.currentSequences = new CurrentSequences(db);
        this.failedEvents = new FailedEvents(db);
        this.clock = requireNonNull(clock, "clock");
    }

    public String projectionName() {
        return projectionName;
    }

    /**
     * Query for the next events of the given instances: one clause per aggregate type and
     * instance starting after its current sequence, capped at the bulk limit.
     */
    public Mono<SearchQuery> searchQuery(List<String> instanceIds) {
        return currentSequences.read(projectionName, aggregateTypes, instanceIds, false)
                .map(known -> {
                    SearchQuery.SearchQueryBuilder query = SearchQuery.builder()
                            .limit(bulkLimit)
                            .allowTimeTravel(true);
                    for (String aggregateType : aggregateTypes) {
                        for (String instanceId : instanceIds) {
                            query.clause(SearchQuery.Clause.builder()
                                    .aggregateType(aggregateType)
                                    .instanceId(instanceId)
                                    .sequenceGreater(known.getOrDefault(new SequenceKey(aggregateType, instanceId), 0L))
                                    .build());
                        }
                    }
                    return query.build();
                });
    }

    /**
     * Applies {@code statements} and emits the index of the last one applied, {@code -1} for an
     * empty list. {@code reducer} reduces gap-filling events.
     */
    public Mono<Integer> update(List<Statement> statements, Reducer reducer) {
        requireNonNull(statements, "statements");
        if (statements.isEmpty()) {
            return Mono.just(-1);
        }
        Set<String> types = new LinkedHashSet<>();
        Set<String> instances = new LinkedHashSet<>();
        statements.forEach(s -> {
            types.add(s.getAggregateType());
            instances.add(s.getInstanceId());
        });

        Mono<Run> work = currentSequences.read(projectionName, types, instances, true)
                .flatMap(known -> plan(statements, known, reducer)
                        .flatMap(planned -> execute(planned, known)));

        return tx.transactional(work)
                .flatMap(run -> {
                    if (run.failed) {
                        log.warn("Some statements failed: projection={} lastAppliedIndex={} size={}",
                                projectionName, run.lastIndex, statements.size());
                        return Mono.<Integer>error(new StatementsFailedException(projectionName, run.lastIndex));
                    }
                    return Mono.just(run.lastIndex);
                });
    }

    private record Planned(Statement statement, int origin) {}

    // Inserts the statements of missing events in front of the statement that reveals the gap.
    private Mono<List<Planned>> plan(List<Statement> statements, Map<SequenceKey, Long> known, Reducer reducer) {
        Map<SequenceKey, Long> cursor = new HashMap<>(known);
        return Flux.range(0, statements.size())
                .concatMap(i -> {
                    Statement statement = statements.get(i);
                    SequenceKey key = SequenceKey.of(statement);
                    long last = cursor.getOrDefault(key, 0L);
                    Mono<List<Planned>> gap = hasGap(statement, last)
                            ? fetchPrevious(statement, last, reducer)
                            : Mono.just(List.of());
                    return gap.flatMapIterable(previous -> {
                        cursor.merge(key, statement.getSequence(), Math::max);
                        List<Planned> out = new ArrayList<>(previous);
                        out.add(new Planned(statement, i));
                        return out;
                    });
                })
                .collectList();
    }

    private static boolean hasGap(Statement statement, long last) {
        return statement.getSequence() > last
                && (statement.getPreviousSequence() == 0 || statement.getPreviousSequence() != last);
    }

    private Mono<List<Planned>> fetchPrevious(Statement statement, long last, Reducer reducer) {
        SearchQuery query = SearchQuery.builder()
                .clause(SearchQuery.Clause.builder()
                        .aggregateType(statement.getAggregateType())
                        .instanceId(statement.getInstanceId())
                        .sequenceGreater(last)
                        .sequenceLess(statement.getSequence())
                        .build())
                .build();
        return eventSource.filter(query)
                .map(event -> new Planned(reduceGap(reducer, event), -1))
                .collectList()
                .doOnNext(previous -> {
                    if (!previous.isEmpty()) {
                        log.debug("Gap filled: projection={} aggregateType={} instance={} from={} to={} events={}",
                                projectionName, statement.getAggregateType(), statement.getInstanceId(),
                                last, statement.getSequence(), previous.size());
                    }
                });
    }

    private static Statement reduceGap(Reducer reducer, Event event) {
        try {
            Statement reduced = reducer.reduce(event);
            if (reduced == null) {
                throw new ReductionException(event, "reducer returned no statement");
            }
            return reduced;
        } catch (ReductionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ReductionException(event, e);
        }
    }

    /** Mutable bookkeeping of one update call. */
    private static final class Run {
        final Map<SequenceKey, Long> applied;
        final Map<SequenceKey, Long> advanced = new LinkedHashMap<>();
        final Set<SequenceKey> blocked = new HashSet<>();
        int lastIndex = -1;
        boolean failed;

        Run(Map<SequenceKey, Long> known) {
            this.applied = new HashMap<>(known);
        }

        void done(Planned planned) {
            if (!failed && planned.origin() >= 0) {
                lastIndex = planned.origin();
            }
        }

        void advance(SequenceKey key, long sequence) {
            applied.put(key, sequence);
            advanced.put(key, sequence);
        }
    }

    private Mono<Run> execute(List<Planned> planned, Map<SequenceKey, Long> known) {
        final Run run = new Run(known);
        final OffsetDateTime now = OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);

        return Flux.fromIterable(planned)
                .concatMap(p -> step(run, p, now))
                .then(Mono.defer(() -> currentSequences.write(projectionName, run.advanced, known.keySet(), now)))
                .thenReturn(run);
    }

    private Mono<Void> step(Run run, Planned planned, OffsetDateTime now) {
        Statement statement = planned.statement();
        SequenceKey key = SequenceKey.of(statement);

        if (run.blocked.contains(key)) {
            return Mono.empty();
        }
        if (statement.getSequence() <= run.applied.getOrDefault(key, 0L)) {
            log.trace("Statement already applied: projection={} aggregateType={} instance={} sequence={}",
                    projectionName, key.aggregateType(), key.instanceId(), statement.getSequence());
            run.done(planned);
            return Mono.empty();
        }
        return executeIsolated(statement)
                .then(Mono.fromRunnable(() -> {
                    run.advance(key, statement.getSequence());
                    run.done(planned);
                }))
                .onErrorResume(StatementExecutionException.class, ex -> failedEvents
                        .increment(projectionName, statement, ex, now)
                        .doOnNext(count -> {
                            if (count > maxFailureCount) {
                                log.warn("Event skipped after {} failures: projection={} aggregateType={} instance={} sequence={}",
                                        count, projectionName, key.aggregateType(), key.instanceId(), statement.getSequence(), ex);
                                run.advance(key, statement.getSequence());
                                run.done(planned);
                            } else {
                                log.warn("Statement failed ({} of {}): projection={} aggregateType={} instance={} sequence={}",
                                        count, maxFailureCount, projectionName, key.aggregateType(), key.instanceId(),
                                        statement.getSequence(), ex);
                                run.blocked.add(key);
                                run.failed = true;
                            }
                        })
                        .then())
                .then();
    }

    // Savepoint errors and SQL errors are recoverable; a failed rollback to the savepoint is not.
    private Mono<Void> executeIsolated(Statement statement) {
        if (statement.isNoOp()) {
            return Mono.empty();
        }
        Mono<Void> savepoint = db.inConnection(c -> Mono.from(c.createSavepoint(SAVEPOINT)))
                .onErrorMap(ex -> new StatementExecutionException(projectionName, statement, ex))
                .then();
        Mono<Void> apply = executor.execute(projectionName, statement.getOperation())
                .onErrorResume(ex -> db.inConnection(c -> Mono.from(c.rollbackTransactionToSavepoint(SAVEPOINT)))
                        .then(Mono.error(new StatementExecutionException(projectionName, statement, ex))));
        Mono<Void> release = db.inConnection(c -> Mono.from(c.releaseSavepoint(SAVEPOINT))).then();

        return savepoint.then(apply).then(release);
    }
}
