package com.github.dimitryivaniuta.iam.projection.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.iam.common.context.CallContext;
import com.github.dimitryivaniuta.iam.eventstore.Event;
import com.github.dimitryivaniuta.iam.eventstore.EventSource;
import com.github.dimitryivaniuta.iam.eventstore.EventSubscriber;
import com.github.dimitryivaniuta.iam.eventstore.SearchQuery;
import com.github.dimitryivaniuta.iam.projection.config.ProjectionConfig;
import com.github.dimitryivaniuta.iam.projection.lock.LockException;
import com.github.dimitryivaniuta.iam.projection.lock.LockSession;
import com.github.dimitryivaniuta.iam.projection.lock.Locker;
import com.github.dimitryivaniuta.iam.projection.statement.Statement;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * Keeps one projection up to date.
 *
 * <p>Events come in on two paths:
 * <ul>
 *   <li>the subscription loop takes freshly pushed events from a local queue and processes
 *       whatever is queued as one batch; it takes no lock and relies on the sequence check;</li>
 *   <li>the scheduler loop sweeps instances every {@code requeueEvery}, in batches of
 *       {@code concurrentInstances}, each batch under a distributed lock.</li>
 * </ul>
 * Until the first complete sweep of all instances succeeded (recorded as a
 * {@value #SCHEDULER_SUCCEEDED} event) only one node sweeps, guarded by the
 * {@value #SYSTEM_LOCK} lock. Afterwards a sweep only covers instances with events in the last
 * {@code handleActiveInstances}, or all of them when that window is zero.
 *
 * <p>A handler built with {@code reduceScheduledEvent} does not read the event store when
 * triggered: it reduces a single {@value #SCHEDULED_EVENT} event carrying the instance ids of the
 * batch, timestamped with the current time, and never subscribes.
 */
@Slf4j
public class ProjectionHandler implements EventSubscriber {

    public static final String SCHEDULER_SUCCEEDED = "system.projections.scheduler.succeeded";
    public static final String SYSTEM_AGGREGATE_TYPE = "system";
    public static final String SYSTEM_AGGREGATE_ID = "SYSTEM";
    public static final String SYSTEM_LOCK = "system";
    public static final String SCHEDULED_AGGREGATE_TYPE = "pseudo";
    public static final String SCHEDULED_EVENT = "pseudo.scheduled";

    private static final Duration QUEUE_POLL = Duration.ofSeconds(1);

    private final ProjectionConfig config;
    private final Reducers reducers;
    private final StatementHandler statements;
    private final EventSource eventSource;
    private final Locker locker;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean subscribe;
    private final boolean reduceScheduledEvent;
    private final BlockingQueue<Event> queue;

    private final SupervisedTask subscription;
    private final SupervisedTask scheduler;

    private volatile boolean succeededOnce;

    public ProjectionHandler(ProjectionConfig config,
                             Reducers reducers,
                             StatementHandler statements,
                             EventSource eventSource,
                             Locker locker,
                             ObjectMapper objectMapper,
                             Clock clock,
                             boolean subscribe) {
        this(config, reducers, statements, eventSource, locker, objectMapper, clock, subscribe, false);
    }

    public ProjectionHandler(ProjectionConfig config,
                             Reducers reducers,
                             StatementHandler statements,
                             EventSource eventSource,
                             Locker locker,
                             ObjectMapper objectMapper,
                             Clock clock,
                             boolean subscribe,
                             boolean reduceScheduledEvent) {
        this.config = requireNonNull(config, "config");
        this.reducers = requireNonNull(reducers, "reducers");
        this.statements = requireNonNull(statements, "statements");
        this.eventSource = requireNonNull(eventSource, "eventSource");
        this.locker = requireNonNull(locker, "locker");
        this.objectMapper = requireNonNull(objectMapper, "objectMapper");
        this.clock = requireNonNull(clock, "clock");
        this.subscribe = subscribe && !reduceScheduledEvent;
        this.reduceScheduledEvent = reduceScheduledEvent;
        this.queue = new LinkedBlockingQueue<>(config.getQueueSize());
        this.subscription = new SupervisedTask(config.getProjectionName() + "-subscription",
                this::subscriptionLoop, config.getSubscriptionRestart());
        this.scheduler = new SupervisedTask(config.getProjectionName() + "-scheduler",
                this::schedulerLoop, config.getSubscriptionRestart());
    }

    public String projectionName() {
        return config.getProjectionName();
    }

    public boolean subscribes() {
        return subscribe;
    }

    public void start() {
        log.info("Projection starting: projection={} subscribe={} scheduledEvent={} requeueEvery={} bulkLimit={} concurrentInstances={}",
                projectionName(), subscribe, reduceScheduledEvent, config.getRequeueEvery(), config.getBulkLimit(), config.getConcurrentInstances());
        if (subscribe) {
            subscription.start();
        }
        scheduler.start();
    }

    public void stop() {
        subscription.stop();
        scheduler.stop();
        queue.clear();
    }

    // ---------------------------------------------------------------- trigger

    /**
     * Brings the projection up to date for the given instances, or the instance of the current
     * {@link CallContext} if none are given. Errors are logged, never emitted.
     */
    public Mono<Void> trigger(String... instanceIds) {
        List<String> ids = Arrays.asList(instanceIds);
        return triggerErr(ids)
                .onErrorResume(ex -> {
                    log.error("Trigger failed: projection={} instanceIds={}", projectionName(), ids, ex);
                    return Mono.empty();
                });
    }

    public Mono<Void> triggerErr(String... instanceIds) {
        return triggerErr(Arrays.asList(instanceIds));
    }

    /** Like {@link #trigger(String...)} but emits the first error. */
    public Mono<Void> triggerErr(List<String> instanceIds) {
        return CallContext.resolveInstances(instanceIds)
                .flatMap(ids -> reduceScheduledEvent ? reduceScheduled(ids) : drain(ids));
    }

    private Mono<Void> reduceScheduled(List<String> instanceIds) {
        return Mono.fromCallable(() -> scheduledEvent(instanceIds))
                .flatMap(event -> process(List.of(event)))
                .then(CallContext.resetCurrentReadTimestamp());
    }

    // The millisecond timestamp doubles as sequence, so every run advances the pair.
    private Event scheduledEvent(List<String> instanceIds) throws JsonProcessingException {
        OffsetDateTime now = OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
        return new Event(SCHEDULED_AGGREGATE_TYPE, SYSTEM_AGGREGATE_ID, "", "", SCHEDULED_EVENT,
                clock.millis(), 0, now, objectMapper.writeValueAsString(Map.of("instanceIds", instanceIds)));
    }

    // Fetch, process and repeat while the fetched batch was full.
    private Mono<Void> drain(List<String> instanceIds) {
        return statements.searchQuery(instanceIds)
                .flatMap(query -> eventSource.filter(query).collectList())
                .flatMap(events -> {
                    if (events.isEmpty()) {
                        return Mono.empty();
                    }
                    Mono<Void> processed = process(events).then(CallContext.resetCurrentReadTimestamp());
                    return events.size() >= config.getBulkLimit()
                            ? processed.then(Mono.defer(() -> drain(instanceIds)))
                            : processed;
                });
    }

    // ---------------------------------------------------------------- process

    /**
     * Reduces all events, then applies them. A partial failure is retried from the first
     * statement not applied, at most {@code retries} times, {@code retryFailedAfter} apart.
     *
     * @return index of the last applied event, {@code -1} for no events
     */
    public Mono<Integer> process(List<Event> events) {
        if (events.isEmpty()) {
            return Mono.just(-1);
        }
        return Mono.fromCallable(() -> reduceAll(events))
                .flatMap(reduced -> apply(reduced, 0, 0));
    }

    private List<Statement> reduceAll(List<Event> events) {
        List<Statement> reduced = new ArrayList<>(events.size());
        for (Event event : events) {
            reduced.add(reducers.reduce(event));
        }
        return reduced;
    }

    private Mono<Integer> apply(List<Statement> reduced, int offset, int attempt) {
        return statements.update(reduced.subList(offset, reduced.size()), reducers)
                .map(index -> offset + index)
                .onErrorResume(StatementsFailedException.class, ex -> {
                    int lastApplied = offset + ex.getLastAppliedIndex();
                    if (attempt >= config.getRetries()) {
                        return Mono.error(new StatementsFailedException(projectionName(), lastApplied));
                    }
                    log.debug("Retrying failed statements: projection={} from={} attempt={} of {}",
                            projectionName(), lastApplied + 1, attempt + 1, config.getRetries());
                    return Mono.delay(config.getRetryFailedAfter())
                            .then(Mono.defer(() -> apply(reduced, lastApplied + 1, attempt + 1)));
                });
    }

    // ---------------------------------------------------------------- subscription

    @Override
    public String subscriberName() {
        return projectionName();
    }

    @Override
    public boolean offer(Event event) {
        return queue.offer(event);
    }

    Mono<Void> subscriptionLoop() {
        return Mono.fromCallable(() -> Optional.ofNullable(queue.poll(QUEUE_POLL.toMillis(), TimeUnit.MILLISECONDS)))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(first -> first.map(this::processQueued).orElse(Mono.empty()))
                .repeat()
                .then();
    }

    private Mono<Void> processQueued(Event first) {
        List<Event> events = new ArrayList<>();
        events.add(first);
        queue.drainTo(events);
        return process(events)
                .doOnNext(index -> {
                    if (index < events.size() - 1) {
                        log.warn("Unable to process all events from subscription: projection={} processed={} of {}",
                                projectionName(), index + 1, events.size());
                    }
                })
                .onErrorResume(ex -> {
                    log.warn("Unable to process all events from subscription: projection={} events={}",
                            projectionName(), events.size(), ex);
                    return Mono.empty();
                })
                .then();
    }

    // ---------------------------------------------------------------- scheduler

    Mono<Void> schedulerLoop() {
        // One tick -> delay -> repeat; the first tick runs immediately.
        return Mono.defer(this::tickSafe)
                .repeatWhen(r -> r.delayElements(config.getRequeueEvery()))
                .then();
    }

    private Mono<Void> tickSafe() {
        return tick()
                .onErrorResume(ex -> {
                    log.error("Projection schedule failed (will retry next tick): projection={}", projectionName(), ex);
                    return Mono.empty();
                });
    }

    Mono<Void> tick() {
        Mono<Boolean> once = succeededOnce
                ? Mono.just(true)
                : hasSucceededOnce().doOnNext(v -> succeededOnce = v);
        return once.flatMap(ok -> ok ? sweep(activeInstancesQuery()).then() : firstSweep());
    }

    boolean succeededOnce() {
        return succeededOnce;
    }

    private Mono<Void> firstSweep() {
        return Mono.usingWhen(
                        locker.lock(config.getLockDuration(), List.of(SYSTEM_LOCK)),
                        session -> guarded(session, sweep(allInstancesQuery())),
                        LockSession::release)
                .flatMap(failed -> failed ? Mono.<Void>empty() : markSucceeded())
                .onErrorResume(LockException.class, ex -> {
                    log.debug("Initial lock failed for first schedule: projection={}", projectionName(), ex);
                    return Mono.empty();
                });
    }

    /** Sweeps the instances found by {@code query}; emits whether any batch failed. */
    private Mono<Boolean> sweep(SearchQuery query) {
        return eventSource.instanceIds(query)
                .collectList()
                .flatMapMany(ids -> Flux.fromIterable(partition(ids, config.getConcurrentInstances())))
                .flatMap(this::processBatch, config.getBatchConcurrency())
                .reduce(false, (a, b) -> a || b);
    }

    private Mono<Boolean> processBatch(List<String> instanceIds) {
        return Mono.usingWhen(
                        locker.lock(config.getLockDuration(), instanceIds),
                        session -> guarded(session, triggerErr(instanceIds).thenReturn(false)),
                        LockSession::release)
                .onErrorResume(LockException.class, ex -> {
                    log.debug("Initial lock failed: projection={} instanceIds={}", projectionName(), instanceIds, ex);
                    return Mono.just(true);
                })
                .onErrorResume(ex -> {
                    log.error("Trigger failed: projection={} instanceIds={}", projectionName(), instanceIds, ex);
                    return Mono.just(true);
                });
    }

    // Cancels work as soon as the lock reports a loss.
    private <T> Mono<T> guarded(LockSession session, Mono<T> work) {
        Mono<T> lost = session.lost()
                .flatMap(ex -> {
                    log.warn("Bulk canceled: projection={} instanceIds={}", projectionName(), session.keys(), ex);
                    return Mono.<T>error(ex);
                });
        return Mono.firstWithSignal(work, lost);
    }

    private SearchQuery allInstancesQuery() {
        return SearchQuery.builder()
                .clause(SearchQuery.Clause.builder().excludedInstanceId("").build())
                .allowTimeTravel(true)
                .build();
    }

    private SearchQuery activeInstancesQuery() {
        Duration window = config.getHandleActiveInstances();
        if (window.isZero()) {
            return allInstancesQuery();
        }
        return allInstancesQuery().toBuilder()
                .creationDateAfter(OffsetDateTime.ofInstant(clock.instant().minus(window), ZoneOffset.UTC))
                .build();
    }

    private Mono<Boolean> hasSucceededOnce() {
        SearchQuery query = SearchQuery.builder()
                .clause(SearchQuery.Clause.builder()
                        .aggregateType(SYSTEM_AGGREGATE_TYPE)
                        .aggregateId(SYSTEM_AGGREGATE_ID)
                        .eventType(SCHEDULER_SUCCEEDED)
                        .eventData(Map.of("name", projectionName()))
                        .build())
                .limit(1)
                .build();
        return eventSource.filter(query).hasElements();
    }

    private Mono<Void> markSucceeded() {
        succeededOnce = true;
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(Map.of("name", projectionName())))
                .flatMap(payload -> eventSource.push(Event.draft(
                        SYSTEM_AGGREGATE_TYPE, SYSTEM_AGGREGATE_ID, "", SCHEDULER_SUCCEEDED, payload)))
                .doOnNext(e -> log.info("First schedule succeeded: projection={}", projectionName()))
                .onErrorResume(ex -> {
                    log.warn("Unable to push first schedule succeeded: projection={}", projectionName(), ex);
                    return Mono.empty();
                })
                .then();
    }

    static List<List<String>> partition(List<String> ids, int size) {
        List<List<String>> batches = new ArrayList<>();
        for (int i = 0; i < ids.size(); i += size) {
            batches.add(List.copyOf(ids.subList(i, Math.min(i + size, ids.size()))));
        }
        return batches;
    }
}
