package com.github.dimitryivaniuta.iam.projection.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * {@link Locker} on {@code projections.locks}, one row per (projection, instance id).
 *
 * <p>A row is free when {@code locked_until} is {@code NULL} or in the past. Held locks are
 * renewed every {@code ttl / 2}; a renewal that does not cover every key reports the lock lost.
 */
@Slf4j
public class R2dbcLocker implements Locker {

    private final DatabaseClient db;
    private final TransactionalOperator tx;
    private final String projectionName;
    private final String lockerId;
    private final Clock clock;

    public R2dbcLocker(DatabaseClient db, TransactionalOperator tx, String projectionName, String lockerId, Clock clock) {
        this.db = requireNonNull(db, "db");
        this.tx = requireNonNull(tx, "tx");
        this.projectionName = requireNonNull(projectionName, "projectionName");
        this.lockerId = requireNonNull(lockerId, "lockerId");
        this.clock = requireNonNull(clock, "clock");
    }

    @Override
    public Mono<LockSession> lock(Duration ttl, List<String> instanceIds) {
        requireNonNull(ttl, "ttl");
        if (instanceIds == null || instanceIds.isEmpty()) {
            return Mono.error(new IllegalArgumentException("no instance ids to lock"));
        }
        final List<String> keys = List.copyOf(new LinkedHashSet<>(instanceIds));

        return tx.transactional(acquire(ttl, keys))
                .onErrorMap(ex -> !(ex instanceof LockException),
                        ex -> new LockException("Lock failed: projection=" + projectionName + " instanceIds=" + keys, ex))
                .map(v -> {
                    Session session = new Session(keys);
                    session.startRenewal(ttl);
                    log.debug("Locked: projection={} instanceIds={} lockerId={} ttl={}", projectionName, keys, lockerId, ttl);
                    return (LockSession) session;
                });
    }

    private Mono<Boolean> acquire(Duration ttl, List<String> keys) {
        final OffsetDateTime now = now();
        final OffsetDateTime until = now.plus(ttl);

        Mono<Long> updated = db.sql("""
                        UPDATE projections.locks
                           SET locker_id    = :locker_id,
                               locked_until = :until
                         WHERE projection_name = :projection_name
                           AND instance_id IN (:instance_ids)
                           AND (locker_id = :locker_id OR locked_until IS NULL OR locked_until < :now)
                        """)
                .bind("locker_id", lockerId)
                .bind("until", until)
                .bind("projection_name", projectionName)
                .bind("instance_ids", keys)
                .bind("now", now)
                .fetch().rowsUpdated();

        Mono<Set<String>> existing = db.sql("""
                        SELECT instance_id
                          FROM projections.locks
                         WHERE projection_name = :projection_name
                           AND instance_id IN (:instance_ids)
                        """)
                .bind("projection_name", projectionName)
                .bind("instance_ids", keys)
                .map((row, md) -> row.get(0, String.class))
                .all()
                .collect(Collectors.toSet());

        return updated.flatMap(rows -> existing.flatMap(present -> Flux.fromIterable(keys)
                        .filter(key -> !present.contains(key))
                        .concatMap(key -> insert(key, until))
                        .reduce(0L, Long::sum)
                        .map(inserted -> rows + inserted)))
                .flatMap(total -> total == keys.size()
                        ? Mono.just(true)
                        : Mono.<Boolean>error(new LockException("Already locked: projection=" + projectionName
                                + " instanceIds=" + keys + " acquired=" + total)));
    }

    private Mono<Long> insert(String instanceId, OffsetDateTime until) {
        return db.sql("""
                        INSERT INTO projections.locks
                          (projection_name, instance_id, locker_id, locked_until)
                        VALUES
                          (:projection_name, :instance_id, :locker_id, :until)
                        """)
                .bind("projection_name", projectionName)
                .bind("instance_id", instanceId)
                .bind("locker_id", lockerId)
                .bind("until", until)
                .fetch().rowsUpdated();
    }

    private Mono<Long> renew(Duration ttl, List<String> keys) {
        final OffsetDateTime now = now();
        return db.sql("""
                        UPDATE projections.locks
                           SET locked_until = :until
                         WHERE projection_name = :projection_name
                           AND instance_id IN (:instance_ids)
                           AND locker_id = :locker_id
                           AND locked_until >= :now
                        """)
                .bind("until", now.plus(ttl))
                .bind("projection_name", projectionName)
                .bind("instance_ids", keys)
                .bind("locker_id", lockerId)
                .bind("now", now)
                .fetch().rowsUpdated();
    }

    @Override
    public Mono<Void> unlock(List<String> instanceIds) {
        if (instanceIds == null || instanceIds.isEmpty()) {
            return Mono.empty();
        }
        return db.sql("""
                        UPDATE projections.locks
                           SET locked_until = NULL
                         WHERE projection_name = :projection_name
                           AND instance_id IN (:instance_ids)
                           AND locker_id = :locker_id
                        """)
                .bind("projection_name", projectionName)
                .bind("instance_ids", List.copyOf(instanceIds))
                .bind("locker_id", lockerId)
                .fetch().rowsUpdated()
                .doOnNext(rows -> log.debug("Unlocked: projection={} instanceIds={} rows={}", projectionName, instanceIds, rows))
                .onErrorResume(ex -> {
                    log.warn("Unable to unlock: projection={} instanceIds={}", projectionName, instanceIds, ex);
                    return Mono.empty();
                })
                .then();
    }

    private OffsetDateTime now() {
        return OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    private final class Session implements LockSession {
        private final List<String> keys;
        private final Sinks.One<LockLostException> lost = Sinks.one();
        private volatile Disposable renewal;

        Session(List<String> keys) {
            this.keys = keys;
        }

        void startRenewal(Duration ttl) {
            Duration every = ttl.dividedBy(2);
            renewal = Flux.interval(every, every)
                    .concatMap(tick -> renew(ttl, keys)
                            .flatMap(rows -> rows == keys.size()
                                    ? Mono.<Long>empty()
                                    : Mono.<Long>error(new LockLostException("Lock taken over: projection="
                                            + projectionName + " instanceIds=" + keys))))
                    .subscribe(null, ex -> {
                        LockLostException lostEx = ex instanceof LockLostException l
                                ? l
                                : new LockLostException("Lock renewal failed: projection=" + projectionName
                                        + " instanceIds=" + keys, ex);
                        log.warn("Lock lost: projection={} instanceIds={}", projectionName, keys, lostEx);
                        lost.tryEmitValue(lostEx);
                    });
        }

        @Override
        public List<String> keys() {
            return keys;
        }

        @Override
        public Mono<LockLostException> lost() {
            return lost.asMono();
        }

        @Override
        public Mono<Void> release() {
            return Mono.defer(() -> {
                Disposable r = renewal;
                if (r != null) {
                    r.dispose();
                }
                return unlock(keys);
            });
        }
    }
}
