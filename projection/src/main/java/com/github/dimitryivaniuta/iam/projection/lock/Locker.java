package com.github.dimitryivaniuta.iam.projection.lock;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Distributed mutex of one projection, keyed by instance ids.
 */
public interface Locker {

    /**
     * Locks all {@code instanceIds} for {@code ttl}, or none of them.
     * Errors with {@link LockException} if any key is held by someone else.
     */
    Mono<LockSession> lock(Duration ttl, List<String> instanceIds);

    /** Idempotent and best effort; failures are logged, the lock expires anyway. */
    Mono<Void> unlock(List<String> instanceIds);
}
