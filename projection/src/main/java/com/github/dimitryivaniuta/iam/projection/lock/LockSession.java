package com.github.dimitryivaniuta.iam.projection.lock;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * A successfully acquired lock.
 */
public interface LockSession {

    List<String> keys();

    /** Emits once if the lock is lost involuntarily; never completes otherwise. */
    Mono<LockLostException> lost();

    /** Stops renewal and unlocks the keys. */
    Mono<Void> release();
}
