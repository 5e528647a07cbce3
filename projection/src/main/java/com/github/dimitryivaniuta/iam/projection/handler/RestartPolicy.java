package com.github.dimitryivaniuta.iam.projection.handler;

import java.time.Duration;
import java.util.Objects;

/**
 * How often a {@link SupervisedTask} is restarted after it terminated with an error,
 * and how long to wait between restarts.
 */
public record RestartPolicy(long maxRestarts, Duration backoff) {

    public RestartPolicy {
        if (maxRestarts < 0) {
            throw new IllegalArgumentException("maxRestarts must be >= 0");
        }
        Objects.requireNonNull(backoff, "backoff");
    }

    /** Terminate on the first error. */
    public static RestartPolicy never() {
        return new RestartPolicy(0, Duration.ZERO);
    }
}
