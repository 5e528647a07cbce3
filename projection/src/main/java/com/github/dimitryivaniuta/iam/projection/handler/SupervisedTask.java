package com.github.dimitryivaniuta.iam.projection.handler;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Owns a long-running loop. An error ending the loop is logged with its stack trace and the
 * loop is resubscribed according to the {@link RestartPolicy}; once restarts are used up the
 * task stays down.
 */
@Slf4j
public class SupervisedTask {

    private final String name;
    private final Supplier<Mono<Void>> loop;
    private final RestartPolicy policy;

    private volatile Disposable subscription;

    public SupervisedTask(String name, Supplier<Mono<Void>> loop, RestartPolicy policy) {
        this.name = requireNonNull(name, "name");
        this.loop = requireNonNull(loop, "loop");
        this.policy = requireNonNull(policy, "policy");
    }

    /** The supervised loop: terminates with the last error once no restart is left. */
    public Mono<Void> supervised() {
        return Mono.defer(loop)
                .doOnError(ex -> log.error("Task terminated: task={}", name, ex))
                .retryWhen(Retry.fixedDelay(policy.maxRestarts(), policy.backoff())
                        .doBeforeRetry(signal -> log.warn("Restarting task: task={} restart={} of {}",
                                name, signal.totalRetries() + 1, policy.maxRestarts()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    public void start() {
        stop();
        subscription = supervised().subscribe(
                null,
                ex -> log.error("Task stopped for good: task={} cause={}", name, ex.toString()),
                () -> log.info("Task completed: task={}", name));
        log.info("Task started: task={} policy={}", name, policy);
    }

    public void stop() {
        Disposable s = subscription;
        if (s != null && !s.isDisposed()) {
            s.dispose();
            log.info("Task stopped: task={}", name);
        }
    }

    public boolean isRunning() {
        Disposable s = subscription;
        return s != null && !s.isDisposed();
    }
}
