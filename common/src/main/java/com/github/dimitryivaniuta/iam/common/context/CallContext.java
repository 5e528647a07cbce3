package com.github.dimitryivaniuta.iam.common.context;

import reactor.core.publisher.Mono;
import reactor.util.context.Context;
import reactor.util.context.ContextView;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-call state carried in the Reactor {@link Context}: the tenant (instance) the call
 * runs for and an optional "as of" read timestamp bounding event reads.
 *
 * <pre>
 * handler.trigger()
 *        .contextWrite(CallContext.forInstance("instance-1").asContext());
 * </pre>
 */
public final class CallContext {

    public static final String KEY = CallContext.class.getName();

    private final String instanceId;
    private final AtomicReference<OffsetDateTime> readTimestamp;

    private CallContext(String instanceId, OffsetDateTime readTimestamp) {
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
        this.readTimestamp = new AtomicReference<>(readTimestamp);
    }

    public static CallContext forInstance(String instanceId) {
        return new CallContext(instanceId, null);
    }

    public static CallContext forInstance(String instanceId, OffsetDateTime readTimestamp) {
        return new CallContext(instanceId, readTimestamp);
    }

    public String instanceId() {
        return instanceId;
    }

    public Optional<OffsetDateTime> readTimestamp() {
        return Optional.ofNullable(readTimestamp.get());
    }

    /** Drops the read bound so subsequent reads observe the latest committed events. */
    public void resetReadTimestamp() {
        readTimestamp.set(null);
    }

    public Context asContext() {
        return Context.of(KEY, this);
    }

    public static Optional<CallContext> from(ContextView ctx) {
        return ctx.getOrEmpty(KEY);
    }

    public static Mono<CallContext> current() {
        return Mono.deferContextual(ctx -> Mono.justOrEmpty(from(ctx)));
    }

    /**
     * Returns {@code explicit} when not empty, otherwise the instance of the current call.
     * Fails with {@link IllegalStateException} when neither is available.
     */
    public static Mono<List<String>> resolveInstances(List<String> explicit) {
        if (explicit != null && !explicit.isEmpty()) {
            return Mono.just(List.copyOf(explicit));
        }
        return current()
                .map(c -> List.of(c.instanceId()))
                .switchIfEmpty(Mono.error(() ->
                        new IllegalStateException("No instance given and none present in call context")));
    }

    /** Resets the read bound of the current call, if any. */
    public static Mono<Void> resetCurrentReadTimestamp() {
        return current().doOnNext(CallContext::resetReadTimestamp).then();
    }

    @Override
    public String toString() {
        return "CallContext{instanceId=" + instanceId + ", readTimestamp=" + readTimestamp.get() + '}';
    }
}
