package com.github.dimitryivaniuta.iam.common.context;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CallContextTest {

    @Test
    void explicitInstancesWin() {
        StepVerifier.create(CallContext.resolveInstances(List.of("a", "b"))
                        .contextWrite(CallContext.forInstance("ctx").asContext()))
                .expectNext(List.of("a", "b"))
                .verifyComplete();
    }

    @Test
    void fallsBackToInstanceOfCall() {
        StepVerifier.create(CallContext.resolveInstances(List.of())
                        .contextWrite(CallContext.forInstance("ctx").asContext()))
                .expectNext(List.of("ctx"))
                .verifyComplete();
    }

    @Test
    void failsWithoutAnyInstance() {
        StepVerifier.create(CallContext.resolveInstances(null))
                .expectError(IllegalStateException.class)
                .verify();
    }

    @Test
    void resetClearsReadTimestampOfCurrentCall() {
        CallContext call = CallContext.forInstance("i1", OffsetDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC));
        assertThat(call.readTimestamp()).isPresent();

        StepVerifier.create(CallContext.resetCurrentReadTimestamp().contextWrite(call.asContext()))
                .verifyComplete();

        assertThat(call.readTimestamp()).isEmpty();
    }

    @Test
    void currentIsEmptyOutsideCall() {
        StepVerifier.create(CallContext.current().then(Mono.just("done")))
                .expectNext("done")
                .verifyComplete();
    }
}
