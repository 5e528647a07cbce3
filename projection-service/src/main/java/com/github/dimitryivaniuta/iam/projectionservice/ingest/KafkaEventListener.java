package com.github.dimitryivaniuta.iam.projectionservice.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.iam.eventstore.Event;
import com.github.dimitryivaniuta.iam.eventstore.EventSubscriptions;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.kafka.receiver.KafkaReceiver;

import java.util.List;

/**
 * Feeds events appended by other nodes into the local real-time queues.
 * Unreadable records are logged and acknowledged; the scheduled sweep still picks up
 * anything missed here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "kafka", name = "enabled", havingValue = "true", matchIfMissing = true)
public class KafkaEventListener {

    private final KafkaReceiver<String, byte[]> receiver;
    private final ObjectMapper om;
    private final EventSubscriptions subscriptions;

    private volatile Disposable running;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (running != null && !running.isDisposed()) return;
        running = receiver.receive()
                .concatMap(rr -> read(rr.value())
                        .doOnNext(event -> subscriptions.publish(List.of(event)))
                        .doFinally(s -> rr.receiverOffset().acknowledge()))
                .subscribe(
                        e -> { },
                        ex -> log.error("Kafka event listener stopped", ex));
        log.info("Kafka event listener started");
    }

    @PreDestroy
    public void stop() {
        Disposable r = running;
        if (r != null) r.dispose();
    }

    Mono<Event> read(byte[] value) {
        return Mono.fromCallable(() -> om.readValue(value, EventMessage.class).toEvent())
                .onErrorResume(ex -> {
                    log.warn("Skipping unreadable event record", ex);
                    return Mono.empty();
                });
    }
}
