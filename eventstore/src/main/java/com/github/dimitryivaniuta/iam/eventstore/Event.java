package com.github.dimitryivaniuta.iam.eventstore;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Immutable, sequenced event as read from the event store.
 *
 * <p>{@code sequence} increases strictly per (aggregate type, instance);
 * {@code previousAggregateTypeSequence} is the sequence of the preceding event of the
 * same aggregate type within the same instance, 0 for the first one.
 */
public record Event(
        String aggregateType,
        String aggregateId,
        String instanceId,
        String resourceOwner,
        String eventType,
        long sequence,
        long previousAggregateTypeSequence,
        OffsetDateTime creationDate,
        String payload
) {

    public Event {
        Objects.requireNonNull(aggregateType, "aggregateType");
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(eventType, "eventType");
        instanceId = instanceId == null ? "" : instanceId;
        payload = payload == null || payload.isBlank() ? "{}" : payload;
    }

    /** Event to be appended; the store assigns sequence, previous sequence and creation date. */
    public static Event draft(String aggregateType, String aggregateId, String instanceId,
                              String eventType, String payload) {
        return new Event(aggregateType, aggregateId, instanceId, instanceId, eventType, 0, 0, null, payload);
    }
}
