package com.github.dimitryivaniuta.iam.projectionservice.ingest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.iam.eventstore.Event;

import java.time.OffsetDateTime;

/**
 * Wire form of an appended event on {@code kafka.topics.events.iam}.
 *
 * <pre>
 * {"aggregateType":"org","aggregateId":"o1","instanceId":"i1","resourceOwner":"o1",
 *  "eventType":"org.added","sequence":5,"previousAggregateTypeSequence":4,
 *  "creationDate":"2024-06-01T10:00:00Z","payload":{"name":"ACME"}}
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventMessage(
        String aggregateType,
        String aggregateId,
        String instanceId,
        String resourceOwner,
        String eventType,
        long sequence,
        long previousAggregateTypeSequence,
        OffsetDateTime creationDate,
        JsonNode payload
) {

    /** The payload may come as a JSON object or as a string holding one. */
    public Event toEvent() {
        String data = payload == null || payload.isNull()
                ? null
                : payload.isTextual() ? payload.asText() : payload.toString();
        return new Event(aggregateType, aggregateId, instanceId,
                resourceOwner == null ? instanceId : resourceOwner,
                eventType, sequence, previousAggregateTypeSequence, creationDate, data);
    }
}
