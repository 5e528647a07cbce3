package com.github.dimitryivaniuta.iam.projectionservice.projections;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.iam.eventstore.Event;
import com.github.dimitryivaniuta.iam.projection.handler.ReductionException;

/**
 * Reads event payloads for reducers; unreadable payloads fail the reduction.
 */
final class Payloads {

    private final ObjectMapper objectMapper;

    Payloads(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    <T> T read(Event event, Class<T> type) {
        try {
            return objectMapper.readValue(event.payload(), type);
        } catch (JsonProcessingException e) {
            throw new ReductionException(event, e);
        }
    }
}
