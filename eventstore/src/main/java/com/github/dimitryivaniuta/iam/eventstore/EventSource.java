package com.github.dimitryivaniuta.iam.eventstore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read/append access to the event log as consumed by the projections.
 */
public interface EventSource {

    /** Events matching the query; events of one aggregate type and instance come in ascending sequence order. */
    Flux<Event> filter(SearchQuery query);

    /** Appends the event and returns it with its assigned sequence and creation date. */
    Mono<Event> push(Event event);

    /** Distinct instance ids having events that match the query. */
    Flux<String> instanceIds(SearchQuery query);
}
