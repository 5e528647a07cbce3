package com.github.dimitryivaniuta.iam.eventstore;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * In-process fan-out of appended events to the subscribers of their aggregate type.
 * Delivery is best effort: a subscriber that cannot take an event misses it and catches
 * up through its scheduled sweep.
 */
@Slf4j
public class EventSubscriptions {

    private final Map<String, Set<EventSubscriber>> byAggregateType = new ConcurrentHashMap<>();

    public void subscribe(EventSubscriber subscriber, Collection<String> aggregateTypes) {
        for (String aggregateType : aggregateTypes) {
            byAggregateType.computeIfAbsent(aggregateType, k -> new CopyOnWriteArraySet<>()).add(subscriber);
        }
        log.debug("Subscribed {} to aggregateTypes={}", subscriber.subscriberName(), aggregateTypes);
    }

    public void unsubscribe(EventSubscriber subscriber) {
        byAggregateType.values().forEach(subscribers -> subscribers.remove(subscriber));
    }

    public void publish(List<Event> events) {
        for (Event event : events) {
            Set<EventSubscriber> subscribers = byAggregateType.get(event.aggregateType());
            if (subscribers == null) continue;
            for (EventSubscriber subscriber : subscribers) {
                if (!subscriber.offer(event)) {
                    log.warn("Event not queued (subscriber busy); subscriber={} aggregateType={} instance={} sequence={}",
                            subscriber.subscriberName(), event.aggregateType(), event.instanceId(), event.sequence());
                }
            }
        }
    }
}
