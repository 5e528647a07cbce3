package com.github.dimitryivaniuta.iam.eventstore;

/**
 * Receiver of freshly appended events, e.g. the real-time queue of a projection.
 */
public interface EventSubscriber {

    String subscriberName();

    /** Non-blocking hand-over; {@code false} when the event could not be queued. */
    boolean offer(Event event);
}
